package com.gamebook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamebook.PipelineConfigStore.PipelineConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigStoreTest {

    @TempDir
    Path tempDir;

    private final PipelineConfigStore store = new PipelineConfigStore(new ObjectMapper());

    @Test
    void missingFileYieldsDefaults() {
        PipelineConfig config = store.loadOrDefault(tempDir.resolve("pipeline.json"));

        assertEquals(PipelineConfig.DEFAULT_MAX_NODES, config.getMaxNodes());
        assertEquals(PipelineConfig.DEFAULT_PAGE_OFFSET, config.getPageOffset());
        assertEquals(PipelineConfig.DEFAULT_MIN_REACHABLE_RATIO, config.getMinReachableRatio(), 1e-9);
        assertEquals(PipelineConfig.DEFAULT_MAX_NOISE_RATIO, config.getMaxNoiseRatio(), 1e-9);
        assertEquals(PipelineConfig.DEFAULT_MAX_NODES, store.loadOrDefault(null).getMaxNodes());
    }

    @Test
    void partialFileMergesOverDefaults() throws Exception {
        Path path = tempDir.resolve("pipeline.json");
        Files.writeString(path, "{\"maxNodes\": 40, \"pageOffset\": 0, \"someFutureKey\": true}",
            StandardCharsets.UTF_8);

        PipelineConfig config = store.loadOrDefault(path);

        assertEquals(40, config.getMaxNodes());
        assertEquals(0, config.getPageOffset());
        assertEquals(PipelineConfig.DEFAULT_CONTINUATION_PAGES, config.getContinuationPages());
        assertEquals(PipelineConfig.DEFAULT_ENTRY_SECTION, config.getEntrySection());
    }

    @Test
    void unreadableFileYieldsDefaults() throws Exception {
        Path path = tempDir.resolve("pipeline.json");
        Files.writeString(path, "{ not json", StandardCharsets.UTF_8);

        assertEquals(PipelineConfig.DEFAULT_MAX_NODES, store.loadOrDefault(path).getMaxNodes());
    }
}
