package com.gamebook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads pipeline tuning values from an optional JSON file, merged over the built-in defaults.
 */
public class PipelineConfigStore {

    private final ObjectMapper mapper;
    private final AppLogger logger = AppLogger.get();

    public PipelineConfigStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public PipelineConfig loadOrDefault(Path path) {
        PipelineConfig defaults = new PipelineConfig();
        if (path == null) {
            return defaults;
        }
        if (!Files.exists(path)) {
            logWarn("Config file not found, using defaults: " + path);
            return defaults;
        }

        try {
            PipelineConfig stored = mapper.readValue(path.toFile(), PipelineConfig.class);
            PipelineConfig merged = merge(defaults, stored);
            log("Loaded pipeline config from " + path);
            return merged;
        } catch (IOException e) {
            logWarn("Failed to load pipeline config, using defaults: " + e.getMessage());
            return defaults;
        }
    }

    private PipelineConfig merge(PipelineConfig base, PipelineConfig stored) {
        if (stored == null) {
            return base;
        }
        PipelineConfig result = new PipelineConfig();
        result.setMaxNodes(stored.getMaxNodes() > 0 ? stored.getMaxNodes() : base.getMaxNodes());
        result.setContinuationPages(stored.getContinuationPages() >= 0
            ? stored.getContinuationPages() : base.getContinuationPages());
        result.setPageOffset(stored.getPageOffset() != null ? stored.getPageOffset() : base.getPageOffset());
        result.setEntrySection(stored.getEntrySection() > 0 ? stored.getEntrySection() : base.getEntrySection());
        result.setMinReachableRatio(stored.getMinReachableRatio() > 0
            ? stored.getMinReachableRatio() : base.getMinReachableRatio());
        result.setMaxNoiseRatio(stored.getMaxNoiseRatio() > 0 ? stored.getMaxNoiseRatio() : base.getMaxNoiseRatio());
        return result;
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[PipelineConfigStore] " + message);
        }
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[PipelineConfigStore] " + message);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PipelineConfig {
        public static final int DEFAULT_MAX_NODES = 200;
        public static final int DEFAULT_CONTINUATION_PAGES = 2;
        public static final int DEFAULT_PAGE_OFFSET = 10;
        public static final int DEFAULT_ENTRY_SECTION = 1;
        public static final double DEFAULT_MIN_REACHABLE_RATIO = 0.15;
        public static final double DEFAULT_MAX_NOISE_RATIO = 0.03;

        private int maxNodes = DEFAULT_MAX_NODES;
        private int continuationPages = DEFAULT_CONTINUATION_PAGES;
        private Integer pageOffset = DEFAULT_PAGE_OFFSET;
        private int entrySection = DEFAULT_ENTRY_SECTION;
        private double minReachableRatio = DEFAULT_MIN_REACHABLE_RATIO;
        private double maxNoiseRatio = DEFAULT_MAX_NOISE_RATIO;

        public int getMaxNodes() {
            return maxNodes;
        }

        public void setMaxNodes(int maxNodes) {
            this.maxNodes = maxNodes;
        }

        public int getContinuationPages() {
            return continuationPages;
        }

        public void setContinuationPages(int continuationPages) {
            this.continuationPages = continuationPages;
        }

        public Integer getPageOffset() {
            return pageOffset;
        }

        public void setPageOffset(Integer pageOffset) {
            this.pageOffset = pageOffset;
        }

        public int getEntrySection() {
            return entrySection;
        }

        public void setEntrySection(int entrySection) {
            this.entrySection = entrySection;
        }

        public double getMinReachableRatio() {
            return minReachableRatio;
        }

        public void setMinReachableRatio(double minReachableRatio) {
            this.minReachableRatio = minReachableRatio;
        }

        public double getMaxNoiseRatio() {
            return maxNoiseRatio;
        }

        public void setMaxNoiseRatio(double maxNoiseRatio) {
            this.maxNoiseRatio = maxNoiseRatio;
        }
    }
}
