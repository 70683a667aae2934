package com.gamebook.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamebook.AppLogger;
import com.gamebook.models.StoryNode;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads and writes the story store: a pretty-printed JSON array of nodes, overwritten whole.
 */
public class StoryStore {

    static final String NO_CHANGES_LINE = "No broken links found.";

    private final ObjectMapper mapper;
    private final AppLogger logger = AppLogger.get();

    public StoryStore(ObjectMapper mapper) {
        this.mapper = mapper != null ? mapper : new ObjectMapper();
    }

    /**
     * Load every node of the store. Array elements that are not node objects are skipped with a warning.
     *
     * @throws FileNotFoundException when the store does not exist
     * @throws StoryStoreException when the file is not a JSON array
     */
    public List<StoryNode> read(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            throw new FileNotFoundException("Story file not found: " + path);
        }

        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (JsonProcessingException e) {
            throw new StoryStoreException("Invalid JSON in " + path + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new StoryStoreException("Story root must be a JSON array: " + path);
        }

        List<StoryNode> nodes = new ArrayList<>();
        int index = 0;
        for (JsonNode element : root) {
            index++;
            if (!element.isObject()) {
                logWarn("Skipping element " + index + " of " + path + ": not an object");
                continue;
            }
            StoryNode node;
            try {
                node = mapper.treeToValue(element, StoryNode.class);
            } catch (JsonProcessingException e) {
                logWarn("Skipping element " + index + " of " + path + ": " + e.getOriginalMessage());
                continue;
            }
            if (node.getSectionNumber() <= 0) {
                Integer fromId = StoryNode.parseSectionId(node.getId());
                if (fromId != null) {
                    node.setSectionNumber(fromId);
                }
            }
            nodes.add(node);
        }
        log("Loaded " + nodes.size() + " nodes from " + path);
        return nodes;
    }

    /**
     * Same as {@link #read(Path)} but an absent store yields an empty list.
     */
    public List<StoryNode> readIfExists(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            return Collections.emptyList();
        }
        return read(path);
    }

    public String toJson(List<StoryNode> nodes) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(nodes);
    }

    public void write(Path path, List<StoryNode> nodes) throws IOException {
        createParent(path);
        Files.writeString(path, toJson(nodes) + "\n", StandardCharsets.UTF_8);
        log("Wrote " + nodes.size() + " nodes to " + path);
    }

    /**
     * One line per change, or a single "no changes" line.
     */
    public void writeChangeLog(Path path, List<String> lines) throws IOException {
        createParent(path);
        String body = lines == null || lines.isEmpty() ? NO_CHANGES_LINE : String.join("\n", lines);
        Files.writeString(path, body + "\n", StandardCharsets.UTF_8);
        log("Wrote change log to " + path);
    }

    private void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[StoryStore] " + message);
        }
    }

    private void logWarn(String message) {
        if (logger != null) {
            logger.warn("[StoryStore] " + message);
        }
    }
}
