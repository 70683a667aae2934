package com.gamebook.controllers;

import com.gamebook.lint.GraphSummary;
import com.gamebook.models.StoryChoice;
import com.gamebook.models.StoryNode;
import com.gamebook.pipeline.StoryGraph;
import com.gamebook.runtime.StoryEngine;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only routes over a loaded story.
 */
public class StoryController implements Controller {
    private final StoryEngine engine;

    public StoryController(StoryEngine engine) {
        this.engine = engine;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/story/entry", this::getEntry);
        app.get("/api/story/nodes/{id}", this::getNode);
        app.get("/api/story/nodes/{id}/choices", this::getChoices);
        app.get("/api/story/summary", this::getSummary);
    }

    private void getEntry(Context ctx) {
        try {
            ctx.json(engine.getEntryNode());
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getNode(Context ctx) {
        String id = ctx.pathParam("id");
        try {
            Optional<StoryNode> node = engine.getNode(id);
            if (node.isEmpty()) {
                ctx.status(404).json(Map.of("error", "Node not found: " + id));
                return;
            }
            ctx.json(node.get());
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getChoices(Context ctx) {
        String id = ctx.pathParam("id");
        try {
            Optional<StoryNode> node = engine.getNode(id);
            if (node.isEmpty()) {
                ctx.status(404).json(Map.of("error", "Node not found: " + id));
                return;
            }
            boolean includeLocked = "true".equalsIgnoreCase(ctx.queryParam("includeLocked"));
            List<StoryChoice> choices = engine.getAvailableChoices(node.get(), statsFrom(ctx), includeLocked);
            ctx.json(choices);
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getSummary(Context ctx) {
        try {
            ctx.json(GraphSummary.of(engine.getNodes(), StoryGraph.DEFAULT_ENTRY_SECTION));
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    // Query parameters become stats; integer-looking values are compared as numbers.
    private Map<String, Object> statsFrom(Context ctx) {
        Map<String, Object> stats = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : ctx.queryParamMap().entrySet()) {
            if ("includeLocked".equals(entry.getKey()) || entry.getValue().isEmpty()) {
                continue;
            }
            String raw = entry.getValue().get(0);
            Object value = raw;
            if (raw != null && raw.trim().matches("-?\\d{1,9}")) {
                value = Integer.parseInt(raw.trim());
            } else if ("true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw)) {
                value = Boolean.parseBoolean(raw);
            }
            stats.put(entry.getKey(), value);
        }
        return stats;
    }
}
