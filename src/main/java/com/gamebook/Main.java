package com.gamebook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamebook.PipelineConfigStore.PipelineConfig;
import com.gamebook.StoryBuildService.BuildResult;
import com.gamebook.controllers.Controller;
import com.gamebook.controllers.StoryController;
import com.gamebook.ingest.PagedTextFileSource;
import com.gamebook.lint.GraphSummary;
import com.gamebook.lint.LintReport;
import com.gamebook.lint.StoryLinter;
import com.gamebook.lint.StoryLinter.FixResult;
import com.gamebook.models.StoryNode;
import com.gamebook.runtime.StoryEngine;
import com.gamebook.storage.StoryStore;
import com.gamebook.storage.StoryStoreException;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

public class Main {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CHECK_FAILED = 1;
    public static final int EXIT_INPUT_FAILURE = 2;
    public static final int EXIT_USAGE = 64;

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;
    private static Javalin server;

    public static void main(String[] args) {
        int code = run(args);
        // serve keeps the process alive until Ctrl+C
        if (server == null) {
            System.exit(code);
        }
    }

    /**
     * Execute one command and return its process exit code.
     */
    public static int run(String[] args) {
        AppConfig config;
        try {
            config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(AppConfig.usage());
            return EXIT_USAGE;
        }

        try {
            AppLogger.initialize(config.getLogPath(), config.isVerbose());
        } catch (IOException e) {
            System.err.println("Failed to open log file " + config.getLogPath() + ": " + e.getMessage());
            return EXIT_INPUT_FAILURE;
        }
        logger = AppLogger.get();

        PipelineConfig pipelineConfig = config.applyOverrides(
            new PipelineConfigStore(objectMapper).loadOrDefault(config.getConfigPath()));
        StoryStore store = new StoryStore(objectMapper);

        try {
            switch (config.getCommand()) {
                case BUILD:
                    return build(config, pipelineConfig, store);
                case LINT:
                    return lint(config, pipelineConfig, store);
                case SERVE:
                    return serve(config, store);
                default:
                    return EXIT_USAGE;
            }
        } catch (FileNotFoundException e) {
            logger.error(e.getMessage());
            logger.console("ERROR: " + e.getMessage());
            return EXIT_INPUT_FAILURE;
        } catch (StoryStoreException e) {
            logger.error(e.getMessage());
            logger.console("ERROR: " + e.getMessage());
            return EXIT_INPUT_FAILURE;
        } catch (IOException e) {
            logger.error("I/O failure during " + config.getCommand().name().toLowerCase(Locale.ROOT), e);
            logger.console("ERROR: " + e.getMessage());
            return EXIT_INPUT_FAILURE;
        }
    }

    private static int build(AppConfig config, PipelineConfig pipelineConfig, StoryStore store) throws IOException {
        PagedTextFileSource source = PagedTextFileSource.load(config.getPagesPath(), pipelineConfig.getPageOffset());
        StoryBuildService service = new StoryBuildService(store, pipelineConfig);
        BuildResult result = service.build(source, config.getStoryPath(), config.getReportPath(), config.getDiffPath());

        logger.console("Rebuilt story with " + result.nodes().size() + " nodes.");
        logger.console("Link changes logged: " + result.changeLog().size());
        printSummary(result.summary());
        return EXIT_OK;
    }

    private static int lint(AppConfig config, PipelineConfig pipelineConfig, StoryStore store) throws IOException {
        List<StoryNode> nodes = store.read(config.getStoryPath());
        StoryLinter linter = new StoryLinter(pipelineConfig);

        if (config.isFix()) {
            FixResult fix = linter.fixDuplicateChoices(nodes);
            if (fix.changed()) {
                store.write(config.getStoryPath(), nodes);
                logger.console("FIXED: removed " + fix.removedDuplicates() + " duplicate choices in "
                    + config.getStoryPath());
            }
        }

        LintReport report = linter.lint(nodes);
        for (String line : report.formatLines()) {
            logger.console(line);
        }
        printSummary(GraphSummary.of(nodes, pipelineConfig.getEntrySection()));
        return report.isPassed() ? EXIT_OK : EXIT_CHECK_FAILED;
    }

    private static int serve(AppConfig config, StoryStore store) throws IOException {
        StoryEngine engine = StoryEngine.load(store, config.getStoryPath());
        server = startServer(engine, config.getPort());

        logger.console("");
        logger.console("========================================");
        logger.console("  Gamebook Graph v" + VERSION);
        logger.console("========================================");
        logger.console("  Listening on http://localhost:" + server.port() + "/api/story/entry");
        logger.console("  Story: " + config.getStoryPath() + " (" + engine.getNodes().size() + " nodes)");
        logger.console("  Press Ctrl+C to stop");

        Javalin running = server;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down...");
            running.stop();
            logger.close();
        }));
        return EXIT_OK;
    }

    /**
     * Start the read-only API on {@code port} (0 picks a free port).
     */
    public static Javalin startServer(StoryEngine engine, int port) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.http.defaultContentType = "application/json";
        });

        List<Controller> controllers = List.of(new StoryController(engine));
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }
        app.exception(Exception.class, (e, ctx) -> {
            AppLogger log = AppLogger.get();
            if (log != null) {
                log.error("Unhandled error on " + ctx.path(), e);
            }
            ctx.status(500).json(Controller.errorBody(e));
        });

        app.start(port);
        AppLogger log = AppLogger.get();
        if (log != null) {
            log.info("Server started on port " + app.port());
        }
        return app;
    }

    private static void printSummary(GraphSummary summary) {
        for (String line : summary.formatLines()) {
            logger.console(line);
        }
    }
}
