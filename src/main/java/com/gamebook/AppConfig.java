package com.gamebook;

import com.gamebook.PipelineConfigStore.PipelineConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Command-line configuration for a single invocation.
 */
public class AppConfig {

    public enum Command { BUILD, LINT, SERVE }

    private final Command command;
    private final Path pagesPath;
    private final Path storyPath;
    private final Path reportPath;
    private final Path diffPath;
    private final Path configPath;
    private final Path logPath;
    private final int port;
    private final boolean fix;
    private final boolean verbose;
    private final Double minReachableRatio;
    private final Double maxNoiseRatio;
    private final Integer maxNodes;
    private final Integer continuationPages;
    private final Integer pageOffset;

    private AppConfig(Builder b) {
        this.command = b.command;
        this.pagesPath = b.pagesPath;
        this.storyPath = b.storyPath;
        this.reportPath = b.reportPath;
        this.diffPath = b.diffPath;
        this.configPath = b.configPath;
        this.logPath = b.logPath;
        this.port = b.port;
        this.fix = b.fix;
        this.verbose = b.verbose;
        this.minReachableRatio = b.minReachableRatio;
        this.maxNoiseRatio = b.maxNoiseRatio;
        this.maxNodes = b.maxNodes;
        this.continuationPages = b.continuationPages;
        this.pageOffset = b.pageOffset;
    }

    public Command getCommand() {
        return command;
    }

    public Path getPagesPath() {
        return pagesPath;
    }

    public Path getStoryPath() {
        return storyPath;
    }

    public Path getReportPath() {
        return reportPath;
    }

    public Path getDiffPath() {
        return diffPath;
    }

    public Path getConfigPath() {
        return configPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isFix() {
        return fix;
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Overlay command-line overrides onto settings loaded from the config file.
     */
    public PipelineConfig applyOverrides(PipelineConfig config) {
        PipelineConfig target = config != null ? config : new PipelineConfig();
        if (minReachableRatio != null) {
            target.setMinReachableRatio(minReachableRatio);
        }
        if (maxNoiseRatio != null) {
            target.setMaxNoiseRatio(maxNoiseRatio);
        }
        if (maxNodes != null) {
            target.setMaxNodes(maxNodes);
        }
        if (continuationPages != null) {
            target.setContinuationPages(continuationPages);
        }
        if (pageOffset != null) {
            target.setPageOffset(pageOffset);
        }
        return target;
    }

    public static String usage() {
        return String.join("\n",
            "Usage: gamebook-graph <build|lint|serve> [options]",
            "",
            "  build   assemble the story graph from page text, repair it and write the store",
            "  lint    check duplicate choices, reachability and OCR noise of a store",
            "  serve   expose a read-only HTTP API over a store",
            "",
            "Options:",
            "  --pages <file>                page text dump (default raw_text.txt)",
            "  --story <file>                story store (default story.json)",
            "  --report <file>               link change report (default link_report.txt)",
            "  --diff <file>                 store diff output (default story.diff)",
            "  --config <file>               pipeline settings JSON",
            "  --log <file>                  append log lines to this file",
            "  --min-reachable-ratio <d>     lint threshold (default 0.15)",
            "  --max-noise-ratio <d>         lint threshold (default 0.03)",
            "  --max-nodes <n>               assembly safety cap (default 200)",
            "  --continuation-pages <n>      pages absorbed after a choice-less page (default 2)",
            "  --page-offset <n>             page number of section n is n + offset (default 10)",
            "  --fix                         lint: remove duplicate choices in place",
            "  --port <n>                    serve: HTTP port (default 8080)",
            "  --verbose                     echo log lines to the console");
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Command command;
        private Path pagesPath = Paths.get("raw_text.txt");
        private Path storyPath = Paths.get("story.json");
        private Path reportPath = Paths.get("link_report.txt");
        private Path diffPath = Paths.get("story.diff");
        private Path configPath;
        private Path logPath;
        private int port = 8080;
        private boolean fix;
        private boolean verbose;
        private Double minReachableRatio;
        private Double maxNoiseRatio;
        private Integer maxNodes;
        private Integer continuationPages;
        private Integer pageOffset;

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    if (command != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    command = parseCommand(arg);
                    continue;
                }

                String key = arg;
                String value = null;
                int eq = arg.indexOf('=');
                if (eq > 0) {
                    key = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                }

                // Flags
                if ("--fix".equals(key)) {
                    fix = true;
                    continue;
                }
                if ("--verbose".equals(key)) {
                    verbose = true;
                    continue;
                }

                if (value == null) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for " + key);
                    }
                    value = args[++i];
                }
                applyOption(key, value);
            }
            return this;
        }

        private void applyOption(String key, String value) {
            switch (key) {
                case "--pages":
                    pagesPath = toPath(value, pagesPath);
                    break;
                case "--story":
                    storyPath = toPath(value, storyPath);
                    break;
                case "--report":
                    reportPath = toPath(value, reportPath);
                    break;
                case "--diff":
                    diffPath = toPath(value, diffPath);
                    break;
                case "--config":
                    configPath = toPath(value, null);
                    break;
                case "--log":
                    logPath = toPath(value, null);
                    break;
                case "--port":
                    port = parseInt(key, value);
                    break;
                case "--min-reachable-ratio":
                    minReachableRatio = parseRatio(key, value);
                    break;
                case "--max-noise-ratio":
                    maxNoiseRatio = parseRatio(key, value);
                    break;
                case "--max-nodes":
                    maxNodes = parseInt(key, value);
                    break;
                case "--continuation-pages":
                    continuationPages = parseInt(key, value);
                    break;
                case "--page-offset":
                    pageOffset = parseInt(key, value);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + key);
            }
        }

        private static Command parseCommand(String value) {
            try {
                return Command.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown command: " + value, e);
            }
        }

        private static Path toPath(String value, Path fallback) {
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return Paths.get(value.trim());
        }

        private static int parseInt(String key, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
            }
        }

        private static double parseRatio(String key, String value) {
            double parsed;
            try {
                parsed = Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
            }
            if (parsed < 0.0 || parsed > 1.0) {
                throw new IllegalArgumentException(key + " must be between 0 and 1: " + value);
            }
            return parsed;
        }

        public AppConfig build() {
            if (command == null) {
                throw new IllegalArgumentException("Missing command");
            }
            return new AppConfig(this);
        }
    }
}
