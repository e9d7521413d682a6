package com.tmdledit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Command-line configuration: the command to run, the project it runs against, and the
 * options that steer logging, writing and insertion.
 */
public class EditorConfig {

    private static final String APP_NAME = "TMDL-Editor";
    public static final String PROJECT_ENV = "TMDL_EDITOR_PROJECT";

    private final String command;
    private final Path projectPath;
    private final Path logPath;
    private final boolean verbose;
    private final boolean dryRun;
    private final boolean verify;
    private final String insertion;
    private final String table;
    private final String path;
    private final String kind;
    private final String spec;
    private final String changes;

    private EditorConfig(Builder builder, Path projectPath, Path logPath) {
        this.command = builder.command;
        this.projectPath = projectPath;
        this.logPath = logPath;
        this.verbose = builder.verbose;
        this.dryRun = builder.dryRun;
        this.verify = builder.verify;
        this.insertion = builder.insertion;
        this.table = builder.table;
        this.path = builder.path;
        this.kind = builder.kind;
        this.spec = builder.spec;
        this.changes = builder.changes;
    }

    public String getCommand() {
        return command;
    }

    /** Project, project folder or model folder to open; null when neither flag nor env var is set. */
    public Path getProjectPath() {
        return projectPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isVerify() {
        return verify;
    }

    public String getInsertion() {
        return insertion;
    }

    public String getTable() {
        return table;
    }

    public String getPath() {
        return path;
    }

    public String getKind() {
        return kind;
    }

    public String getSpec() {
        return spec;
    }

    public String getChanges() {
        return changes;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\TMDL-Editor\logs
     * macOS: ~/Library/Logs/TMDL-Editor
     * Linux: ~/.local/share/TMDL-Editor/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("tmdl-editor.log");
    }

    /**
     * Ensure the log directory exists and return the log file path.
     */
    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for EditorConfig.
     */
    public static class Builder {
        private String command;
        private Path projectPath;
        private Path logPath;
        private boolean verbose = false;
        private boolean dryRun = false;
        private boolean verify = true;
        private String insertion = "convention";
        private String table;
        private String path;
        private String kind;
        private String spec;
        private String changes;
        private Map<String, String> env = System.getenv();

        public Builder projectPath(String value) {
            if (value != null && !value.isEmpty()) {
                this.projectPath = Paths.get(value).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder logPath(String value) {
            if (value != null && !value.isEmpty()) {
                this.logPath = Paths.get(value).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // Handle --name=value or --name value
                if (arg.startsWith("--") && arg.contains("=")) {
                    int eq = arg.indexOf('=');
                    option(arg.substring(2, eq), arg.substring(eq + 1));
                } else if (arg.startsWith("--") && takesValue(arg.substring(2)) && i + 1 < args.length) {
                    option(arg.substring(2), args[++i]);
                }

                // Flags
                else if ("--verbose".equals(arg)) {
                    this.verbose = true;
                } else if ("--dry-run".equals(arg)) {
                    this.dryRun = true;
                } else if ("--no-verify".equals(arg)) {
                    this.verify = false;
                }

                // First positional argument is the command
                else if (!arg.startsWith("--") && command == null) {
                    this.command = arg;
                }
            }
            return this;
        }

        private static boolean takesValue(String name) {
            switch (name) {
                case "project":
                case "log-file":
                case "insertion":
                case "table":
                case "path":
                case "kind":
                case "spec":
                case "changes":
                    return true;
                default:
                    return false;
            }
        }

        private void option(String name, String value) {
            switch (name) {
                case "project":
                    projectPath(value);
                    break;
                case "log-file":
                    logPath(value);
                    break;
                case "insertion":
                    this.insertion = value;
                    break;
                case "table":
                    this.table = value;
                    break;
                case "path":
                    this.path = value;
                    break;
                case "kind":
                    this.kind = value;
                    break;
                case "spec":
                    this.spec = value;
                    break;
                case "changes":
                    this.changes = value;
                    break;
                default:
                    break;
            }
        }

        public EditorConfig build() throws IOException {
            Path project = projectPath;
            if (project == null && env != null) {
                String fromEnv = env.get(PROJECT_ENV);
                if (fromEnv != null && !fromEnv.isBlank()) {
                    project = Paths.get(fromEnv).toAbsolutePath().normalize();
                }
            }

            // Ensure log directory exists
            Path log = logPath != null ? logPath : ensureLogDirectory();

            return new EditorConfig(this, project, log);
        }
    }
}
