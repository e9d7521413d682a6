package com.tmdledit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdledit.errors.TmdlException;
import com.tmdledit.errors.UnsupportedPropertyException;
import com.tmdledit.models.EntityKind;
import com.tmdledit.models.EntityPath;
import com.tmdledit.mutation.InsertionPolicy;
import com.tmdledit.mutation.MutationEngine;
import com.tmdledit.mutation.RandomLineageTagGenerator;
import com.tmdledit.tools.PayloadParser;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line front end. Prints one JSON document to stdout per invocation; failures print
 * {@code {"error": code, "message": text}} and exit with status 1.
 */
public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    static final String USAGE = String.join("\n",
        "TMDL Editor " + VERSION,
        "usage: tmdl-editor <command> --project <path> [options]",
        "  list-tables",
        "  list-measures [--table <name>]",
        "  list-columns [--table <name>]",
        "  list-relationships",
        "  model-details",
        "  show --path <entity path>",
        "  add --table <name> --kind measure|column --spec <json|@file>",
        "  update --path <entity path> --changes <json|@file>",
        "  delete --path <entity path>",
        "options: --dry-run --no-verify --verbose --insertion=convention|append --log-file <path>");

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        EditorConfig config;
        try {
            config = new EditorConfig.Builder().parseArgs(args).build();
            Path logPath = config.getLogPath();
            if (logPath.getParent() != null) {
                Files.createDirectories(logPath.getParent());
            }
            AppLogger.initialize(logPath, config.isVerbose(), config.isVerbose());
        } catch (IOException e) {
            return fail(out, "config_error", "Could not set up logging: " + e.getMessage());
        }
        AppLogger logger = AppLogger.get();

        if (config.getCommand() == null || "help".equals(config.getCommand())) {
            System.err.println(USAGE);
            return config.getCommand() == null ? 1 : 0;
        }
        if (config.getProjectPath() == null) {
            return fail(out, "missing_project", "No project given; use --project or set " + EditorConfig.PROJECT_ENV);
        }

        try {
            MutationEngine engine = new MutationEngine(new RandomLineageTagGenerator(),
                InsertionPolicy.fromName(config.getInsertion()));
            TmdlEditor editor = new TmdlEditor(engine, config.isVerify());
            SemanticModelWorkspace workspace = SemanticModelWorkspace.open(config.getProjectPath(), editor);
            ModelOperations operations = new ModelOperations(workspace, editor, objectMapper, config.isDryRun());
            logger.info("Running " + config.getCommand() + " against " + workspace.getModelRoot());
            Object result = dispatch(config, operations, new PayloadParser(objectMapper));
            if (result == null) {
                return fail(out, "unknown_command", "Unknown command: " + config.getCommand() + "\n" + USAGE);
            }
            out.println(objectMapper.writeValueAsString(result));
            return 0;
        } catch (UnsupportedPropertyException e) {
            logger.warn(e.getDetail() + ": " + e.getMessage());
            return fail(out, e.getErrorCode(), e.getMessage(), e.getDetail());
        } catch (TmdlException e) {
            logger.warn(e.getErrorCode() + ": " + e.getMessage());
            return fail(out, e.getErrorCode(), e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.warn(e.getMessage());
            return fail(out, "invalid_argument", e.getMessage());
        } catch (IOException e) {
            logger.error("I/O failure", e);
            return fail(out, "io_error", e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure", e);
            return fail(out, "internal_error", e.getMessage());
        }
    }

    private static Object dispatch(EditorConfig config, ModelOperations operations, PayloadParser payloads)
            throws IOException, TmdlException {
        switch (config.getCommand()) {
            case "list-tables":
                return operations.listTables();
            case "list-measures":
                return operations.listMeasures(config.getTable());
            case "list-columns":
                return operations.listColumns(config.getTable());
            case "list-relationships":
                return operations.listRelationships();
            case "model-details":
                return operations.modelDetails();
            case "show":
                return operations.show(requirePath(config));
            case "add": {
                EntityKind kind = EntityKind.parse(require(config.getKind(), "kind"));
                if (kind == null) {
                    throw new IllegalArgumentException("Unknown kind: " + config.getKind());
                }
                EntityPath parent = config.getPath() != null
                    ? EntityPath.parse(config.getPath())
                    : EntityPath.table(require(config.getTable(), "table"));
                return operations.add(parent, payloads.parseEntitySpec(kind, readPayload(require(config.getSpec(), "spec"))));
            }
            case "update":
                return operations.update(requirePath(config),
                    payloads.parsePropertyChanges(readPayload(require(config.getChanges(), "changes"))));
            case "delete":
                return operations.delete(requirePath(config));
            default:
                return null;
        }
    }

    private static EntityPath requirePath(EditorConfig config) {
        return EntityPath.parse(require(config.getPath(), "path"));
    }

    private static String require(String value, String option) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing --" + option);
        }
        return value;
    }

    /**
     * A payload starting with {@code @} names a file holding the JSON.
     */
    private static String readPayload(String value) throws IOException {
        if (value.startsWith("@")) {
            return new String(Files.readAllBytes(Paths.get(value.substring(1))), StandardCharsets.UTF_8);
        }
        return value;
    }

    private static int fail(PrintStream out, String code, String message) {
        return fail(out, code, message, null);
    }

    private static int fail(PrintStream out, String code, String message, String detail) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("error", code);
        error.put("message", message);
        if (detail != null) {
            error.put("detail", detail);
        }
        try {
            out.println(objectMapper.writeValueAsString(error));
        } catch (JsonProcessingException e) {
            out.println("{\"error\":\"" + code + "\"}");
        }
        return 1;
    }
}
