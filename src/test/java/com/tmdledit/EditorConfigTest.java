package com.tmdledit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EditorConfigTest {

    @TempDir
    Path tempDir;

    private String logFile() {
        return tempDir.resolve("editor.log").toString();
    }

    @Test
    void parsesCommandOptionsAndFlags() throws Exception {
        EditorConfig config = new EditorConfig.Builder()
            .env(Map.of())
            .parseArgs(new String[] {"update", "--project", tempDir.toString(), "--path=Sales/measure:X",
                "--changes", "{\"format_string\":\"0\"}", "--dry-run", "--no-verify", "--log-file", logFile()})
            .build();

        assertEquals("update", config.getCommand());
        assertEquals(tempDir.toAbsolutePath().normalize(), config.getProjectPath());
        assertEquals("Sales/measure:X", config.getPath());
        assertEquals("{\"format_string\":\"0\"}", config.getChanges());
        assertTrue(config.isDryRun());
        assertFalse(config.isVerify());
        assertFalse(config.isVerbose());
        assertEquals("convention", config.getInsertion());
        assertEquals(Path.of(logFile()).toAbsolutePath().normalize(), config.getLogPath());
    }

    @Test
    void projectFallsBackToEnvironment() throws Exception {
        EditorConfig config = new EditorConfig.Builder()
            .env(Map.of(EditorConfig.PROJECT_ENV, tempDir.toString()))
            .parseArgs(new String[] {"list-tables", "--log-file=" + logFile()})
            .build();

        assertEquals(tempDir.toAbsolutePath().normalize(), config.getProjectPath());
    }

    @Test
    void flagWinsOverEnvironmentAndUnknownOptionsAreIgnored() throws Exception {
        Path other = tempDir.resolve("other");
        EditorConfig config = new EditorConfig.Builder()
            .env(Map.of(EditorConfig.PROJECT_ENV, tempDir.toString()))
            .parseArgs(new String[] {"--colour", "add", "--project=" + other, "--kind", "measure",
                "--table", "Sales", "--spec", "{}", "--insertion=append", "--verbose", "--log-file", logFile()})
            .build();

        assertEquals("add", config.getCommand());
        assertEquals(other.toAbsolutePath().normalize(), config.getProjectPath());
        assertEquals("measure", config.getKind());
        assertEquals("Sales", config.getTable());
        assertEquals("{}", config.getSpec());
        assertEquals("append", config.getInsertion());
        assertTrue(config.isVerbose());
    }

    @Test
    void noProjectWhenNothingIsGiven() throws Exception {
        EditorConfig config = new EditorConfig.Builder()
            .env(Map.of())
            .parseArgs(new String[] {"list-tables", "--log-file", logFile()})
            .build();

        assertNull(config.getProjectPath());
    }

    @Test
    void logFileLivesUnderAppDirectory() {
        assertEquals("tmdl-editor.log", EditorConfig.getLogFilePath().getFileName().toString());
        assertTrue(EditorConfig.getLogDirectory().toString().contains("TMDL-Editor"));
    }
}
