package com.tmdledit;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the sample TMDL files under {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Lays the fixtures out as a Power BI project: {@code Demo.pbip} next to
     * {@code Demo.SemanticModel/definition/...}.
     *
     * @return the project folder
     */
    public static Path writeProject(Path dir) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("Demo.pbip"), "{\"version\": \"1.0\"}\n");
        Path definition = dir.resolve("Demo.SemanticModel").resolve("definition");
        Path tables = definition.resolve("tables");
        Files.createDirectories(tables);
        Files.writeString(definition.resolve("model.tmdl"), read("model.tmdl"));
        Files.writeString(definition.resolve("relationships.tmdl"), read("relationships.tmdl"));
        Files.writeString(tables.resolve("Fact.tmdl"), read("Fact.tmdl"));
        Files.writeString(tables.resolve("Date.tmdl"), read("Date.tmdl"));
        Files.writeString(tables.resolve("Sales.tmdl"), read("Sales.tmdl"));
        Files.writeString(tables.resolve("Time Intelligence.tmdl"), read("TimeIntelligence.tmdl"));
        return dir;
    }
}
