package dumb.natded;

import dumb.natded.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTests {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String input, String... args) {
        return Main.run(args, new BufferedReader(new StringReader(input)), new PrintWriter(out), new PrintWriter(err));
    }

    @Test
    void formulaFromArguments() {
        assertEquals(Main.EXIT_OK, run("", "p", "->", "q"));
        assertEquals("p → q", out.toString().strip());
    }

    @Test
    void syntaxErrorFails() {
        assertEquals(Main.EXIT_FAILURE, run("", "p", "#"));
        assertTrue(err.toString().startsWith("error: Unrecognized character '#'"), err.toString());
    }

    @Test
    void jsonFlag() throws IOException {
        assertEquals(Main.EXIT_OK, run("", "--json", "p & q"));
        assertEquals("and", Json.the.readTree(out.toString()).get("type").asText());
    }

    @Test
    void freeFlag() {
        assertEquals(Main.EXIT_OK, run("", "-f", "forall x. P(x, y)"));
        assertTrue(out.toString().contains("free: {y}"), out.toString());
    }

    @Test
    void usageErrors() {
        assertEquals(Main.EXIT_USAGE, run("", "--bogus", "p"));
        assertEquals(Main.EXIT_USAGE, run("", "-c"));
        assertTrue(err.toString().contains("Usage:"), err.toString());
    }

    @Test
    void help() {
        assertEquals(Main.EXIT_OK, run("", "-h"));
        assertTrue(out.toString().contains("Usage:"));
    }

    @Test
    void interactiveWithoutFormula() {
        assertEquals(Main.EXIT_OK, run("p\nbad #\nquit\n"));
        assertTrue(out.toString().contains("formula:  p"), out.toString());
        assertTrue(err.toString().contains("error:"), err.toString());
    }

    @Test
    void configFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("natded.json");
        Files.writeString(file, "{\"json\": true, \"unknown\": 1}");
        assertEquals(Main.EXIT_OK, run("", "-c", file.toString(), "~p"));
        assertEquals("not", Json.the.readTree(out.toString()).get("type").asText());
    }

    @Test
    void missingConfigFile(@TempDir Path dir) {
        assertEquals(Main.EXIT_USAGE, run("", "--config", dir.resolve("absent.json").toString(), "p"));
    }

    @Test
    void configDefaults(@TempDir Path dir) throws IOException {
        var file = dir.resolve("natded.json");
        Files.writeString(file, "{\"showFree\": true}");
        var config = Config.load(file);
        assertFalse(config.json());
        assertTrue(config.showFree());
        assertEquals(Config.DEFAULT_PROMPT, config.prompt());
        assertTrue(config.withJson(true).json());
    }
}
