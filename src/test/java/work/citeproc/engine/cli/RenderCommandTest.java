package work.citeproc.engine.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import org.junit.jupiter.api.Test;
import work.citeproc.engine.style.StyleException;
import work.citeproc.engine.support.CiteprocTestSupport;

class RenderCommandTest {
    private static final String STYLE = CiteprocTestSupport.resource("fixtures", "author-date.csl").toString();
    private static final String REFERENCES = CiteprocTestSupport.resource("fixtures", "references.json").toString();
    private static final String CITATIONS = CiteprocTestSupport.resource("fixtures", "citations.json").toString();

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void printsCitationsThenBibliography() {
        int exit = execute("-s", STYLE, "-b", REFERENCES, "-c", CITATIONS);

        assertEquals(0, exit);
        var lines = out.toString().split("\\R");
        assertEquals("(Doe 2020a, b)", lines[0]);
        assertEquals("(Roe & Poe 2019, 12)", lines[1]);
        assertEquals("", lines[2]);
        assertEquals("Doe, Jane. 2020a. Rivers of the North.", lines[3]);
    }

    @Test
    void printsJson() {
        int exit = execute("-s", STYLE, "-b", REFERENCES, "--json", "--format", "html");
        assertEquals(0, exit);
        assertTrue(out.toString().contains("\"status\" : \"success\""));
        assertTrue(out.toString().contains("<i>Tides</i>"));
    }

    @Test
    void failsForBrokenStyles() {
        var broken = CiteprocTestSupport.resource("fixtures", "broken.csl").toString();
        assertEquals(1, execute("-s", broken, "-b", REFERENCES));
        assertTrue(err.toString().contains("no <citation>"));
    }

    @Test
    void rejectsMissingConfigurationFile() {
        var missing = CiteprocTestSupport.resource("fixtures", "absent.toml").toString();
        assertNotEquals(0, execute("-s", STYLE, "-b", REFERENCES, "--config", missing));
    }

    @Test
    void reportsInvalidConfigurationAsInputError() {
        var invalid = CiteprocTestSupport.resource("fixtures", "invalid.toml").toString();
        assertEquals(2, execute("-s", STYLE, "-b", REFERENCES, "--config", invalid));
        assertTrue(err.toString().contains("Invalid invalid.toml"));
    }

    @Test
    void rejectsUnknownLogLevels() {
        assertEquals(2, execute("-s", STYLE, "-b", REFERENCES, "--log-level", "loud"));
        assertTrue(err.toString().contains("Unsupported log level: loud"));
    }

    @Test
    void describesRootCauses() {
        var wrapped = new IllegalStateException("outer", new StyleException("malformed_xml", "Unexpected end"));
        assertEquals("Style error [malformed_xml]: Unexpected end", ShortErrorHandler.describe(wrapped));
        assertEquals("File not found: refs.json",
            ShortErrorHandler.describe(new UncheckedIOException(new NoSuchFileException("refs.json"))));
        assertEquals("IllegalStateException", ShortErrorHandler.describe(new IllegalStateException()));
    }

    @Test
    void printsVersion() {
        assertEquals(0, execute("--version"));
        assertTrue(out.toString().contains("CSL 1.0.2, CSL-M"));
        assertTrue(out.toString().contains("built-in locales: de-DE, en-US"));
    }

    @Test
    void requiresStyleAndBibliography() {
        assertNotEquals(0, execute("-b", REFERENCES));
    }
}
