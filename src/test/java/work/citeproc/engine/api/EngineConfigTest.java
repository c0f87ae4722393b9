package work.citeproc.engine.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.tomlj.Toml;
import work.citeproc.engine.output.OutputFormat;
import work.citeproc.engine.support.CiteprocTestSupport;

class EngineConfigTest {
    @Test
    void readsEverySection() throws Exception {
        var config = EngineConfig.load(CiteprocTestSupport.resource("fixtures", "citeproc.toml"));
        assertEquals(Optional.of("en-US"), config.defaultLocale());
        assertEquals(3, config.nearNoteDistance());
        assertEquals(OutputFormat.HTML, config.outputFormat());
        assertFalse(config.memoizeMacros());
        assertEquals(4, config.maxIterations());
    }

    @Test
    void fallsBackToDefaultsForMissingFiles() throws Exception {
        assertSame(EngineConfig.DEFAULTS, EngineConfig.load(CiteprocTestSupport.resource("fixtures", "absent.toml")));
        assertSame(EngineConfig.DEFAULTS, EngineConfig.load(null));
    }

    @Test
    void keepsDefaultsForMissingKeys() {
        var config = EngineConfig.fromToml(Toml.parse("[engine]\nmemoize-macros = false\n"));
        assertEquals(EngineConfig.DEFAULTS.nearNoteDistance(), config.nearNoteDistance());
        assertEquals(OutputFormat.TEXT, config.outputFormat());
        assertEquals(Optional.empty(), config.defaultLocale());
        assertFalse(config.memoizeMacros());
    }

    @Test
    void rejectsInvalidToml() {
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfig.load(CiteprocTestSupport.resource("fixtures", "invalid.toml")));
    }
}
