package work.citeproc.engine.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OutputFormatTest {
    private static Output styled(Map<String, String> attributes, Output content) {
        return Output.styled(Formatting.from(attributes), content);
    }

    @Test
    void escapesMarkupInHtml() {
        assertEquals("Tom &amp; &quot;Jerry&quot; &lt;3", OutputFormat.HTML.render(Output.text("Tom & \"Jerry\" <3")));
        assertEquals("Tom & \"Jerry\" <3", OutputFormat.TEXT.render(Output.text("Tom & \"Jerry\" <3")));
    }

    @Test
    void nestsFormattingInsideDisplayBlocks() {
        var output = styled(Map.of("display", "block", "font-style", "italic", "font-weight", "bold"),
            Output.text("Title"));
        assertEquals("<div class=\"csl-block\"><i><b>Title</b></i></div>", OutputFormat.HTML.render(output));
        assertEquals("Title", OutputFormat.TEXT.render(output));
    }

    @Test
    void rendersSmallCapsAndSuperscript() {
        var output = Output.seq(
            styled(Map.of("font-variant", "small-caps"), Output.text("Doe")),
            styled(Map.of("vertical-align", "sup"), Output.text("1")));
        assertEquals("<span style=\"font-variant:small-caps;\">Doe</span><sup>1</sup>",
            OutputFormat.HTML.render(output));
    }

    @Test
    void dropsEmptyFragments() {
        assertSame(Output.EMPTY, Output.text(""));
        assertSame(Output.EMPTY, Output.seq(Output.text(null), Output.EMPTY));
        assertTrue(styled(Map.of("font-style", "italic"), Output.EMPTY).isEmpty());
    }

    @Test
    void joinsWithoutDoublingPunctuation() {
        var joined = Output.join(List.of(Output.text("Ann."), Output.EMPTY, Output.text("B"), Output.text("Why?")), ". ");
        assertEquals("Ann. B. Why?", joined.plainText());
        assertEquals("Why? Next", Output.join(List.of(Output.text("Why?"), Output.text("Next")), ". ").plainText());
    }

    @Test
    void parsesFormatNames() {
        assertSame(OutputFormat.TEXT, OutputFormat.from(null));
        assertSame(OutputFormat.TEXT, OutputFormat.from("plain"));
        assertSame(OutputFormat.HTML, OutputFormat.from(" html "));
        assertThrows(IllegalArgumentException.class, () -> OutputFormat.from("rtf"));
    }
}
