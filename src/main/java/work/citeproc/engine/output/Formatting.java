package work.citeproc.engine.output;

import java.util.Map;

/**
 * Font and display attributes applied to a rendered fragment. {@code null} means "not set".
 */
public record Formatting(
    String fontStyle,
    String fontWeight,
    String fontVariant,
    String textDecoration,
    String verticalAlign,
    String display
) {
    public static final Formatting NONE = new Formatting(null, null, null, null, null, null);

    public static Formatting from(Map<String, String> attributes) {
        var formatting = new Formatting(
            attributes.get("font-style"),
            attributes.get("font-weight"),
            attributes.get("font-variant"),
            attributes.get("text-decoration"),
            attributes.get("vertical-align"),
            attributes.get("display")
        );
        return formatting.isNone() ? NONE : formatting;
    }

    public boolean isNone() {
        return fontStyle == null && fontWeight == null && fontVariant == null
            && textDecoration == null && verticalAlign == null && display == null;
    }

    public Formatting withoutDisplay() {
        return new Formatting(fontStyle, fontWeight, fontVariant, textDecoration, verticalAlign, null);
    }

    public Formatting displayOnly() {
        return new Formatting(null, null, null, null, null, display);
    }
}
