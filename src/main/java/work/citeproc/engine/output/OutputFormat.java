package work.citeproc.engine.output;

import java.util.Locale;

/**
 * Serializes {@link Output} trees for the typesetting collaborator.
 */
public enum OutputFormat {
    TEXT {
        @Override
        public String render(Output output) {
            return output.plainText();
        }
    },
    HTML {
        @Override
        public String render(Output output) {
            var builder = new StringBuilder();
            appendHtml(output, builder);
            return builder.toString();
        }
    };

    public abstract String render(Output output);

    public static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("PLAIN".equals(normalized) || "TXT".equals(normalized)) {
            return TEXT;
        }
        return OutputFormat.valueOf(normalized);
    }

    private static void appendHtml(Output output, StringBuilder builder) {
        if (output instanceof Output.Text text) {
            builder.append(escape(text.value()));
        } else if (output instanceof Output.Seq seq) {
            for (var part : seq.parts()) {
                appendHtml(part, builder);
            }
        } else if (output instanceof Output.Styled styled) {
            var formatting = styled.formatting();
            var closing = new StringBuilder();
            openDisplay(formatting.display(), builder, closing);
            open(formatting, builder, closing);
            appendHtml(styled.content(), builder);
            builder.append(closing);
        }
    }

    private static void openDisplay(String display, StringBuilder builder, StringBuilder closing) {
        if (display == null) {
            return;
        }
        builder.append("<div class=\"csl-").append(escape(display)).append("\">");
        closing.insert(0, "</div>");
    }

    private static void open(Formatting formatting, StringBuilder builder, StringBuilder closing) {
        if ("italic".equals(formatting.fontStyle()) || "oblique".equals(formatting.fontStyle())) {
            wrap("<i>", "</i>", builder, closing);
        } else if ("normal".equals(formatting.fontStyle())) {
            wrap("<span style=\"font-style:normal;\">", "</span>", builder, closing);
        }
        if ("bold".equals(formatting.fontWeight())) {
            wrap("<b>", "</b>", builder, closing);
        } else if ("light".equals(formatting.fontWeight())) {
            wrap("<span style=\"font-weight:lighter;\">", "</span>", builder, closing);
        }
        if ("small-caps".equals(formatting.fontVariant())) {
            wrap("<span style=\"font-variant:small-caps;\">", "</span>", builder, closing);
        }
        if ("underline".equals(formatting.textDecoration())) {
            wrap("<span style=\"text-decoration:underline;\">", "</span>", builder, closing);
        }
        if ("sup".equals(formatting.verticalAlign())) {
            wrap("<sup>", "</sup>", builder, closing);
        } else if ("sub".equals(formatting.verticalAlign())) {
            wrap("<sub>", "</sub>", builder, closing);
        }
    }

    private static void wrap(String open, String close, StringBuilder builder, StringBuilder closing) {
        builder.append(open);
        closing.insert(0, close);
    }

    static String escape(String value) {
        var builder = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '&' -> builder.append("&amp;");
                case '<' -> builder.append("&lt;");
                case '>' -> builder.append("&gt;");
                case '"' -> builder.append("&quot;");
                default -> builder.append(c);
            }
        }
        return builder.toString();
    }
}
