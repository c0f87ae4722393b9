package work.citeproc.engine.output;

import java.util.ArrayList;
import java.util.List;

/**
 * Rendered fragment tree. Formatting stays structural until an {@link OutputFormat} serializes it.
 */
public sealed interface Output permits Output.Text, Output.Styled, Output.Seq {
    Output EMPTY = new Seq(List.of());

    boolean isEmpty();

    String plainText();

    static Output text(String value) {
        return value == null || value.isEmpty() ? EMPTY : new Text(value);
    }

    static Output styled(Formatting formatting, Output content) {
        if (content.isEmpty() || formatting == null || formatting.isNone()) {
            return content;
        }
        return new Styled(formatting, content);
    }

    static Output seq(List<Output> parts) {
        var kept = new ArrayList<Output>(parts.size());
        for (var part : parts) {
            if (!part.isEmpty()) {
                kept.add(part);
            }
        }
        if (kept.isEmpty()) {
            return EMPTY;
        }
        return kept.size() == 1 ? kept.get(0) : new Seq(kept);
    }

    static Output seq(Output... parts) {
        return seq(List.of(parts));
    }

    /**
     * Joins non-empty parts with {@code delimiter}. A delimiter starting with the punctuation the previous part
     * already ends with loses that character ("Title." + ". " gives "Title. ").
     */
    static Output join(List<Output> parts, String delimiter) {
        var kept = new ArrayList<Output>();
        for (var part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            if (!kept.isEmpty() && delimiter != null && !delimiter.isEmpty()) {
                var previous = kept.get(kept.size() - 1).plainText();
                kept.add(text(Punctuation.trimLeadingDuplicate(previous, delimiter)));
            }
            kept.add(part);
        }
        return seq(kept);
    }

    record Text(String value) implements Output {
        @Override
        public boolean isEmpty() {
            return value.isEmpty();
        }

        @Override
        public String plainText() {
            return value;
        }
    }

    record Styled(Formatting formatting, Output content) implements Output {
        @Override
        public boolean isEmpty() {
            return content.isEmpty();
        }

        @Override
        public String plainText() {
            return content.plainText();
        }
    }

    record Seq(List<Output> parts) implements Output {
        public Seq {
            parts = List.copyOf(parts);
        }

        @Override
        public boolean isEmpty() {
            for (var part : parts) {
                if (!part.isEmpty()) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String plainText() {
            var builder = new StringBuilder();
            for (var part : parts) {
                builder.append(part.plainText());
            }
            return builder.toString();
        }
    }
}
