package work.citeproc.engine.locale;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.citeproc.engine.style.Node;

/**
 * Terms, localized date formats and style options of one locale, as declared by a locale file or a style.
 */
public final class LocaleTable {
    private final String language;
    private final Map<String, Term> terms;
    private final Map<String, Node> dateFormats;
    private final Map<String, String> options;

    private LocaleTable(String language, Map<String, Term> terms, Map<String, Node> dateFormats, Map<String, String> options) {
        this.language = language;
        this.terms = Collections.unmodifiableMap(new LinkedHashMap<>(terms));
        this.dateFormats = Collections.unmodifiableMap(new LinkedHashMap<>(dateFormats));
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static Builder builder(String language) {
        return new Builder(language);
    }

    /**
     * @return the xml:lang tag, or {@code null} for a style locale without one
     */
    public String language() {
        return language;
    }

    public Optional<Term> term(String name, TermForm form, String genderForm) {
        var term = terms.get(key(name, form, genderForm));
        if (term == null && genderForm != null) {
            term = terms.get(key(name, form, null));
        }
        return Optional.ofNullable(term);
    }

    public Optional<Node> dateFormat(String form) {
        return Optional.ofNullable(dateFormats.get(form));
    }

    public Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public Map<String, Term> terms() {
        return terms;
    }

    static String key(String name, TermForm form, String genderForm) {
        return name + "|" + form.attribute() + "|" + (genderForm == null ? "" : genderForm);
    }

    public static final class Builder {
        private final String language;
        private final Map<String, Term> terms = new LinkedHashMap<>();
        private final Map<String, Node> dateFormats = new LinkedHashMap<>();
        private final Map<String, String> options = new LinkedHashMap<>();

        private Builder(String language) {
            this.language = language;
        }

        public Builder term(Term term) {
            terms.put(key(term.name(), term.form(), term.genderForm()), term);
            return this;
        }

        public Builder term(String name, String single) {
            return term(new Term(name, TermForm.LONG, single, null, null, null, null));
        }

        public Builder term(String name, TermForm form, String single, String multiple) {
            return term(new Term(name, form, single, multiple, null, null, null));
        }

        public Builder dateFormat(String form, Node date) {
            dateFormats.put(form, date);
            return this;
        }

        public Builder option(String name, String value) {
            options.put(name, value);
            return this;
        }

        public LocaleTable build() {
            return new LocaleTable(language, terms, dateFormats, options);
        }
    }
}
