package work.citeproc.engine.locale;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.citeproc.engine.style.Node;

/**
 * Resolves terms across the style-embedded, externally supplied and built-in locale tables.
 *
 * <p>Lookup order for a language such as {@code de-AT}: style {@code de-AT}, style {@code de}, untagged style locale,
 * supplied {@code de-AT}, supplied {@code de*}, built-in {@code de-AT} (or the primary dialect {@code de-DE}), and
 * finally built-in {@code en-US}. Term form fallback (for example symbol to short to long) runs before locale
 * fallback.
 */
public final class LocaleResolver {
    private final String language;
    private final List<LocaleTable> chain;

    LocaleResolver(String language, List<LocaleTable> chain) {
        this.language = language;
        this.chain = List.copyOf(chain);
    }

    public static LocaleResolver of(String language, Map<String, LocaleTable> styleLocales, Collection<LocaleTable> supplied) {
        var tag = language == null || language.isBlank() ? BuiltinLocales.FALLBACK_LANGUAGE : BuiltinLocales.normalize(language);
        var primary = BuiltinLocales.primary(tag);
        var chain = new ArrayList<LocaleTable>();
        if (styleLocales != null) {
            findTagged(styleLocales.values(), tag).ifPresent(chain::add);
            if (!primary.equals(tag)) {
                findTagged(styleLocales.values(), primary).ifPresent(chain::add);
            }
            var untagged = styleLocales.get("");
            if (untagged != null) {
                chain.add(untagged);
            }
        }
        if (supplied != null) {
            findTagged(supplied, tag).ifPresent(chain::add);
            for (var table : supplied) {
                if (table.language() != null && !chain.contains(table)
                    && BuiltinLocales.primary(BuiltinLocales.normalize(table.language())).equals(primary)) {
                    chain.add(table);
                }
            }
        }
        BuiltinLocales.find(tag).ifPresent(chain::add);
        var fallback = BuiltinLocales.fallback();
        if (!chain.contains(fallback)) {
            chain.add(fallback);
        }
        return new LocaleResolver(tag, chain);
    }

    public static LocaleResolver builtin(String language) {
        return of(language, Map.of(), List.of());
    }

    public String language() {
        return language;
    }

    public Locale javaLocale() {
        return Locale.forLanguageTag(language);
    }

    public Optional<Term> lookup(String name, TermForm form, String genderForm) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (var candidate : form.fallbacks()) {
            for (var table : chain) {
                var term = table.term(name, candidate, genderForm);
                if (term.isPresent()) {
                    return term;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @return the term text, or an empty string when no locale defines it
     */
    public String term(String name, TermForm form, boolean plural) {
        return lookup(name, form, null).map(term -> term.value(plural)).orElse("");
    }

    public String term(String name) {
        return term(name, TermForm.LONG, false);
    }

    public boolean hasTerm(String name, TermForm form) {
        return lookup(name, form, null).isPresent();
    }

    public Optional<String> gender(String name) {
        return lookup(name, TermForm.LONG, null).map(Term::gender);
    }

    public String ordinalSuffix(int number, String genderForm) {
        int lastTwo = Math.abs(number) % 100;
        if (lastTwo >= 10) {
            var exact = lookup(String.format(Locale.ROOT, "ordinal-%02d", lastTwo), TermForm.LONG, genderForm);
            if (exact.isPresent()) {
                return exact.get().value(false);
            }
        }
        int lastDigit = Math.abs(number) % 10;
        var byDigit = lookup(String.format(Locale.ROOT, "ordinal-%02d", lastDigit), TermForm.LONG, genderForm);
        if (byDigit.isPresent() && matchesLastDigit(byDigit.get(), number)) {
            return byDigit.get().value(false);
        }
        return lookup("ordinal", TermForm.LONG, genderForm).map(term -> term.value(false)).orElse("");
    }

    public String ordinal(int number, String genderForm) {
        return number + ordinalSuffix(number, genderForm);
    }

    public String longOrdinal(int number, String genderForm) {
        if (number >= 1 && number <= 10) {
            var term = lookup(String.format(Locale.ROOT, "long-ordinal-%02d", number), TermForm.LONG, genderForm);
            if (term.isPresent()) {
                return term.get().value(false);
            }
        }
        return ordinal(number, genderForm);
    }

    public String month(int month, TermForm form) {
        if (month < 1 || month > 12) {
            return "";
        }
        return term(String.format(Locale.ROOT, "month-%02d", month), form, false);
    }

    public String season(int season) {
        if (season < 1 || season > 4) {
            return "";
        }
        return term(String.format(Locale.ROOT, "season-%02d", season));
    }

    public Optional<Node> dateFormat(String form) {
        for (var table : chain) {
            var date = table.dateFormat(form);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    public boolean option(String name) {
        for (var table : chain) {
            var value = table.option(name);
            if (value.isPresent()) {
                return "true".equals(value.get());
            }
        }
        return false;
    }

    private static boolean matchesLastDigit(Term term, int number) {
        // a last-two-digits match on ordinal-0N only applies to 0..9
        if ("last-two-digits".equals(term.match())) {
            return Math.abs(number) % 100 < 10;
        }
        if ("whole-number".equals(term.match())) {
            return Math.abs(number) < 10;
        }
        return true;
    }

    private static Optional<LocaleTable> findTagged(Collection<LocaleTable> tables, String tag) {
        for (var table : tables) {
            if (table.language() != null && BuiltinLocales.normalize(table.language()).equals(tag)) {
                return Optional.of(table);
            }
        }
        return Optional.empty();
    }
}
