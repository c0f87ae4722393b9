package work.citeproc.engine.locale;

/**
 * A localized term. {@code multiple} is {@code null} for terms without a plural.
 */
public record Term(String name, TermForm form, String single, String multiple, String gender, String genderForm, String match) {
    public String value(boolean plural) {
        if (plural && multiple != null) {
            return multiple;
        }
        return single == null ? "" : single;
    }
}
