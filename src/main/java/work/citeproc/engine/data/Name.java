package work.citeproc.engine.data;

/**
 * One personal or institutional name as supplied by the bibliography.
 */
public record Name(
    String family,
    String given,
    String nonDroppingParticle,
    String droppingParticle,
    String suffix,
    String literal
) {
    public static Name of(String family, String given) {
        return new Name(family, given, null, null, null, null);
    }

    public static Name literal(String literal) {
        return new Name(null, null, null, null, null, literal);
    }

    /**
     * Literal names and family-only names are treated as institutions.
     */
    public boolean isInstitution() {
        if (notBlank(literal)) {
            return true;
        }
        return notBlank(family) && !notBlank(given);
    }

    /**
     * Family name including the non-dropping particle, or the literal for institutions.
     */
    public String familyWithParticle() {
        if (notBlank(literal)) {
            return literal;
        }
        var base = family == null ? "" : family;
        if (notBlank(nonDroppingParticle)) {
            return joinParticle(nonDroppingParticle, base);
        }
        return base;
    }

    public String sortFamily() {
        if (notBlank(literal)) {
            return literal;
        }
        return family == null ? "" : family;
    }

    static String joinParticle(String particle, String family) {
        if (particle.endsWith("'") || particle.endsWith("’") || particle.endsWith("-")) {
            return particle + family;
        }
        return particle + " " + family;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
