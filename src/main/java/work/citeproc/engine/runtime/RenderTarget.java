package work.citeproc.engine.runtime;

public enum RenderTarget {
    CITATION("citation"),
    BIBLIOGRAPHY("bibliography");

    private final String contextName;

    RenderTarget(String contextName) {
        this.contextName = contextName;
    }

    /**
     * Value matched by the CSL-M {@code context} condition.
     */
    public String contextName() {
        return contextName;
    }
}
