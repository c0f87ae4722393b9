package work.citeproc.engine.runtime;

/**
 * Name list overrides a sort {@code <key>} applies to macros it renders ({@code names-min}, {@code names-use-first},
 * {@code names-use-last}). {@code null} fields keep the style's own values.
 */
public record SortNameOptions(Integer etAlMin, Integer etAlUseFirst, Boolean etAlUseLast) {}
