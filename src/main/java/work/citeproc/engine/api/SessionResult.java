package work.citeproc.engine.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.citeproc.engine.disambiguation.DisambiguationOutcome;
import work.citeproc.engine.disambiguation.DisambiguationState;

/**
 * Everything one {@link EngineSession#render()} produced.
 */
public record SessionResult(
    List<RenderedCitation> citations,
    List<BibliographyItem> bibliography,
    BibliographyFormat bibliographyFormat,
    DisambiguationOutcome disambiguation,
    Map<String, DisambiguationState> states,
    List<String> warnings
) {
    public SessionResult {
        citations = List.copyOf(citations);
        bibliography = List.copyOf(bibliography);
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        warnings = List.copyOf(warnings);
    }
}
