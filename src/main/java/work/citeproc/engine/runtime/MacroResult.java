package work.citeproc.engine.runtime;

import java.util.List;
import work.citeproc.engine.output.Output;

/**
 * Pre-formatting output of one macro expansion plus the variable bookkeeping it produced, replayed on cache hits.
 */
record MacroResult(Output output, int variablesCalled, int variablesRendered, List<String> renderedVariables) {
    MacroResult {
        renderedVariables = List.copyOf(renderedVariables);
    }
}
