package work.citeproc.engine.disambiguation;

/**
 * Result of the name-disambiguation loop: a fixed point, or the iteration cap with collisions possibly left.
 */
public sealed interface DisambiguationOutcome permits DisambiguationOutcome.Converged, DisambiguationOutcome.CappedAt {
    boolean converged();

    record Converged(int iterations) implements DisambiguationOutcome {
        @Override
        public boolean converged() {
            return true;
        }
    }

    record CappedAt(int cap) implements DisambiguationOutcome {
        @Override
        public boolean converged() {
            return false;
        }
    }
}
