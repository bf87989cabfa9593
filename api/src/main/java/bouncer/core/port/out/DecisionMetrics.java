package bouncer.core.port.out;

/**
 * Port interface for recording access-decision metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface DecisionMetrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record one decision.
     *
     * @param outcome   how the request was decided
     * @param latencyNs time spent deciding, in nanoseconds
     */
    void recordDecision(Outcome outcome, long latencyNs);

    /**
     * Decision outcomes as seen by the HTTP layer.
     */
    enum Outcome {
        ALLOW("allow"),
        DENY("deny"),
        ERROR("error"),
        SKIPPED("skipped");

        private final String tag;

        Outcome(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }
}
