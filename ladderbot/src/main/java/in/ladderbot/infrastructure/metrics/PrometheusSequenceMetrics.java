package in.ladderbot.infrastructure.metrics;

import in.ladderbot.domain.sequence.AttemptOutcome;
import in.ladderbot.domain.sequence.TerminalReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of SequenceMetrics.
 *
 * Key Metrics:
 * - ladder_submissions_total{asset, level, status} - Accepted/rejected submissions
 * - ladder_submission_latency_seconds{asset} - Time spent submitting
 * - ladder_outcomes_total{asset, level, outcome} - WIN/LOSS/UNKNOWN per level
 * - ladder_poll_errors_total{asset} - Transient poll failures
 * - ladder_current_level{asset} - Level of the running sequence
 * - ladder_sequences_total{asset, reason} - Finished sequences by terminal reason
 * - ladder_sequence_levels{asset} - Levels used per finished sequence
 */
public class PrometheusSequenceMetrics implements SequenceMetrics {

    private final CollectorRegistry registry;

    private final Counter submissionCounter;
    private final Histogram submissionLatency;
    private final Counter outcomeCounter;
    private final Counter pollErrorCounter;
    private final Gauge currentLevel;
    private final Counter sequenceCounter;
    private final Histogram sequenceLevels;

    public PrometheusSequenceMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSequenceMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.submissionCounter = Counter.build()
            .name("ladder_submissions_total")
            .help("Total number of action submissions")
            .labelNames("asset", "level", "status")
            .register(registry);

        this.submissionLatency = Histogram.build()
            .name("ladder_submission_latency_seconds")
            .help("Action submission latency in seconds")
            .labelNames("asset")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.outcomeCounter = Counter.build()
            .name("ladder_outcomes_total")
            .help("Resolved attempt outcomes")
            .labelNames("asset", "level", "outcome")
            .register(registry);

        this.pollErrorCounter = Counter.build()
            .name("ladder_poll_errors_total")
            .help("Transient outcome poll failures")
            .labelNames("asset")
            .register(registry);

        this.currentLevel = Gauge.build()
            .name("ladder_current_level")
            .help("Current level of the running sequence (0 when idle)")
            .labelNames("asset")
            .register(registry);

        this.sequenceCounter = Counter.build()
            .name("ladder_sequences_total")
            .help("Finished sequences by terminal reason")
            .labelNames("asset", "reason")
            .register(registry);

        this.sequenceLevels = Histogram.build()
            .name("ladder_sequence_levels")
            .help("Levels attempted per finished sequence")
            .labelNames("asset")
            .buckets(1, 2, 3, 4, 5, 6, 8, 10)
            .register(registry);
    }

    @Override
    public void recordSubmission(String asset, int level, boolean accepted, Duration latency) {
        submissionCounter.labels(asset, String.valueOf(level), accepted ? "accepted" : "rejected").inc();
        submissionLatency.labels(asset).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordOutcome(String asset, int level, AttemptOutcome outcome) {
        outcomeCounter.labels(asset, String.valueOf(level), outcome.name()).inc();
    }

    @Override
    public void recordPollError(String asset) {
        pollErrorCounter.labels(asset).inc();
    }

    @Override
    public void recordLevel(String asset, int level) {
        currentLevel.labels(asset).set(level);
    }

    @Override
    public void recordSequenceEnd(String asset, TerminalReason reason, int levelsAttempted) {
        sequenceCounter.labels(asset, reason.name()).inc();
        sequenceLevels.labels(asset).observe(levelsAttempted);
        currentLevel.labels(asset).set(0);
    }

    /**
     * Registry the metrics are registered with, for exposition.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
