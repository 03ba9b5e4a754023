package in.ladderbot.bootstrap;

import in.ladderbot.config.ScheduleException;
import in.ladderbot.config.SequenceConfig;
import in.ladderbot.config.SequenceConfigLoader;
import in.ladderbot.domain.sequence.SequenceResult;
import in.ladderbot.infrastructure.metrics.PrometheusSequenceMetrics;
import in.ladderbot.infrastructure.venue.paper.PaperVenue;
import in.ladderbot.service.schedule.SequenceScheduler;
import in.ladderbot.service.sequence.SequenceClock;
import in.ladderbot.service.sequence.SequenceController;
import in.ladderbot.service.sequence.SequenceRunner;
import in.ladderbot.service.sequence.StopSignal;
import in.ladderbot.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Entry point: load config, validate, run one sequence against the paper venue.
 *
 * Exit codes: 0 WIN, 1 LOSS or aborted sequence, 2 invalid configuration.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final double DEFAULT_WIN_PROBABILITY = 0.5;

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Ladderbot Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        SequenceConfig config;
        double winProbability;
        try {
            config = new SequenceConfigLoader().loadFromEnvironment();
            StartupConfigValidator.validate(config);
            winProbability = paperWinProbability();
        } catch (ScheduleException | IllegalStateException e) {
            log.error("Refusing to start: {}", e.getMessage());
            System.exit(2);
            return;
        } catch (IOException e) {
            log.error("Cannot read sequence config", e);
            System.exit(2);
            return;
        }

        System.exit(run(config, winProbability));
    }

    /**
     * Run one sequence and map its result to an exit code.
     */
    static int run(SequenceConfig config, double winProbability) {
        SequenceClock clock = SequenceClock.system();
        long seed = Env.getInt("PAPER_SEED", (int) System.nanoTime());
        PaperVenue venue = new PaperVenue(clock, winProbability, seed);
        PrometheusSequenceMetrics metrics = new PrometheusSequenceMetrics();

        SequenceController controller = new SequenceController(
            config, venue, venue, new SequenceScheduler(), clock, metrics, new StopSignal());
        SequenceRunner runner = new SequenceRunner(controller);

        CompletableFuture<SequenceResult> pending = runner.start();
        Thread hook = new Thread(() -> {
            runner.stop();
            try {
                pending.get(2, TimeUnit.SECONDS);
            } catch (Exception e) {
                log.warn("Sequence did not finish during shutdown: {}", e.toString());
            }
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            SequenceResult result = pending.join();
            log.info("Result: {} ({}) levels={} elapsed={}s",
                result.finalOutcome(), result.terminalReason(), result.levelsAttempted(),
                result.elapsed().toSeconds());
            result.attempts().forEach(a -> log.info("  {}", a));
            return result.isWin() ? 0 : 1;
        } catch (CompletionException e) {
            log.error("Sequence failed", e.getCause());
            return e.getCause() instanceof ScheduleException ? 2 : 1;
        } finally {
            runner.shutdown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down");
            }
        }
    }

    /**
     * Win probability of the paper venue from PAPER_WIN_PROBABILITY, default 0.5.
     *
     * @throws ScheduleException if the value is not a number within [0, 1]
     */
    static double paperWinProbability() {
        String value = Env.get("PAPER_WIN_PROBABILITY", null);
        if (value == null) {
            return DEFAULT_WIN_PROBABILITY;
        }
        double probability;
        try {
            probability = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ScheduleException("PAPER_WIN_PROBABILITY", "not a number: " + value, e);
        }
        if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
            throw new ScheduleException("PAPER_WIN_PROBABILITY", "must be within [0, 1], got " + value);
        }
        return probability;
    }

    private App() {}
}
