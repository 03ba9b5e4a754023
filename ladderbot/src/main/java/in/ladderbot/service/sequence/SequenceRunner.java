package in.ladderbot.service.sequence;

import in.ladderbot.domain.sequence.SequenceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs a {@link SequenceController} on its own thread.
 *
 * Usage:
 * <pre>
 * SequenceRunner runner = new SequenceRunner(controller);
 * CompletableFuture&lt;SequenceResult&gt; result = runner.start();
 * ...
 * runner.shutdown();   // cancels a running sequence
 * </pre>
 */
public final class SequenceRunner {
    private static final Logger log = LoggerFactory.getLogger(SequenceRunner.class);

    private final SequenceController controller;
    private final ExecutorService executor;

    private CompletableFuture<SequenceResult> result;

    public SequenceRunner(SequenceController controller) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sequence-controller");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the sequence. Calling again returns the same future.
     *
     * @return Future completed with the sequence result, or exceptionally if
     *         the schedule could not be computed
     */
    public synchronized CompletableFuture<SequenceResult> start() {
        if (result != null) {
            log.warn("[{}] Sequence already started", controller.getConfig().asset());
            return result;
        }
        log.info("[{}] Starting sequence runner", controller.getConfig().asset());
        result = CompletableFuture.supplyAsync(controller::run, executor);
        return result;
    }

    /**
     * Ask the running sequence to stop at its next wait.
     */
    public void stop() {
        controller.stop();
    }

    /**
     * Stop the sequence and release the runner thread.
     */
    public void shutdown() {
        controller.stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[{}] Sequence runner stopped", controller.getConfig().asset());
    }

    public SequenceController getController() {
        return controller;
    }
}
