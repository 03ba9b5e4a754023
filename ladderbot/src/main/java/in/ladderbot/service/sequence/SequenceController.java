package in.ladderbot.service.sequence;

import in.ladderbot.config.SequenceConfig;
import in.ladderbot.domain.sequence.AttemptOutcome;
import in.ladderbot.domain.sequence.AttemptRecord;
import in.ladderbot.domain.sequence.FinalOutcome;
import in.ladderbot.domain.sequence.ScheduleEntry;
import in.ladderbot.domain.sequence.SequenceResult;
import in.ladderbot.domain.sequence.SequenceSchedule;
import in.ladderbot.domain.sequence.SequenceState;
import in.ladderbot.domain.sequence.TerminalReason;
import in.ladderbot.domain.venue.ActionHandle;
import in.ladderbot.domain.venue.PollOutcome;
import in.ladderbot.domain.venue.SubmissionResult;
import in.ladderbot.infrastructure.metrics.SequenceMetrics;
import in.ladderbot.infrastructure.venue.ActionSubmitter;
import in.ladderbot.infrastructure.venue.OutcomePoller;
import in.ladderbot.infrastructure.venue.PollException;
import in.ladderbot.infrastructure.venue.SubmissionException;
import in.ladderbot.service.schedule.SequenceScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one escalation sequence to completion.
 *
 * State machine:
 * <pre>
 * PENDING_ENTRY -> ACTION_SUBMITTED -> AWAITING_OUTCOME -> ESCALATE | SUCCEED | ABORT
 * </pre>
 *
 * Timing is self-chaining: level 1 is submitted at the schedule's entry time,
 * level k (k > 1) at level k-1's expiry, which is the moment the loss that
 * triggered the escalation was determined.
 *
 * Failure handling:
 * - Submission rejected or failed: ABORT (SUBMISSION_FAILED), never retried
 * - Poll errors: retried at the poll interval until the outcome timeout
 * - No outcome within the timeout: ABORT (OUTCOME_TIMEOUT), not treated as a loss
 * - Stop signal or interrupt at either wait: ABORT (CANCELLED); an action
 *   already accepted by the venue is left as is
 *
 * A controller runs a single sequence once, on the calling thread.
 */
public final class SequenceController {
    private static final Logger log = LoggerFactory.getLogger(SequenceController.class);

    /** Every action is submitted with a fixed one-minute duration. */
    public static final int ACTION_DURATION_MINUTES = 1;

    private final SequenceConfig config;
    private final ActionSubmitter submitter;
    private final OutcomePoller poller;
    private final SequenceScheduler scheduler;
    private final SequenceClock clock;
    private final SequenceMetrics metrics;
    private final StopSignal stop;

    private final List<AttemptRecord> attempts = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile SequenceState state = SequenceState.PENDING_ENTRY;
    private volatile int currentLevel = 0;
    private volatile SequenceSchedule schedule;

    /**
     * Create a controller on the system clock without metrics.
     */
    public SequenceController(SequenceConfig config, ActionSubmitter submitter, OutcomePoller poller) {
        this(config, submitter, poller, new SequenceScheduler(), SequenceClock.system(),
            SequenceMetrics.noop(), new StopSignal());
    }

    public SequenceController(
            SequenceConfig config,
            ActionSubmitter submitter,
            OutcomePoller poller,
            SequenceScheduler scheduler,
            SequenceClock clock,
            SequenceMetrics metrics,
            StopSignal stop) {
        this.config = Objects.requireNonNull(config, "config");
        this.submitter = Objects.requireNonNull(submitter, "submitter");
        this.poller = Objects.requireNonNull(poller, "poller");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.stop = Objects.requireNonNull(stop, "stop");
    }

    /**
     * Run the sequence on the calling thread until a terminal state.
     *
     * @return Terminal summary, never null
     * @throws in.ladderbot.config.ScheduleException if no schedule can be computed
     *         (raised before any submission)
     * @throws IllegalStateException if this controller has already run
     */
    public SequenceResult run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Sequence for " + config.asset() + " has already run");
        }

        Instant startedAt = clock.now();
        SequenceSchedule computed = scheduler.schedule(config, startedAt);
        this.schedule = computed;
        logSchedule(computed);

        try {
            for (int level = 1; level <= computed.levelCount(); level++) {
                ScheduleEntry entry = computed.level(level);
                Instant dueAt = computed.submissionDueAt(level);

                currentLevel = level;
                state = SequenceState.PENDING_ENTRY;
                metrics.recordLevel(config.asset(), level);
                log.debug("[{}:L{}] Waiting for entry at {}", config.asset(), level, zoned(dueAt));

                if (!clock.sleepUntil(dueAt, stop)) {
                    return finish(TerminalReason.CANCELLED, FinalOutcome.ABORTED,
                        "Stopped before level " + level + " entry", startedAt);
                }

                BigDecimal stake = entry.stakeFor(config.baseStake());
                AttemptRecord attempt = new AttemptRecord(level, stake, clock.now());
                attempts.add(attempt);

                String failure = submit(attempt, dueAt);
                if (failure != null) {
                    return finish(TerminalReason.SUBMISSION_FAILED, FinalOutcome.ABORTED, failure, startedAt);
                }
                state = SequenceState.AWAITING_OUTCOME;
                PollVerdict verdict = awaitOutcome(attempt);

                switch (verdict) {
                    case WIN:
                        resolve(attempt, AttemptOutcome.WIN);
                        return finish(TerminalReason.WON, FinalOutcome.WIN, null, startedAt);

                    case LOSS:
                        resolve(attempt, AttemptOutcome.LOSS);
                        if (level == computed.levelCount()) {
                            return finish(TerminalReason.MAX_LEVELS_REACHED, FinalOutcome.LOSS, null, startedAt);
                        }
                        state = SequenceState.ESCALATE;
                        log.info("[{}:L{}] Lost, escalating to level {} at {} with stake {}",
                            config.asset(), level, level + 1, zoned(entry.dueAt()),
                            computed.level(level + 1).stakeFor(config.baseStake()).toPlainString());
                        break;

                    case TIMEOUT:
                        return finish(TerminalReason.OUTCOME_TIMEOUT, FinalOutcome.ABORTED,
                            "No outcome for action " + attempt.getActionId().map(ActionHandle::id).orElse("-")
                                + " within " + config.outcomeTimeout().toMillis() + "ms",
                            startedAt);

                    case CANCELLED:
                        return finish(TerminalReason.CANCELLED, FinalOutcome.ABORTED,
                            "Stopped while awaiting outcome of level " + level, startedAt);

                    default:
                        throw new IllegalStateException("Unhandled verdict " + verdict);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(TerminalReason.CANCELLED, FinalOutcome.ABORTED,
                "Interrupted at level " + currentLevel, startedAt);
        }

        // The last level always returns from the loop above
        throw new IllegalStateException("Sequence ended without a terminal state");
    }

    /**
     * Raise the stop signal. The sequence ends as CANCELLED at its next wait.
     */
    public void stop() {
        log.info("[{}] Stop requested at level {} ({})", config.asset(), currentLevel, state);
        stop.raise();
    }

    public SequenceState getState() {
        return state;
    }

    /**
     * Level being worked on, 0 before the sequence starts.
     */
    public int getCurrentLevel() {
        return currentLevel;
    }

    /**
     * Computed schedule, null until {@link #run()} has started.
     */
    public SequenceSchedule getSchedule() {
        return schedule;
    }

    public SequenceConfig getConfig() {
        return config;
    }

    /**
     * Submit the attempt's action.
     *
     * @return null when accepted, otherwise the failure description
     */
    private String submit(AttemptRecord attempt, Instant dueAt) {
        int level = attempt.getLevel();
        Instant submitStart = clock.now();

        log.info("[{}:L{}] Submitting {} stake={} duration={}m (due {}, actual {})",
            config.asset(), level, config.direction(), attempt.getStake().toPlainString(),
            ACTION_DURATION_MINUTES, zoned(dueAt), zoned(attempt.getSubmittedAt()));

        state = SequenceState.ACTION_SUBMITTED;
        SubmissionResult result;
        try {
            result = submitter.submit(config.asset(), config.direction(), attempt.getStake(), ACTION_DURATION_MINUTES);
        } catch (SubmissionException e) {
            metrics.recordSubmission(config.asset(), level, false, Duration.between(submitStart, clock.now()));
            log.error("[{}:L{}] Submission failed: {}", config.asset(), level, e.getReason());
            return e.getMessage();
        } catch (RuntimeException e) {
            metrics.recordSubmission(config.asset(), level, false, Duration.between(submitStart, clock.now()));
            log.error("[{}:L{}] Unexpected submission error", config.asset(), level, e);
            return "Unexpected submission error: " + e;
        }

        Duration latency = Duration.between(submitStart, clock.now());

        if (result == null) {
            metrics.recordSubmission(config.asset(), level, false, latency);
            log.error("[{}:L{}] Submitter returned no result", config.asset(), level);
            return "Submitter returned no result";
        }

        if (!result.accepted()) {
            metrics.recordSubmission(config.asset(), level, false, latency);
            log.error("[{}:L{}] Venue rejected action: {}", config.asset(), level, result.rejectionReason());
            return "Rejected by venue: " + result.rejectionReason();
        }

        attempt.accepted(result.handle());
        metrics.recordSubmission(config.asset(), level, true, latency);
        log.info("[{}:L{}] Accepted as {} in {}ms", config.asset(), level, result.handle(), latency.toMillis());
        return null;
    }

    /**
     * Poll until WIN/LOSS, the outcome timeout, or a stop.
     */
    private PollVerdict awaitOutcome(AttemptRecord attempt) throws InterruptedException {
        ActionHandle handle = attempt.getActionId()
            .orElseThrow(() -> new IllegalStateException("Level " + attempt.getLevel() + " has no action"));
        Instant deadline = clock.now().plus(config.outcomeTimeout());
        int polls = 0;
        int errors = 0;

        while (true) {
            if (stop.isRaised()) {
                return PollVerdict.CANCELLED;
            }

            polls++;
            try {
                PollOutcome outcome = poller.poll(handle);
                if (outcome == PollOutcome.WIN) {
                    return PollVerdict.WIN;
                }
                if (outcome == PollOutcome.LOSS) {
                    return PollVerdict.LOSS;
                }
            } catch (PollException e) {
                errors++;
                metrics.recordPollError(config.asset());
                log.warn("[{}:L{}] {} (poll {}, retrying)", config.asset(), attempt.getLevel(), e.getMessage(), polls);
            } catch (RuntimeException e) {
                errors++;
                metrics.recordPollError(config.asset());
                log.warn("[{}:L{}] Unexpected poll error for {} (poll {}, retrying)",
                    config.asset(), attempt.getLevel(), handle, polls, e);
            }

            Instant now = clock.now();
            if (!now.isBefore(deadline)) {
                log.warn("[{}:L{}] No outcome for {} after {} polls ({} errors)",
                    config.asset(), attempt.getLevel(), handle, polls, errors);
                return PollVerdict.TIMEOUT;
            }

            Instant next = now.plus(config.pollInterval());
            if (next.isAfter(deadline)) {
                next = deadline;
            }
            if (!clock.sleepUntil(next, stop)) {
                return PollVerdict.CANCELLED;
            }
        }
    }

    private void resolve(AttemptRecord attempt, AttemptOutcome outcome) {
        attempt.resolve(outcome, clock.now());
        metrics.recordOutcome(config.asset(), attempt.getLevel(), outcome);
        log.info("[{}:L{}] Outcome {} for {}", config.asset(), attempt.getLevel(), outcome,
            attempt.getActionId().map(ActionHandle::id).orElse("-"));
    }

    private SequenceResult finish(TerminalReason reason, FinalOutcome outcome, String detail, Instant startedAt) {
        Instant finishedAt = clock.now();

        for (AttemptRecord attempt : attempts) {
            if (!attempt.isResolved()) {
                attempt.resolve(AttemptOutcome.UNKNOWN, finishedAt);
                metrics.recordOutcome(config.asset(), attempt.getLevel(), AttemptOutcome.UNKNOWN);
            }
        }

        state = outcome == FinalOutcome.WIN ? SequenceState.SUCCEED : SequenceState.ABORT;
        SequenceResult result = new SequenceResult(
            attempts.size(), reason, outcome, detail, attempts, startedAt, finishedAt);
        metrics.recordSequenceEnd(config.asset(), reason, attempts.size());

        if (reason == TerminalReason.WON) {
            log.info("[{}] Sequence finished: {} at level {}/{}",
                config.asset(), outcome, result.levelsAttempted(), config.maxLevels());
        } else {
            log.warn("[{}] Sequence finished: {} ({}) after {}/{} levels{}",
                config.asset(), outcome, reason, result.levelsAttempted(), config.maxLevels(),
                detail == null ? "" : ": " + detail);
        }
        return result;
    }

    private void logSchedule(SequenceSchedule computed) {
        log.info("[{}] Sequence {} base={} x{} levels={} entry={}",
            config.asset(), config.direction(), config.baseStake().toPlainString(),
            config.escalationMultiplier().toPlainString(), computed.levelCount(), zoned(computed.entryAt()));
        for (ScheduleEntry entry : computed.entries()) {
            log.info("[{}:L{}]   expiry={} stake={}", config.asset(), entry.sequenceLevel(),
                zoned(entry.dueAt()), entry.stakeFor(config.baseStake()).toPlainString());
        }
    }

    private String zoned(Instant instant) {
        return instant.atZone(config.zone()).toLocalDateTime().toString();
    }

    private enum PollVerdict {
        WIN,
        LOSS,
        TIMEOUT,
        CANCELLED
    }
}
