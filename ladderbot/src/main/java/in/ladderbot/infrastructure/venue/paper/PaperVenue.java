package in.ladderbot.infrastructure.venue.paper;

import in.ladderbot.domain.sequence.Direction;
import in.ladderbot.domain.venue.ActionHandle;
import in.ladderbot.domain.venue.PollOutcome;
import in.ladderbot.domain.venue.SubmissionResult;
import in.ladderbot.infrastructure.venue.ActionSubmitter;
import in.ladderbot.infrastructure.venue.OutcomePoller;
import in.ladderbot.infrastructure.venue.PollException;
import in.ladderbot.service.sequence.SequenceClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process simulated venue for paper trading.
 *
 * Every well-formed submission is accepted. Its outcome is drawn from a seeded
 * random source at submission time and stays hidden (PENDING) until the
 * action expires on the venue clock.
 */
public final class PaperVenue implements ActionSubmitter, OutcomePoller {
    private static final Logger log = LoggerFactory.getLogger(PaperVenue.class);

    private final SequenceClock clock;
    private final double winProbability;
    private final Random random;

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, PaperAction> actions = new ConcurrentHashMap<>();
    private final List<PaperAction> history = new CopyOnWriteArrayList<>();

    public PaperVenue(SequenceClock clock, double winProbability, long seed) {
        if (winProbability < 0.0 || winProbability > 1.0) {
            throw new IllegalArgumentException("Win probability must be within [0, 1], got " + winProbability);
        }
        this.clock = clock;
        this.winProbability = winProbability;
        this.random = new Random(seed);
    }

    @Override
    public synchronized SubmissionResult submit(String asset, Direction direction, BigDecimal stake, int durationMinutes) {
        if (stake == null || stake.signum() <= 0) {
            return SubmissionResult.rejected("stake must be positive");
        }
        if (durationMinutes <= 0) {
            return SubmissionResult.rejected("duration must be positive");
        }

        Instant now = clock.now();
        ActionHandle handle = new ActionHandle("paper-" + sequence.incrementAndGet());
        boolean win = random.nextDouble() < winProbability;
        PaperAction action = new PaperAction(handle, asset, direction, stake, now,
            now.plus(Duration.ofMinutes(durationMinutes)), win ? PollOutcome.WIN : PollOutcome.LOSS);
        actions.put(handle.id(), action);
        history.add(action);

        log.info("[PAPER] {} {} {} stake={} expires={}", handle, asset, direction, stake.toPlainString(), action.expiresAt());
        return SubmissionResult.accepted(handle);
    }

    @Override
    public PollOutcome poll(ActionHandle handle) throws PollException {
        PaperAction action = actions.get(handle.id());
        if (action == null) {
            throw new PollException(handle, "unknown paper action");
        }
        return clock.now().isBefore(action.expiresAt()) ? PollOutcome.PENDING : action.outcome();
    }

    /**
     * Actions submitted so far, in submission order.
     */
    public List<PaperAction> getActions() {
        return List.copyOf(history);
    }

    /**
     * A simulated action.
     */
    public record PaperAction(
        ActionHandle handle,
        String asset,
        Direction direction,
        BigDecimal stake,
        Instant submittedAt,
        Instant expiresAt,
        PollOutcome outcome
    ) {}
}
