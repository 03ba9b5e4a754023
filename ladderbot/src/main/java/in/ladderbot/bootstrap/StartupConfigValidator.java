package in.ladderbot.bootstrap;

import in.ladderbot.config.SequenceConfig;
import in.ladderbot.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Runs before any collaborator is wired. Throws IllegalStateException if the
 * process must not start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * Validate the run mode and log the effective sequence configuration.
     *
     * @param config Loaded sequence config (already field-validated)
     * @throws IllegalStateException if the configuration cannot be run
     */
    public static void validate(SequenceConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        boolean orderExecutionEnabled = Env.getBool("ORDER_EXECUTION_ENABLED", false);
        if (orderExecutionEnabled) {
            throw new IllegalStateException(
                "INVALID CONFIG: ORDER_EXECUTION_ENABLED=true but no live venue is bundled\n" +
                "System refuses to start.\n" +
                "Either:\n" +
                "  1. Wire a live ActionSubmitter/OutcomePoller and start through it\n" +
                "  2. Set ORDER_EXECUTION_ENABLED=false for paper trading"
            );
        }
        log.warn("Order execution DISABLED - paper trading mode active");

        log.info("Asset: {} {}", config.asset(), config.direction());
        log.info("Stake: base={} multiplier={} levels={}",
            config.baseStake().toPlainString(), config.escalationMultiplier().toPlainString(), config.maxLevels());
        log.info("Entry: {} expiries: {} ({})", config.entryTime(), config.expiryTimes(), config.zone());
        log.info("Outcome polling: every {}ms, timeout {}ms",
            config.pollInterval().toMillis(), config.outcomeTimeout().toMillis());

        if (config.pollInterval().compareTo(config.outcomeTimeout()) >= 0) {
            log.warn("Poll interval {}ms is not shorter than the outcome timeout {}ms; each level gets a single poll",
                config.pollInterval().toMillis(), config.outcomeTimeout().toMillis());
        }

        log.info("Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {}
}
