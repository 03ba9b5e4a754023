package in.ladderbot.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.ladderbot.domain.sequence.Direction;
import in.ladderbot.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads {@link SequenceConfig} from a JSON document.
 *
 * Lookup order for {@link #loadFromEnvironment()}:
 * 1. File named by LADDER_CONFIG (env var or system property)
 * 2. Classpath resource ladder.json
 *
 * Scalar overrides: LADDER_ASSET, LADDER_DIRECTION, LADDER_BASE_STAKE.
 */
public final class SequenceConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SequenceConfigLoader.class);

    public static final String CONFIG_PATH_KEY = "LADDER_CONFIG";
    public static final String DEFAULT_RESOURCE = "ladder.json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Load from LADDER_CONFIG, falling back to the bundled classpath config.
     *
     * @throws IOException if the configured file cannot be read
     * @throws ScheduleException if the document is not a valid sequence config
     */
    public SequenceConfig loadFromEnvironment() throws IOException {
        String path = Env.get(CONFIG_PATH_KEY, null);
        if (path != null) {
            return load(Path.of(path));
        }

        try (InputStream in = SequenceConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ScheduleException(CONFIG_PATH_KEY,
                    "not set and no " + DEFAULT_RESOURCE + " on the classpath");
            }
            return load(in, "classpath:" + DEFAULT_RESOURCE);
        }
    }

    /**
     * Load from a file.
     */
    public SequenceConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    /**
     * Load from a stream. The stream is not closed.
     *
     * @param in JSON document
     * @param source Description of the source for log and error messages
     */
    public SequenceConfig load(InputStream in, String source) throws IOException {
        SequenceConfigDocument document;
        try {
            document = objectMapper.readValue(in, SequenceConfigDocument.class);
        } catch (JsonProcessingException e) {
            throw new ScheduleException("document", "cannot parse " + source + ": " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new ScheduleException("document", source + " is empty");
        }

        SequenceConfig config = toConfig(applyOverrides(document));
        log.info("Loaded sequence config from {}: asset={}, direction={}, levels={}",
            source, config.asset(), config.direction(), config.maxLevels());
        return config;
    }

    /**
     * Convert the raw document into a validated config.
     *
     * @throws ScheduleException on any missing or malformed field
     */
    public SequenceConfig toConfig(SequenceConfigDocument document) {
        List<LocalTime> expiries = new ArrayList<>();
        if (document.expiryTimes() != null) {
            for (String expiry : document.expiryTimes()) {
                expiries.add(parseTime("expiryTimes", expiry));
            }
        }

        int maxLevels = document.maxLevels() != null ? document.maxLevels() : expiries.size();

        return new SequenceConfig(
            document.asset(),
            parseDirection(document.direction()),
            document.baseStake(),
            document.escalationMultiplier() != null ? document.escalationMultiplier() : BigDecimal.valueOf(2),
            maxLevels,
            parseTime("entryTime", document.entryTime()),
            expiries,
            parseZone(document.timezone()),
            seconds("pollIntervalSeconds", document.pollIntervalSeconds(), SequenceConfig.DEFAULT_POLL_INTERVAL),
            seconds("outcomeTimeoutSeconds", document.outcomeTimeoutSeconds(), SequenceConfig.DEFAULT_OUTCOME_TIMEOUT)
        );
    }

    private SequenceConfigDocument applyOverrides(SequenceConfigDocument document) {
        String asset = Env.get("LADDER_ASSET", document.asset());
        String direction = Env.get("LADDER_DIRECTION", document.direction());
        BigDecimal baseStake = stakeOverride(document.baseStake());

        if (!Objects.equals(asset, document.asset())
                || !Objects.equals(direction, document.direction())
                || !Objects.equals(baseStake, document.baseStake())) {
            log.info("Applying environment overrides: asset={}, direction={}, baseStake={}",
                asset, direction, baseStake);
        }

        return new SequenceConfigDocument(asset, direction, baseStake, document.escalationMultiplier(),
            document.maxLevels(), document.entryTime(), document.expiryTimes(), document.timezone(),
            document.pollIntervalSeconds(), document.outcomeTimeoutSeconds());
    }

    private static BigDecimal stakeOverride(BigDecimal fromDocument) {
        String value = Env.get("LADDER_BASE_STAKE", null);
        if (value == null) {
            return fromDocument;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new ScheduleException("baseStake", "LADDER_BASE_STAKE is not a number: " + value, e);
        }
    }

    private static Direction parseDirection(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Direction.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ScheduleException("direction", e.getMessage(), e);
        }
    }

    private static LocalTime parseTime(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ScheduleException(field, "time-of-day must be set (HH:mm)");
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ScheduleException(field, "not a time-of-day (HH:mm): " + value, e);
        }
    }

    private static ZoneId parseZone(String value) {
        if (value == null || value.isBlank()) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new ScheduleException("timezone", "unknown zone id: " + value, e);
        }
    }

    private static Duration seconds(String field, Double value, Duration defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value.isNaN() || value <= 0) {
            throw new ScheduleException(field, "must be > 0, got " + value);
        }
        return Duration.ofMillis(Math.round(value * 1000));
    }
}
