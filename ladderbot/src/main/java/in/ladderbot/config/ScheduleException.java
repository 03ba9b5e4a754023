package in.ladderbot.config;

/**
 * Thrown when a sequence configuration cannot produce a valid schedule.
 * Always raised before any action is submitted.
 */
public class ScheduleException extends RuntimeException {

    private final String field;

    public ScheduleException(String field, String message) {
        super(String.format("Invalid sequence config [%s]: %s", field, message));
        this.field = field;
    }

    public ScheduleException(String field, String message, Throwable cause) {
        super(String.format("Invalid sequence config [%s]: %s", field, message), cause);
        this.field = field;
    }

    /**
     * Name of the offending configuration field.
     */
    public String getField() {
        return field;
    }
}
