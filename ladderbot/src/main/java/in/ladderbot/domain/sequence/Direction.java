package in.ladderbot.domain.sequence;

/**
 * Direction of a submitted action.
 */
public enum Direction {
    UP,
    DOWN;

    /**
     * Parse a direction, accepting the common venue aliases CALL/PUT.
     *
     * @param value Direction text (case-insensitive)
     * @return Parsed direction
     * @throws IllegalArgumentException if the value is not a known direction
     */
    public static Direction parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Direction cannot be null or empty");
        }
        switch (value.trim().toUpperCase()) {
            case "UP":
            case "CALL":
                return UP;
            case "DOWN":
            case "PUT":
                return DOWN;
            default:
                throw new IllegalArgumentException("Unknown direction: " + value);
        }
    }
}
