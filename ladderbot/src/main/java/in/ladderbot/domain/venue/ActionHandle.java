package in.ladderbot.domain.venue;

/**
 * Opaque venue identifier of a submitted action.
 */
public record ActionHandle(String id) {
    public ActionHandle {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Action id cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
