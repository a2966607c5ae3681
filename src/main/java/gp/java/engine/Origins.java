package gp.java.engine;

/**
 * Origin key checks shared by the engine entry points.
 */
final class Origins {

    private Origins() {
        // Utility class, no instantiation
    }

    /**
     * Origin keys are opaque, pre-normalized strings. The empty string is reserved
     * for "no request in progress", so it is never a valid key.
     *
     * @throws IllegalArgumentException if origin is null or empty
     */
    static String requireValid(String origin) {
        if (origin == null) {
            throw new IllegalArgumentException("origin cannot be null");
        }
        if (origin.isEmpty()) {
            throw new IllegalArgumentException("origin must not be empty");
        }
        return origin;
    }
}
