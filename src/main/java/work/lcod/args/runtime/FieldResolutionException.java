package work.lcod.args.runtime;

/**
 * Raised by resolvers (or result serialization) to fail a single field with a user-visible message.
 */
public class FieldResolutionException extends RuntimeException {
    private final String code;

    public FieldResolutionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
