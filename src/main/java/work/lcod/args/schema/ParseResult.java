package work.lcod.args.schema;

/**
 * Outcome of a {@link ScalarParser}: either a parsed value (possibly {@code null}) or a rejection reason.
 */
public record ParseResult(boolean ok, Object value, String reason) {
    public ParseResult {
        if (!ok && (reason == null || reason.isBlank())) {
            reason = "invalid value";
        }
    }

    public static ParseResult ok(Object value) {
        return new ParseResult(true, value, null);
    }

    public static ParseResult failure(String reason) {
        return new ParseResult(false, null, reason);
    }
}
