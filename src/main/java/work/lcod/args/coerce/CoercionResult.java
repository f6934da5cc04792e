package work.lcod.args.coerce;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of coercing one position: a value (which may be an explicit {@code null}), "absent", or failures.
 */
public final class CoercionResult {
    private static final CoercionResult ABSENT = new CoercionResult(State.ABSENT, null, List.of());
    private static final CoercionResult NULL = new CoercionResult(State.VALUE, null, List.of());

    private final State state;
    private final Object value;
    private final List<CoercionFailure> failures;

    private CoercionResult(State state, Object value, List<CoercionFailure> failures) {
        this.state = state;
        this.value = value;
        this.failures = failures;
    }

    public static CoercionResult of(Object value) {
        return value == null ? NULL : new CoercionResult(State.VALUE, value, List.of());
    }

    public static CoercionResult absent() {
        return ABSENT;
    }

    public static CoercionResult failed(CoercionFailure failure) {
        return new CoercionResult(State.FAILED, null, List.of(Objects.requireNonNull(failure, "failure")));
    }

    public static CoercionResult failed(List<CoercionFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("A failed result needs at least one failure");
        }
        return new CoercionResult(State.FAILED, null, List.copyOf(failures));
    }

    public boolean isAbsent() {
        return state == State.ABSENT;
    }

    public boolean isFailed() {
        return state == State.FAILED;
    }

    public boolean hasValue() {
        return state == State.VALUE;
    }

    public Object value() {
        if (state != State.VALUE) {
            throw new IllegalStateException("No value in a " + state + " result");
        }
        return value;
    }

    public List<CoercionFailure> failures() {
        return failures;
    }

    @Override
    public String toString() {
        switch (state) {
            case VALUE:
                return "Value(" + value + ")";
            case ABSENT:
                return "Absent";
            default:
                return "Failed" + failures;
        }
    }

    private enum State {
        VALUE,
        ABSENT,
        FAILED
    }
}
