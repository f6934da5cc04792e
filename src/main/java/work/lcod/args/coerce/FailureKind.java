package work.lcod.args.coerce;

/**
 * Classification of coercion failures. Every kind is a user-input error, never an engine fault.
 */
public enum FailureKind {
    MISSING_REQUIRED_VARIABLE("MissingRequiredVariable"),
    VALUE_REQUIRED("ValueRequired"),
    SCALAR_COERCION_FAILED("ScalarCoercionFailed"),
    INVALID_ENUM_VALUE("InvalidEnumValue"),
    SHAPE_MISMATCH("ShapeMismatch"),
    UNDEFINED_VARIABLE("UndefinedVariable");

    private final String code;

    FailureKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
