package work.lcod.spatial.validation;

/**
 * Exception carrying the reason, field path and offending instance of a failed check.
 */
public final class ValidationException extends RuntimeException {
    private final Reason reason;
    private final String field;
    private final transient Object instance;

    public ValidationException(Reason reason, String field, String message, Object instance) {
        super(message);
        this.reason = reason;
        this.field = field;
        this.instance = instance;
    }

    public static ValidationException invalid(String field, String message, Object instance) {
        return new ValidationException(Reason.INVALID, field, message, instance);
    }

    public static ValidationException missing(String field, String message, Object instance) {
        return new ValidationException(Reason.MISSING, field, message, instance);
    }

    public Reason reason() {
        return reason;
    }

    public String field() {
        return field;
    }

    public Object instance() {
        return instance;
    }

    /**
     * Re-raises a nested failure under the owner's field path, keeping the original instance.
     */
    public ValidationException under(String parentPath) {
        if (parentPath == null || parentPath.isEmpty()) {
            return this;
        }
        String path = field == null || field.isEmpty() ? parentPath : parentPath + "." + field;
        var wrapped = new ValidationException(reason, path, getMessage(), instance);
        wrapped.initCause(this);
        return wrapped;
    }

    @Override
    public String toString() {
        return "ValidationException{" + reason.wireName() + ", field=" + field + ", message=" + getMessage() + "}";
    }
}
