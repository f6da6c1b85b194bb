package work.lcod.spatial.validation;

/**
 * Object taking part in graph validation.
 *
 * <p>{@link #checkFields()} re-runs the field-local checks also applied by setters,
 * {@link #checkObject()} holds the cross-field and cross-object invariants, and
 * {@link #visitChildren(ChildVisitor)} exposes owned references and embedded values.
 */
public interface Validatable {
    default void checkFields() {}

    default void checkObject() {}

    default void visitChildren(ChildVisitor visitor) {}

    /**
     * Validates this object and everything reachable from it through resolved references.
     *
     * @return always {@code true}; failures raise {@link ValidationException}
     */
    default boolean validate() {
        return GraphValidator.validate(this);
    }

    @FunctionalInterface
    interface ChildVisitor {
        /**
         * @param path  field path relative to the owner, e.g. {@code data[2]}
         * @param child a {@link work.lcod.spatial.ref.Ref}, a {@link Validatable} or {@code null}
         */
        void visit(String path, Object child);
    }
}
