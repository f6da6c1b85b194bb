package work.lcod.spatial.validation;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.spatial.ref.Ref;

/**
 * Depth-first walk over a resource graph.
 *
 * <p>Each node runs its field checks, then every resolved child, then its object checks.
 * Unresolved references are skipped. A node reached twice in one call is validated once.
 */
public final class GraphValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphValidator.class);

    private GraphValidator() {}

    public static boolean validate(Validatable root) {
        Objects.requireNonNull(root, "root");
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        visit(root, seen);
        return true;
    }

    private static void visit(Validatable node, Set<Object> seen) {
        if (!seen.add(node)) {
            return;
        }
        LOGGER.debug("validating {}", node.getClass().getSimpleName());
        node.checkFields();
        node.visitChildren((path, child) -> {
            Validatable next = unwrap(child);
            if (next == null) {
                return;
            }
            try {
                visit(next, seen);
            } catch (ValidationException ex) {
                throw ex.under(path);
            }
        });
        node.checkObject();
    }

    private static Validatable unwrap(Object child) {
        if (child instanceof Ref<?> ref) {
            return ref.value().filter(Validatable.class::isInstance).map(Validatable.class::cast).orElse(null);
        }
        if (child instanceof Validatable validatable) {
            return validatable;
        }
        return null;
    }
}
