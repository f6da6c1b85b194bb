package work.lcod.spatial.interchange;

import java.util.List;

/**
 * Values for category indices: colors as {@code [r, g, b]}, numbers or labels.
 */
public record Legend(String name, String description, List<?> values) {}
