package work.lcod.spatial.interchange;

import java.util.List;

/**
 * One exported element: its geometry plus attribute and texture lists.
 *
 * @param kind  interchange element type, e.g. {@code SurfaceElement}
 * @param color raw {@code [r, g, b]} default color, {@code null} when the color is data-driven
 */
public record InterchangeElement(
    String kind,
    String name,
    String description,
    Geometry geometry,
    List<InterchangeData> data,
    List<ImageTexture> textures,
    List<Integer> color
) {
    public InterchangeElement {
        data = List.copyOf(data);
        textures = List.copyOf(textures);
    }
}
