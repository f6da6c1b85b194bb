package work.lcod.spatial.interchange;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.spatial.data.Attachment;
import work.lcod.spatial.data.DataBasic;
import work.lcod.spatial.data.DataCategory;
import work.lcod.spatial.data.Location;
import work.lcod.spatial.element.Element;
import work.lcod.spatial.element.LineSet;
import work.lcod.spatial.element.PointSet;
import work.lcod.spatial.element.Surface;
import work.lcod.spatial.element.SurfaceGrid;
import work.lcod.spatial.element.VolumeGrid;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.files.ImageDescriptor;
import work.lcod.spatial.mapping.MappingCategory;
import work.lcod.spatial.mapping.MappingValues;
import work.lcod.spatial.options.ChannelOptions;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.shared.Vector3;
import work.lcod.spatial.texture.TextureProjection;
import work.lcod.spatial.validation.ValidationException;

/**
 * Lowers a validated, fully resolved element into the interchange model.
 *
 * <p>Validation tolerates unresolved references; export does not. Every reference read here
 * must be resolved and every array or image copied must be materialized, otherwise a
 * {@code missing} failure is raised.
 */
public final class InterchangeExporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(InterchangeExporter.class);

    private InterchangeExporter() {}

    public static InterchangeElement toInterchange(Element element) {
        element.validate();
        LOGGER.debug("exporting {}", element);
        List<InterchangeData> data = new ArrayList<>();
        List<ImageTexture> textures = new ArrayList<>();
        String cellTag = cellTag(element);
        for (int i = 0; i < element.data().size(); i++) {
            String field = "data[" + i + "]";
            Attachment attachment = element.data().get(i).require(field, element);
            try {
                if (attachment instanceof TextureProjection texture) {
                    textures.add(texture(texture));
                } else if (attachment instanceof DataBasic basic) {
                    data.add(data(basic, basic.location() == Location.NODES ? "vertices" : cellTag));
                }
            } catch (ValidationException ex) {
                throw ex.under(field);
            }
        }
        return new InterchangeElement(
            kind(element),
            text(element.name()),
            text(element.description()),
            geometry(element),
            data,
            textures,
            color(element.defaults().color())
        );
    }

    /**
     * Location tag of cell-bound data for each element kind.
     */
    static String cellTag(Element element) {
        if (element instanceof LineSet) {
            return "segments";
        }
        if (element instanceof Surface || element instanceof SurfaceGrid) {
            return "faces";
        }
        if (element instanceof VolumeGrid) {
            return "cells";
        }
        return "vertices";
    }

    private static String kind(Element element) {
        if (element instanceof PointSet) {
            return "PointSetElement";
        }
        if (element instanceof LineSet) {
            return "LineSetElement";
        }
        if (element instanceof VolumeGrid) {
            return "VolumeElement";
        }
        return "SurfaceElement";
    }

    private static Geometry geometry(Element element) {
        if (element instanceof PointSet points) {
            return new Geometry.PointSetGeometry(materialized(points.vertices(), "vertices", element).rows());
        }
        if (element instanceof LineSet lines) {
            return new Geometry.LineSetGeometry(
                materialized(lines.vertices(), "vertices", element).rows(),
                indexRows(materialized(lines.segments(), "segments", element), "segments", element)
            );
        }
        if (element instanceof Surface surface) {
            return new Geometry.SurfaceGeometry(
                materialized(surface.vertices(), "vertices", element).rows(),
                indexRows(materialized(surface.triangles(), "triangles", element), "triangles", element)
            );
        }
        if (element instanceof SurfaceGrid grid) {
            double[] offsetW = grid.offsetW() == null ? null : materialized(grid.offsetW(), "offset_w", element).values();
            return new Geometry.SurfaceGridGeometry(
                grid.origin().toArray(),
                grid.axisU().toArray(),
                grid.axisV().toArray(),
                toArray(grid.tensorU()),
                toArray(grid.tensorV()),
                offsetW
            );
        }
        if (element instanceof VolumeGrid grid) {
            return new Geometry.VolumeGridGeometry(
                grid.origin().toArray(),
                grid.axisU().toArray(),
                grid.axisV().toArray(),
                grid.axisW().toArray(),
                toArray(grid.tensorU()),
                toArray(grid.tensorV()),
                toArray(grid.tensorW())
            );
        }
        throw new IllegalArgumentException("Unsupported element type: " + element.getClass().getName());
    }

    private static InterchangeData data(DataBasic data, String location) {
        ArrayDescriptor array = materialized(data.array(), "array", data);
        if (data instanceof DataCategory category) {
            List<Legend> legends = new ArrayList<>();
            legends.add(legend(category.categories().require("categories", category)));
            for (int i = 0; i < category.mappings().size(); i++) {
                String field = "mappings[" + i + "]";
                legends.add(legend((MappingCategory) category.mappings().get(i).require(field, category)));
            }
            return new InterchangeData.MappedData(
                text(data.name()),
                text(data.description()),
                location,
                indices(array, "array", data),
                legends
            );
        }
        return new InterchangeData.ScalarData(text(data.name()), text(data.description()), location, array.values());
    }

    private static Legend legend(MappingCategory mapping) {
        return new Legend(text(mapping.name()), text(mapping.description()), legendValues(mapping.values()));
    }

    private static List<?> legendValues(MappingValues values) {
        if (values instanceof MappingValues.Colors colors) {
            return colors.items().stream().map(InterchangeExporter::rgb).toList();
        }
        return values == null ? List.of() : values.items();
    }

    private static ImageTexture texture(TextureProjection texture) {
        ImageDescriptor image = texture.image().require("image", texture);
        if (!image.isMaterialized()) {
            throw ValidationException.missing("image", "The 'image' file must be materialized for export", texture);
        }
        return new ImageTexture(
            text(texture.name()),
            text(texture.description()),
            vector(texture.origin()),
            vector(texture.axisU()),
            vector(texture.axisV()),
            image.contentType(),
            image.content()
        );
    }

    private static List<Integer> color(ChannelOptions<Color> color) {
        if (color == null || color.data() != null || color.value() == null) {
            return null;
        }
        return rgb(color.value());
    }

    private static List<Integer> rgb(Color color) {
        return List.of(color.red(), color.green(), color.blue());
    }

    private static ArrayDescriptor materialized(Ref<ArrayDescriptor> ref, String field, Object owner) {
        if (ref == null) {
            throw ValidationException.missing(field, "The '" + field + "' property is required", owner);
        }
        ArrayDescriptor array = ref.require(field, owner);
        if (!array.isMaterialized()) {
            throw ValidationException.missing(field, "The '" + field + "' array must be materialized for export", owner);
        }
        return array;
    }

    private static double[] vector(Vector3 value) {
        return value == null ? null : value.toArray();
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static int[] indices(ArrayDescriptor array, String field, Object owner) {
        try {
            return array.intValues();
        } catch (IllegalStateException ex) {
            throw ValidationException.invalid(field, ex.getMessage(), owner);
        }
    }

    private static int[][] indexRows(ArrayDescriptor array, String field, Object owner) {
        try {
            return array.intRows();
        } catch (IllegalStateException ex) {
            throw ValidationException.invalid(field, ex.getMessage(), owner);
        }
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }
}
