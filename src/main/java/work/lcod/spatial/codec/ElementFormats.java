package work.lcod.spatial.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.function.Function;
import work.lcod.spatial.element.Element;
import work.lcod.spatial.element.LineSet;
import work.lcod.spatial.element.PointSet;
import work.lcod.spatial.element.Surface;
import work.lcod.spatial.element.SurfaceGrid;
import work.lcod.spatial.element.VolumeGrid;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.runtime.ResourceRegistry;
import work.lcod.spatial.runtime.ResourceType;

/**
 * Wire formats of elements. Element {@code defaults} are embedded like a resolved reference:
 * inline, or as a JSON string in snapshot mode.
 */
public final class ElementFormats {
    private ElementFormats() {}

    public static ResourceRegistry register(ResourceRegistry registry) {
        registry.register(new ResourceType<>(
            PointSet.TYPE,
            PointSet.class,
            "Point set defined by an array of vertices",
            ElementFormats::readPointSet,
            ElementFormats::writePointSet
        ));
        registry.register(new ResourceType<>(
            LineSet.TYPE,
            LineSet.class,
            "Line set defined by vertices and segments",
            ElementFormats::readLineSet,
            ElementFormats::writeLineSet
        ));
        registry.register(new ResourceType<>(
            Surface.TYPE,
            Surface.class,
            "Surface defined by vertices and triangles",
            ElementFormats::readSurface,
            ElementFormats::writeSurface
        ));
        registry.register(new ResourceType<>(
            SurfaceGrid.TYPE,
            SurfaceGrid.class,
            "Surface defined by a 2D grid of cell widths",
            ElementFormats::readSurfaceGrid,
            ElementFormats::writeSurfaceGrid
        ));
        registry.register(new ResourceType<>(
            VolumeGrid.TYPE,
            VolumeGrid.class,
            "Volume defined by a 3D grid of cell widths",
            ElementFormats::readVolumeGrid,
            ElementFormats::writeVolumeGrid
        ));
        return registry;
    }

    static PointSet readPointSet(ObjectNode node, ResourceCodec codec) {
        var element = new PointSet();
        element.setVertices(codec.ref(node, "vertices", ArrayDescriptor.class));
        readData(element, node, codec);
        Fields.ifPresent(defaults(node, codec, raw -> OptionsFormats.readPoints(raw, codec)), element::setDefaults);
        return element;
    }

    static void writePointSet(PointSet element, ObjectNode out, ResourceCodec codec) {
        codec.putRef(out, "vertices", element.vertices());
        writeData(element, out, codec);
        out.set("defaults", codec.snapshot(OptionsFormats.writePoints(element.defaults(), codec)));
    }

    static LineSet readLineSet(ObjectNode node, ResourceCodec codec) {
        var element = new LineSet();
        element.setVertices(codec.ref(node, "vertices", ArrayDescriptor.class));
        element.setSegments(codec.ref(node, "segments", ArrayDescriptor.class));
        readData(element, node, codec);
        Fields.ifPresent(defaults(node, codec, raw -> OptionsFormats.readLineSet(raw, codec)), element::setDefaults);
        return element;
    }

    static void writeLineSet(LineSet element, ObjectNode out, ResourceCodec codec) {
        codec.putRef(out, "vertices", element.vertices());
        codec.putRef(out, "segments", element.segments());
        writeData(element, out, codec);
        out.set("defaults", codec.snapshot(OptionsFormats.writeLineSet(element.defaults(), codec)));
    }

    static Surface readSurface(ObjectNode node, ResourceCodec codec) {
        var element = new Surface();
        element.setVertices(codec.ref(node, "vertices", ArrayDescriptor.class));
        element.setTriangles(codec.ref(node, "triangles", ArrayDescriptor.class));
        readData(element, node, codec);
        Fields.ifPresent(defaults(node, codec, raw -> OptionsFormats.readSurface(raw, codec)), element::setDefaults);
        return element;
    }

    static void writeSurface(Surface element, ObjectNode out, ResourceCodec codec) {
        codec.putRef(out, "vertices", element.vertices());
        codec.putRef(out, "triangles", element.triangles());
        writeData(element, out, codec);
        out.set("defaults", codec.snapshot(OptionsFormats.writeSurface(element.defaults(), codec)));
    }

    static SurfaceGrid readSurfaceGrid(ObjectNode node, ResourceCodec codec) {
        var element = new SurfaceGrid();
        Fields.ifPresent(Fields.vector(node, "origin"), element::setOrigin);
        Fields.ifPresent(Fields.vector(node, "axis_u"), element::setAxisU);
        Fields.ifPresent(Fields.vector(node, "axis_v"), element::setAxisV);
        element.setTensorU(Fields.doubles(node, "tensor_u"));
        element.setTensorV(Fields.doubles(node, "tensor_v"));
        element.setOffsetW(codec.ref(node, "offset_w", ArrayDescriptor.class));
        readData(element, node, codec);
        Fields.ifPresent(defaults(node, codec, raw -> OptionsFormats.readSurface(raw, codec)), element::setDefaults);
        return element;
    }

    static void writeSurfaceGrid(SurfaceGrid element, ObjectNode out, ResourceCodec codec) {
        Fields.putVector(out, "origin", element.origin());
        Fields.putVector(out, "axis_u", element.axisU());
        Fields.putVector(out, "axis_v", element.axisV());
        Fields.putDoubles(out, "tensor_u", element.tensorU());
        Fields.putDoubles(out, "tensor_v", element.tensorV());
        codec.putRef(out, "offset_w", element.offsetW());
        writeData(element, out, codec);
        out.set("defaults", codec.snapshot(OptionsFormats.writeSurface(element.defaults(), codec)));
    }

    static VolumeGrid readVolumeGrid(ObjectNode node, ResourceCodec codec) {
        var element = new VolumeGrid();
        Fields.ifPresent(Fields.vector(node, "origin"), element::setOrigin);
        Fields.ifPresent(Fields.vector(node, "axis_u"), element::setAxisU);
        Fields.ifPresent(Fields.vector(node, "axis_v"), element::setAxisV);
        Fields.ifPresent(Fields.vector(node, "axis_w"), element::setAxisW);
        element.setTensorU(Fields.doubles(node, "tensor_u"));
        element.setTensorV(Fields.doubles(node, "tensor_v"));
        element.setTensorW(Fields.doubles(node, "tensor_w"));
        readData(element, node, codec);
        Fields.ifPresent(defaults(node, codec, raw -> OptionsFormats.readVolume(raw, codec)), element::setDefaults);
        return element;
    }

    static void writeVolumeGrid(VolumeGrid element, ObjectNode out, ResourceCodec codec) {
        Fields.putVector(out, "origin", element.origin());
        Fields.putVector(out, "axis_u", element.axisU());
        Fields.putVector(out, "axis_v", element.axisV());
        Fields.putVector(out, "axis_w", element.axisW());
        Fields.putDoubles(out, "tensor_u", element.tensorU());
        Fields.putDoubles(out, "tensor_v", element.tensorV());
        Fields.putDoubles(out, "tensor_w", element.tensorW());
        writeData(element, out, codec);
        out.set("defaults", codec.snapshot(OptionsFormats.writeVolume(element.defaults(), codec)));
    }

    private static void readData(Element element, ObjectNode node, ResourceCodec codec) {
        element.setData(codec.refs(node, "data", element.allowedAttachments()));
    }

    private static void writeData(Element element, ObjectNode out, ResourceCodec codec) {
        codec.putRefs(out, "data", element.data());
    }

    private static <T> T defaults(ObjectNode node, ResourceCodec codec, Function<JsonNode, T> reader) {
        JsonNode raw = codec.unwrapSnapshot(node.get("defaults"));
        if (raw == null || raw.isNull()) {
            return null;
        }
        return reader.apply(raw);
    }
}
