package work.lcod.spatial.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import work.lcod.spatial.data.DataBasic;
import work.lcod.spatial.data.DataCategory;
import work.lcod.spatial.mapping.MappingCategory;
import work.lcod.spatial.mapping.MappingContinuous;
import work.lcod.spatial.mapping.MappingDiscrete;
import work.lcod.spatial.options.BlockModelOptions;
import work.lcod.spatial.options.ChannelOptions;
import work.lcod.spatial.options.ColorOptions;
import work.lcod.spatial.options.LineSetOptions;
import work.lcod.spatial.options.LinesOptions;
import work.lcod.spatial.options.OpacityOptions;
import work.lcod.spatial.options.PointShape;
import work.lcod.spatial.options.PointsOptions;
import work.lcod.spatial.options.SizeOptions;
import work.lcod.spatial.options.SurfaceColorOptions;
import work.lcod.spatial.options.SurfaceOptions;
import work.lcod.spatial.options.TextureOptions;
import work.lcod.spatial.options.TubesOptions;
import work.lcod.spatial.options.VolumeOptions;
import work.lcod.spatial.options.VolumeSlicesOptions;
import work.lcod.spatial.options.WireframeOptions;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.texture.TextureProjection;
import work.lcod.spatial.validation.ValidationException;

/**
 * Wire formats of display options. Options carry no type discriminator: line-set and volume
 * variants are told apart by their extra fields ({@code radius}, {@code slices_*}).
 */
public final class OptionsFormats {
    private OptionsFormats() {}

    public static ObjectNode writePoints(PointsOptions options, ResourceCodec codec) {
        ObjectNode out = common(options.visible(), options.opacity(), codec);
        out.set("color", writeColor(options.color(), codec));
        out.set("size", writeSize(options.size(), codec));
        out.put("shape", options.shape().wireName());
        return out;
    }

    public static PointsOptions readPoints(JsonNode node, ResourceCodec codec) {
        var options = PointsOptions.defaults();
        readCommon(node, codec, options::setVisible, options::setOpacity);
        Fields.ifPresent(object(node, "color"), color -> options.setColor(readColor(color, codec)));
        Fields.ifPresent(object(node, "size"), size -> options.setSize(readSize(size, codec)));
        Fields.ifPresent(Fields.text(node, "shape"), shape -> options.setShape(PointShape.parse(shape)));
        return options;
    }

    public static ObjectNode writeLineSet(LineSetOptions options, ResourceCodec codec) {
        ObjectNode out = common(options.visible(), options.opacity(), codec);
        out.set("color", writeColor(options.color(), codec));
        if (options instanceof TubesOptions tubes) {
            out.set("radius", writeSize(tubes.radius(), codec));
        }
        return out;
    }

    public static LineSetOptions readLineSet(JsonNode node, ResourceCodec codec) {
        if (Fields.present(node, "radius")) {
            var tubes = TubesOptions.defaults();
            readCommon(node, codec, tubes::setVisible, tubes::setOpacity);
            Fields.ifPresent(object(node, "color"), color -> tubes.setColor(readColor(color, codec)));
            tubes.setRadius(readSize(object(node, "radius"), codec));
            return tubes;
        }
        var lines = LinesOptions.defaults();
        readCommon(node, codec, lines::setVisible, lines::setOpacity);
        Fields.ifPresent(object(node, "color"), color -> lines.setColor(readColor(color, codec)));
        return lines;
    }

    public static ObjectNode writeSurface(SurfaceOptions options, ResourceCodec codec) {
        ObjectNode out = common(options.visible(), options.opacity(), codec);
        ObjectNode color = writeColor(options.color(), codec);
        Fields.putColor(color, "back", options.color().back());
        out.set("color", color);
        out.set("wireframe", writeWireframe(options.wireframe(), codec));
        ArrayNode textures = out.putArray("textures");
        for (TextureOptions texture : options.textures()) {
            textures.add(writeTexture(texture, codec));
        }
        return out;
    }

    public static SurfaceOptions readSurface(JsonNode node, ResourceCodec codec) {
        var options = SurfaceOptions.defaults();
        readCommon(node, codec, options::setVisible, options::setOpacity);
        Fields.ifPresent(object(node, "color"), color -> {
            var surfaceColor = new SurfaceColorOptions();
            readChannel(color, codec, surfaceColor);
            if (color.has("value")) {
                surfaceColor.setValue(Fields.color(color, "value"));
            }
            surfaceColor.setBack(Fields.color(color, "back"));
            options.setColor(surfaceColor);
        });
        Fields.ifPresent(object(node, "wireframe"), wireframe -> options.setWireframe(readWireframe(wireframe)));
        options.setTextures(readTextures(node, codec));
        return options;
    }

    public static ObjectNode writeVolume(VolumeOptions options, ResourceCodec codec) {
        ObjectNode out = common(options.visible(), options.opacity(), codec);
        out.set("color", writeColor(options.color(), codec));
        if (options instanceof VolumeSlicesOptions slices) {
            out.set("wireframe", writeWireframe(slices.wireframe(), codec));
            Fields.putDoubles(out, "slices_u", slices.slicesU());
            Fields.putDoubles(out, "slices_v", slices.slicesV());
            Fields.putDoubles(out, "slices_w", slices.slicesW());
        } else if (options instanceof BlockModelOptions block) {
            out.set("wireframe", writeWireframe(block.wireframe(), codec));
            out.putArray("textures");
        }
        return out;
    }

    public static VolumeOptions readVolume(JsonNode node, ResourceCodec codec) {
        if (Fields.present(node, "slices_u") || Fields.present(node, "slices_v") || Fields.present(node, "slices_w")) {
            var slices = VolumeSlicesOptions.defaults();
            readCommon(node, codec, slices::setVisible, slices::setOpacity);
            Fields.ifPresent(object(node, "color"), color -> slices.setColor(readColor(color, codec)));
            Fields.ifPresent(object(node, "wireframe"), wireframe -> slices.setWireframe(readWireframe(wireframe)));
            Fields.ifPresent(Fields.doubles(node, "slices_u"), slices::setSlicesU);
            Fields.ifPresent(Fields.doubles(node, "slices_v"), slices::setSlicesV);
            Fields.ifPresent(Fields.doubles(node, "slices_w"), slices::setSlicesW);
            return slices;
        }
        var block = BlockModelOptions.defaults();
        readCommon(node, codec, block::setVisible, block::setOpacity);
        Fields.ifPresent(object(node, "color"), color -> block.setColor(readColor(color, codec)));
        Fields.ifPresent(object(node, "wireframe"), wireframe -> block.setWireframe(readWireframe(wireframe)));
        block.setTextures(readTextures(node, codec));
        return block;
    }

    private static ObjectNode common(boolean visible, OpacityOptions opacity, ResourceCodec codec) {
        ObjectNode out = codec.mapper().createObjectNode();
        out.put("visible", visible);
        ObjectNode node = channel(opacity, codec);
        putNumber(node, opacity.value());
        out.set("opacity", node);
        return out;
    }

    private static void readCommon(
        JsonNode node,
        ResourceCodec codec,
        Consumer<Boolean> visible,
        Consumer<OpacityOptions> opacity
    ) {
        Fields.ifPresent(Fields.bool(node, "visible"), visible);
        Fields.ifPresent(object(node, "opacity"), raw -> {
            var options = new OpacityOptions();
            readChannel(raw, codec, options);
            if (raw.has("value")) {
                options.setValue(Fields.number(raw, "value"));
            }
            opacity.accept(options);
        });
    }

    private static ObjectNode writeColor(ChannelOptions<?> color, ResourceCodec codec) {
        ObjectNode node = channel(color, codec);
        Object value = color.value();
        if (value instanceof Color rgb) {
            node.put("value", rgb.toHex());
        } else {
            node.putNull("value");
        }
        return node;
    }

    private static ColorOptions readColor(JsonNode node, ResourceCodec codec) {
        var options = new ColorOptions();
        readChannel(node, codec, options);
        if (node.has("value")) {
            options.setValue(Fields.color(node, "value"));
        }
        return options;
    }

    private static ObjectNode writeSize(SizeOptions size, ResourceCodec codec) {
        ObjectNode node = channel(size, codec);
        putNumber(node, size.value());
        return node;
    }

    private static SizeOptions readSize(JsonNode node, ResourceCodec codec) {
        var options = new SizeOptions();
        readChannel(node, codec, options);
        if (node.has("value")) {
            options.setValue(Fields.number(node, "value"));
        }
        return options;
    }

    private static ObjectNode writeWireframe(WireframeOptions wireframe, ResourceCodec codec) {
        ObjectNode node = codec.mapper().createObjectNode();
        node.put("active", wireframe.active());
        return node;
    }

    private static WireframeOptions readWireframe(JsonNode node) {
        Boolean active = Fields.bool(node, "active");
        return new WireframeOptions(active != null && active);
    }

    private static ObjectNode writeTexture(TextureOptions texture, ResourceCodec codec) {
        ObjectNode node = codec.mapper().createObjectNode();
        node.put("value", texture.value());
        node.put("visible", texture.visible());
        codec.putRef(node, "data", texture.data());
        return node;
    }

    private static List<TextureOptions> readTextures(JsonNode node, ResourceCodec codec) {
        JsonNode raw = node.get("textures");
        if (raw == null || raw.isNull()) {
            return List.of();
        }
        if (!raw.isArray()) {
            throw ValidationException.invalid("textures", "The 'textures' property must be a list", null);
        }
        List<TextureOptions> textures = new ArrayList<>(raw.size());
        for (JsonNode entry : raw) {
            var texture = new TextureOptions();
            Fields.ifPresent(Fields.number(entry, "value"), texture::setValue);
            Fields.ifPresent(Fields.bool(entry, "visible"), texture::setVisible);
            texture.setData(codec.ref(entry, "data", TextureProjection.class));
            textures.add(texture);
        }
        return textures;
    }

    private static ObjectNode channel(ChannelOptions<?> options, ResourceCodec codec) {
        ObjectNode node = codec.mapper().createObjectNode();
        codec.putRef(node, "data", options.data());
        codec.putRef(node, "mapping", options.mapping());
        return node;
    }

    private static void readChannel(JsonNode node, ResourceCodec codec, ChannelOptions<?> options) {
        options.setData(codec.ref(node, "data", DataCategory.class, DataBasic.class));
        options.setMapping(codec.ref(
            node,
            "mapping",
            MappingContinuous.class,
            MappingDiscrete.class,
            MappingCategory.class
        ));
    }

    private static void putNumber(ObjectNode node, Double value) {
        if (value == null) {
            node.putNull("value");
        } else {
            node.put("value", value);
        }
    }

    private static JsonNode object(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw ValidationException.invalid(field, "The '" + field + "' property must be an object", null);
        }
        return node;
    }
}
