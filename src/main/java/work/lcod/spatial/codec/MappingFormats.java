package work.lcod.spatial.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.mapping.MappingCategory;
import work.lcod.spatial.mapping.MappingContinuous;
import work.lcod.spatial.mapping.MappingDiscrete;
import work.lcod.spatial.mapping.MappingValues;
import work.lcod.spatial.runtime.ResourceRegistry;
import work.lcod.spatial.runtime.ResourceType;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.validation.ValidationException;

public final class MappingFormats {
    private MappingFormats() {}

    public static ResourceRegistry register(ResourceRegistry registry) {
        registry.register(new ResourceType<>(
            MappingContinuous.TYPE,
            MappingContinuous.class,
            "Piecewise-linear mapping from a continuous data range onto a color gradient",
            MappingFormats::readContinuous,
            MappingFormats::writeContinuous
        ));
        registry.register(new ResourceType<>(
            MappingDiscrete.TYPE,
            MappingDiscrete.class,
            "Mapping from data ranges split at end points onto discrete values",
            MappingFormats::readDiscrete,
            MappingFormats::writeDiscrete
        ));
        registry.register(new ResourceType<>(
            MappingCategory.TYPE,
            MappingCategory.class,
            "Mapping from integer category indices onto values",
            MappingFormats::readCategory,
            MappingFormats::writeCategory
        ));
        return registry;
    }

    static MappingContinuous readContinuous(ObjectNode node, ResourceCodec codec) {
        var mapping = new MappingContinuous();
        mapping.setGradient(codec.ref(node, "gradient", ArrayDescriptor.class));
        Fields.ifPresent(Fields.doubles(node, "data_controls"), mapping::setDataControls);
        Fields.ifPresent(Fields.doubles(node, "gradient_controls"), mapping::setGradientControls);
        Fields.ifPresent(Fields.booleans(node, "visibility"), mapping::setVisibility);
        Fields.ifPresent(Fields.bool(node, "interpolate"), mapping::setInterpolate);
        return mapping;
    }

    static void writeContinuous(MappingContinuous mapping, ObjectNode out, ResourceCodec codec) {
        codec.putRef(out, "gradient", mapping.gradient());
        Fields.putDoubles(out, "data_controls", mapping.dataControls());
        Fields.putDoubles(out, "gradient_controls", mapping.gradientControls());
        Fields.putBooleans(out, "visibility", mapping.visibility());
        out.put("interpolate", mapping.interpolate());
    }

    static MappingDiscrete readDiscrete(ObjectNode node, ResourceCodec codec) {
        var mapping = new MappingDiscrete();
        Fields.ifPresent(values(node), mapping::setValues);
        Fields.ifPresent(Fields.doubles(node, "end_points"), mapping::setEndPoints);
        Fields.ifPresent(Fields.booleans(node, "end_inclusive"), mapping::setEndInclusive);
        Fields.ifPresent(Fields.booleans(node, "visibility"), mapping::setVisibility);
        return mapping;
    }

    static void writeDiscrete(MappingDiscrete mapping, ObjectNode out, ResourceCodec codec) {
        putValues(out, mapping.values());
        Fields.putDoubles(out, "end_points", mapping.endPoints());
        Fields.putBooleans(out, "end_inclusive", mapping.endInclusive());
        Fields.putBooleans(out, "visibility", mapping.visibility());
    }

    static MappingCategory readCategory(ObjectNode node, ResourceCodec codec) {
        var mapping = new MappingCategory();
        Fields.ifPresent(values(node), mapping::setValues);
        Fields.ifPresent(Fields.integers(node, "indices"), mapping::setIndices);
        Fields.ifPresent(Fields.booleans(node, "visibility"), mapping::setVisibility);
        return mapping;
    }

    static void writeCategory(MappingCategory mapping, ObjectNode out, ResourceCodec codec) {
        putValues(out, mapping.values());
        Fields.putIntegers(out, "indices", mapping.indices());
        Fields.putBooleans(out, "visibility", mapping.visibility());
    }

    /**
     * Decodes a homogeneous value list, trying hex colors, then numbers, then labels. An empty
     * list reads as colors.
     */
    static MappingValues values(JsonNode node) {
        JsonNode values = node.get("values");
        if (values == null || values.isNull()) {
            return null;
        }
        if (!values.isArray()) {
            throw ValidationException.invalid("values", "The 'values' property must be a list", null);
        }
        List<Color> colors = asColors(values);
        if (colors != null) {
            return new MappingValues.Colors(colors);
        }
        if (allMatch(values, JsonNode::isNumber)) {
            return new MappingValues.Numbers(Fields.doubles(node, "values"));
        }
        if (allMatch(values, JsonNode::isTextual)) {
            List<String> labels = new ArrayList<>(values.size());
            values.forEach(value -> labels.add(value.asText()));
            return new MappingValues.Labels(labels);
        }
        throw ValidationException.invalid("values", "Mapping values must all be colors, numbers or labels", null);
    }

    static void putValues(ObjectNode out, MappingValues values) {
        if (values == null) {
            return;
        }
        ArrayNode array = out.putArray("values");
        if (values instanceof MappingValues.Colors colors) {
            colors.items().forEach(color -> array.add(color.toHex()));
        } else if (values instanceof MappingValues.Numbers numbers) {
            numbers.items().forEach(array::add);
        } else if (values instanceof MappingValues.Labels labels) {
            labels.items().forEach(array::add);
        }
    }

    private static List<Color> asColors(JsonNode values) {
        List<Color> colors = new ArrayList<>(values.size());
        for (JsonNode value : values) {
            if (!value.isTextual()) {
                return null;
            }
            try {
                colors.add(Color.fromHex(value.asText()));
            } catch (IllegalArgumentException ex) {
                return null;
            }
        }
        return colors;
    }

    private static boolean allMatch(JsonNode values, Predicate<JsonNode> test) {
        for (JsonNode value : values) {
            if (!test.test(value)) {
                return false;
            }
        }
        return true;
    }
}
