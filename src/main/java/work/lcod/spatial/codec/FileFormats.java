package work.lcod.spatial.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.files.ImageDescriptor;
import work.lcod.spatial.runtime.ResourceRegistry;
import work.lcod.spatial.runtime.ResourceType;
import work.lcod.spatial.validation.ValidationException;

/**
 * Wire formats of file resources. Array values travel as nested lists following the shape;
 * image bytes as base64.
 */
public final class FileFormats {
    private FileFormats() {}

    public static ResourceRegistry register(ResourceRegistry registry) {
        registry.register(new ResourceType<>(
            ArrayDescriptor.TYPE,
            ArrayDescriptor.class,
            "Numeric array known by shape and element type",
            FileFormats::readArray,
            FileFormats::writeArray
        ));
        registry.register(new ResourceType<>(
            ImageDescriptor.TYPE,
            ImageDescriptor.class,
            "Image file used by texture projections",
            FileFormats::readImage,
            FileFormats::writeImage
        ));
        return registry;
    }

    static ArrayDescriptor readArray(ObjectNode node, ResourceCodec codec) {
        String dtype = Fields.text(node, "dtype");
        if (dtype == null) {
            throw ValidationException.missing("dtype", "The 'dtype' property is required", null);
        }
        List<Integer> shape = Fields.integers(node, "shape");
        double[] values = null;
        if (Fields.present(node, "array")) {
            List<Integer> inferred = new ArrayList<>();
            List<Double> flat = new ArrayList<>();
            flatten(node.get("array"), 0, inferred, flat, new int[] {-1});
            if (shape == null) {
                shape = inferred;
            }
            values = flat.stream().mapToDouble(Double::doubleValue).toArray();
        }
        if (shape == null) {
            throw ValidationException.missing("shape", "The 'shape' property is required", null);
        }
        try {
            return new ArrayDescriptor(dtype, shape, values, Fields.integer(node, "content_length"));
        } catch (IllegalArgumentException ex) {
            throw ValidationException.invalid("array", ex.getMessage(), null);
        }
    }

    static void writeArray(ArrayDescriptor array, ObjectNode out, ResourceCodec codec) {
        out.put("dtype", array.dtype());
        Fields.putIntegers(out, "shape", array.shape());
        if (array.contentLength() != null) {
            out.put("content_length", array.contentLength());
        }
        if (array.isMaterialized()) {
            out.set("array", codec.mapper().valueToTree(array.nested()));
        }
    }

    /**
     * Flattens nested lists in row-major order while recording the size of each level.
     */
    private static void flatten(JsonNode node, int depth, List<Integer> shape, List<Double> out, int[] leafDepth) {
        if (node.isArray()) {
            if (shape.size() == depth) {
                shape.add(node.size());
            } else if (shape.get(depth) != node.size()) {
                throw ValidationException.invalid("array", "Ragged array: expected " + shape.get(depth)
                    + " entries at depth " + depth + ", got " + node.size(), null);
            }
            for (JsonNode child : node) {
                flatten(child, depth + 1, shape, out, leafDepth);
            }
            return;
        }
        if (leafDepth[0] < 0) {
            leafDepth[0] = depth;
        } else if (leafDepth[0] != depth) {
            throw ValidationException.invalid("array", "Ragged array: values found at depths " + leafDepth[0]
                + " and " + depth, null);
        }
        out.add(Fields.asNumber("array", node));
    }

    static ImageDescriptor readImage(ObjectNode node, ResourceCodec codec) {
        var image = new ImageDescriptor();
        image.setContentType(Fields.text(node, "content_type"));
        image.setContentLength(Fields.integer(node, "content_length"));
        if (Fields.present(node, "image")) {
            try {
                image.setContent(node.get("image").binaryValue());
            } catch (IOException ex) {
                throw ValidationException.invalid("image", "Image content must be base64: " + ex.getMessage(), null);
            }
        }
        return image;
    }

    static void writeImage(ImageDescriptor image, ObjectNode out, ResourceCodec codec) {
        if (image.contentType() != null) {
            out.put("content_type", image.contentType());
        }
        if (image.contentLength() != null) {
            out.put("content_length", image.contentLength());
        }
        if (image.isMaterialized()) {
            out.put("image", image.content());
        }
    }
}
