package work.lcod.spatial.codec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import work.lcod.spatial.data.DataBasic;
import work.lcod.spatial.data.DataCategory;
import work.lcod.spatial.data.Location;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.files.ImageDescriptor;
import work.lcod.spatial.mapping.MappingCategory;
import work.lcod.spatial.mapping.MappingContinuous;
import work.lcod.spatial.mapping.MappingDiscrete;
import work.lcod.spatial.runtime.ResourceRegistry;
import work.lcod.spatial.runtime.ResourceType;
import work.lcod.spatial.texture.TextureProjection;

/**
 * Wire formats of element attachments: data and texture projections.
 */
public final class DataFormats {
    private DataFormats() {}

    public static ResourceRegistry register(ResourceRegistry registry) {
        registry.register(new ResourceType<>(
            DataBasic.TYPE,
            DataBasic.class,
            "Numeric attribute data bound to element nodes or cells",
            DataFormats::readBasic,
            DataFormats::writeData
        ));
        registry.register(new ResourceType<>(
            DataCategory.TYPE,
            DataCategory.class,
            "Integer category indices resolved through a category mapping",
            DataFormats::readCategory,
            DataFormats::writeData
        ));
        registry.register(new ResourceType<>(
            TextureProjection.TYPE,
            TextureProjection.class,
            "Image projected onto an element along two axes",
            DataFormats::readTexture,
            DataFormats::writeTexture
        ));
        return registry;
    }

    static DataBasic readBasic(ObjectNode node, ResourceCodec codec) {
        var data = new DataBasic();
        data.setArray(codec.ref(node, "array", ArrayDescriptor.class));
        Fields.ifPresent(Fields.text(node, "location"), raw -> data.setLocation(Location.parse(raw)));
        data.setMappings(codec.refs(node, "mappings", MappingContinuous.class, MappingDiscrete.class));
        return data;
    }

    static DataCategory readCategory(ObjectNode node, ResourceCodec codec) {
        var data = new DataCategory();
        data.setArray(codec.ref(node, "array", ArrayDescriptor.class));
        Fields.ifPresent(Fields.text(node, "location"), raw -> data.setLocation(Location.parse(raw)));
        data.setCategories(codec.ref(node, "categories", MappingCategory.class));
        data.setMappings(codec.refs(node, "mappings", MappingCategory.class));
        return data;
    }

    static void writeData(DataBasic data, ObjectNode out, ResourceCodec codec) {
        codec.putRef(out, "array", data.array());
        if (data.location() != null) {
            out.put("location", data.location().wireName());
        }
        if (data instanceof DataCategory category) {
            codec.putRef(out, "categories", category.categories());
        }
        codec.putRefs(out, "mappings", data.mappings());
    }

    static TextureProjection readTexture(ObjectNode node, ResourceCodec codec) {
        var texture = new TextureProjection();
        texture.setOrigin(Fields.vector(node, "origin"));
        texture.setAxisU(Fields.vector(node, "axis_u"));
        texture.setAxisV(Fields.vector(node, "axis_v"));
        texture.setImage(codec.ref(node, "image", ImageDescriptor.class));
        return texture;
    }

    static void writeTexture(TextureProjection texture, ObjectNode out, ResourceCodec codec) {
        Fields.putVector(out, "origin", texture.origin());
        Fields.putVector(out, "axis_u", texture.axisU());
        Fields.putVector(out, "axis_v", texture.axisV());
        codec.putRef(out, "image", texture.image());
    }
}
