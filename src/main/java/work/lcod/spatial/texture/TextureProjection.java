package work.lcod.spatial.texture;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.data.Attachment;
import work.lcod.spatial.files.ImageDescriptor;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.resource.Resource;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.shared.Vector3;
import work.lcod.spatial.validation.Checks;

/**
 * Image placed in space by an origin and two axes, projected normal to its plane onto the
 * element it is attached to.
 */
public final class TextureProjection extends Resource implements Attachment {
    public static final String BASE_TYPE = "textures";
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "projection");

    private Vector3 origin;
    private Vector3 axisU;
    private Vector3 axisV;
    private Ref<ImageDescriptor> image;

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    @Override
    public boolean isLocationBound() {
        return false;
    }

    public Vector3 origin() {
        return origin;
    }

    public void setOrigin(Vector3 origin) {
        this.origin = origin;
    }

    public Vector3 axisU() {
        return axisU;
    }

    public void setAxisU(Vector3 axisU) {
        this.axisU = axisU;
    }

    public Vector3 axisV() {
        return axisV;
    }

    public void setAxisV(Vector3 axisV) {
        this.axisV = axisV;
    }

    public Ref<ImageDescriptor> image() {
        return image;
    }

    public void setImage(Ref<ImageDescriptor> image) {
        if (image != null) {
            image.checkTarget("image", this, List.of(ImageDescriptor.class));
        }
        this.image = image;
    }

    @Override
    public void checkFields() {
        super.checkFields();
        Checks.required("origin", origin, this);
        Checks.required("axis_u", axisU, this);
        Checks.required("axis_v", axisV, this);
        Checks.required("image", image, this).checkTarget("image", this, List.of(ImageDescriptor.class));
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("image", image);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TextureProjection that)) {
            return false;
        }
        return sameIdentity(that)
            && Objects.equals(origin, that.origin)
            && Objects.equals(axisU, that.axisU)
            && Objects.equals(axisV, that.axisV)
            && Objects.equals(image, that.image);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityHash(), origin, axisU, axisV, image);
    }
}
