package work.lcod.spatial.element;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.options.SurfaceOptions;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.shared.Vector3;
import work.lcod.spatial.validation.Checks;
import work.lcod.spatial.validation.ValidationException;

/**
 * Surface defined by a 2D grid: an origin, two unit axes and the cell widths along each.
 *
 * <p>Nodes are {@code (|tensor_u| + 1) * (|tensor_v| + 1)}, cells {@code |tensor_u| * |tensor_v|}.
 * The optional {@code offset_w} moves each node perpendicular to the grid plane, in row-major
 * order.
 */
public final class SurfaceGrid extends Element {
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "surfacegrid");
    public static final int MAX_TENSOR = 10000;

    private Vector3 origin = Vector3.ZERO;
    private Vector3 axisU = Vector3.named("east");
    private Vector3 axisV = Vector3.named("north");
    private List<Double> tensorU;
    private List<Double> tensorV;
    private Ref<ArrayDescriptor> offsetW;
    private SurfaceOptions defaults = SurfaceOptions.defaults();

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    @Override
    public List<Class<?>> allowedAttachments() {
        return DATA_AND_TEXTURES;
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
        this.axisU = Tensors.axis("axis_u", axisU, this);
    }

    public Vector3 axisV() {
        return axisV;
    }

    public void setAxisV(Vector3 axisV) {
        this.axisV = Tensors.axis("axis_v", axisV, this);
    }

    public List<Double> tensorU() {
        return tensorU;
    }

    public void setTensorU(List<Double> tensorU) {
        this.tensorU = Tensors.check("tensor_u", tensorU, MAX_TENSOR, this);
    }

    public List<Double> tensorV() {
        return tensorV;
    }

    public void setTensorV(List<Double> tensorV) {
        this.tensorV = Tensors.check("tensor_v", tensorV, MAX_TENSOR, this);
    }

    public Ref<ArrayDescriptor> offsetW() {
        return offsetW;
    }

    public void setOffsetW(Ref<ArrayDescriptor> offsetW) {
        checkOffsetRef(offsetW);
        this.offsetW = offsetW;
    }

    @Override
    public SurfaceOptions defaults() {
        return defaults;
    }

    public void setDefaults(SurfaceOptions defaults) {
        this.defaults = Checks.required("defaults", defaults, this);
    }

    @Override
    public OptionalLong numNodes() {
        return Tensors.count(true, tensorU, tensorV);
    }

    @Override
    public OptionalLong numCells() {
        return Tensors.count(false, tensorU, tensorV);
    }

    @Override
    public void checkFields() {
        super.checkFields();
        Checks.required("origin", origin, this);
        Checks.required("axis_u", axisU, this);
        Checks.required("axis_v", axisV, this);
        Tensors.check("tensor_u", Checks.required("tensor_u", tensorU, this), MAX_TENSOR, this);
        Tensors.check("tensor_v", Checks.required("tensor_v", tensorV, this), MAX_TENSOR, this);
        checkOffsetRef(offsetW);
    }

    @Override
    public void checkObject() {
        var nodes = numNodes();
        var length = firstDimension(offsetW);
        if (nodes.isPresent() && length.isPresent() && nodes.getAsLong() != length.getAsLong()) {
            throw ValidationException.invalid(
                "offset_w",
                "Length of offset_w, " + length.getAsLong() + ", must equal number of nodes, " + nodes.getAsLong(),
                this
            );
        }
        super.checkObject();
    }

    private void checkOffsetRef(Ref<ArrayDescriptor> value) {
        if (value == null) {
            return;
        }
        value.checkTarget("offset_w", this, List.of(ArrayDescriptor.class));
        value.value().ifPresent(array -> {
            if (array.rank() != 1) {
                throw ValidationException.invalid(
                    "offset_w",
                    "offset_w must be 1D array, not of shape " + array.shape(),
                    this
                );
            }
        });
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("offset_w", offsetW);
        super.visitChildren(visitor);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SurfaceGrid that)) {
            return false;
        }
        return sameElement(that)
            && Objects.equals(origin, that.origin)
            && Objects.equals(axisU, that.axisU)
            && Objects.equals(axisV, that.axisV)
            && Objects.equals(tensorU, that.tensorU)
            && Objects.equals(tensorV, that.tensorV)
            && Objects.equals(offsetW, that.offsetW);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementHash(), origin, axisU, axisV, tensorU, tensorV, offsetW);
    }
}
