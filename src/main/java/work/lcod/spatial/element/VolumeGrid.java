package work.lcod.spatial.element;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import work.lcod.spatial.options.BlockModelOptions;
import work.lcod.spatial.options.VolumeOptions;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.shared.Vector3;
import work.lcod.spatial.validation.Checks;

/**
 * Volume defined by a 3D grid: an origin, three unit axes and the cell widths along each.
 */
public final class VolumeGrid extends Element {
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "volumegrid");
    public static final int MAX_TENSOR = 2000;

    private Vector3 origin = Vector3.ZERO;
    private Vector3 axisU = Vector3.named("east");
    private Vector3 axisV = Vector3.named("north");
    private Vector3 axisW = Vector3.named("up");
    private List<Double> tensorU;
    private List<Double> tensorV;
    private List<Double> tensorW;
    private VolumeOptions defaults = BlockModelOptions.defaults();

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    @Override
    public List<Class<?>> allowedAttachments() {
        return DATA_ONLY;
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

    public Vector3 axisW() {
        return axisW;
    }

    public void setAxisW(Vector3 axisW) {
        this.axisW = Tensors.axis("axis_w", axisW, this);
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

    public List<Double> tensorW() {
        return tensorW;
    }

    public void setTensorW(List<Double> tensorW) {
        this.tensorW = Tensors.check("tensor_w", tensorW, MAX_TENSOR, this);
    }

    @Override
    public VolumeOptions defaults() {
        return defaults;
    }

    public void setDefaults(VolumeOptions defaults) {
        this.defaults = Checks.required("defaults", defaults, this);
    }

    @Override
    public OptionalLong numNodes() {
        return Tensors.count(true, tensorU, tensorV, tensorW);
    }

    @Override
    public OptionalLong numCells() {
        return Tensors.count(false, tensorU, tensorV, tensorW);
    }

    @Override
    public void checkFields() {
        super.checkFields();
        Checks.required("origin", origin, this);
        Checks.required("axis_u", axisU, this);
        Checks.required("axis_v", axisV, this);
        Checks.required("axis_w", axisW, this);
        Tensors.check("tensor_u", Checks.required("tensor_u", tensorU, this), MAX_TENSOR, this);
        Tensors.check("tensor_v", Checks.required("tensor_v", tensorV, this), MAX_TENSOR, this);
        Tensors.check("tensor_w", Checks.required("tensor_w", tensorW, this), MAX_TENSOR, this);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof VolumeGrid that)) {
            return false;
        }
        return sameElement(that)
            && Objects.equals(origin, that.origin)
            && Objects.equals(axisU, that.axisU)
            && Objects.equals(axisV, that.axisV)
            && Objects.equals(axisW, that.axisW)
            && Objects.equals(tensorU, that.tensorU)
            && Objects.equals(tensorV, that.tensorV)
            && Objects.equals(tensorW, that.tensorW);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementHash(), origin, axisU, axisV, axisW, tensorU, tensorV, tensorW);
    }
}
