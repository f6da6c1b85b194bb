package work.lcod.spatial.mapping;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.Checks;
import work.lcod.spatial.validation.ValidationException;

/**
 * Maps continuous data onto an N x 3 color gradient through a piecewise transfer function.
 *
 * <p>With {@code data_controls = [d0, d1, d2, d3]} and the default visibility the data axis is
 * split into five regions: hidden below {@code d0}, low gradient value up to {@code d1}, the
 * gradient's dynamic range up to {@code d2}, high gradient value up to {@code d3}, hidden above.
 */
public final class MappingContinuous extends Mapping {
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "continuous");

    private Ref<ArrayDescriptor> gradient;
    private List<Double> dataControls;
    private List<Double> gradientControls = List.of(0.0, 0.0, 1.0, 1.0);
    private List<Boolean> visibility = List.of(false, true, true, true, false);
    private boolean interpolate;

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    public Ref<ArrayDescriptor> gradient() {
        return gradient;
    }

    public void setGradient(Ref<ArrayDescriptor> gradient) {
        checkGradient(gradient);
        this.gradient = gradient;
    }

    public List<Double> dataControls() {
        return dataControls;
    }

    public void setDataControls(List<Double> dataControls) {
        this.dataControls = checkDataControls(dataControls);
    }

    public List<Double> gradientControls() {
        return gradientControls;
    }

    public void setGradientControls(List<Double> gradientControls) {
        this.gradientControls = checkGradientControls(gradientControls);
    }

    public List<Boolean> visibility() {
        return visibility;
    }

    public void setVisibility(List<Boolean> visibility) {
        this.visibility = checkVisibility(visibility);
    }

    public boolean interpolate() {
        return interpolate;
    }

    public void setInterpolate(boolean interpolate) {
        this.interpolate = interpolate;
    }

    @Override
    public int bucketCount() {
        return visibility == null ? -1 : visibility.size();
    }

    @Override
    public void checkFields() {
        super.checkFields();
        Checks.required("gradient", gradient, this);
        checkGradient(gradient);
        Checks.required("data_controls", dataControls, this);
        checkDataControls(dataControls);
        Checks.required("gradient_controls", gradientControls, this);
        checkGradientControls(gradientControls);
        Checks.required("visibility", visibility, this);
        checkVisibility(visibility);
    }

    @Override
    public void checkObject() {
        if (dataControls.size() != gradientControls.size()) {
            throw ValidationException.invalid("data_controls", "data and gradient controls must be equal length", this);
        }
        if (dataControls.size() != visibility.size() - 1) {
            throw ValidationException.invalid("data_controls", "visibility must be one longer than data controls", this);
        }
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("gradient", gradient);
    }

    private void checkGradient(Ref<ArrayDescriptor> value) {
        if (value == null) {
            return;
        }
        value.checkTarget("gradient", this, List.of(ArrayDescriptor.class));
        value.value().ifPresent(array -> {
            if (array.rank() != 2 || array.shape().get(1) != 3) {
                throw ValidationException.invalid("gradient", "gradient must be an N x 3 array, not " + array.shape(), this);
            }
        });
    }

    private List<Double> checkDataControls(List<Double> value) {
        if (value == null) {
            return null;
        }
        Checks.noNulls("data_controls", value, this);
        Checks.sizeBetween("data_controls", value, 2, 4, this);
        Checks.nonDecreasing("data_controls", value, "data controls", this);
        return List.copyOf(value);
    }

    private List<Double> checkGradientControls(List<Double> value) {
        if (value == null) {
            return null;
        }
        Checks.noNulls("gradient_controls", value, this);
        Checks.sizeBetween("gradient_controls", value, 2, 4, this);
        Checks.eachInRange("gradient_controls", value, 0, 1, this);
        return List.copyOf(value);
    }

    private List<Boolean> checkVisibility(List<Boolean> value) {
        if (value == null) {
            return null;
        }
        Checks.noNulls("visibility", value, this);
        Checks.sizeBetween("visibility", value, 3, 5, this);
        return List.copyOf(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MappingContinuous that)) {
            return false;
        }
        return sameIdentity(that)
            && interpolate == that.interpolate
            && Objects.equals(gradient, that.gradient)
            && Objects.equals(dataControls, that.dataControls)
            && Objects.equals(gradientControls, that.gradientControls)
            && Objects.equals(visibility, that.visibility);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityHash(), gradient, dataControls, gradientControls, visibility, interpolate);
    }
}
