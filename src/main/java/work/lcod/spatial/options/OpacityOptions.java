package work.lcod.spatial.options;

import java.util.Objects;
import work.lcod.spatial.validation.Checks;

/**
 * Opacity from 0 (transparent) to 1 (opaque). Clients may not support variable opacity.
 */
public final class OpacityOptions implements ChannelOptions<Double> {
    private final ChannelBinding binding = new ChannelBinding();
    private Double value;

    public OpacityOptions() {}

    public OpacityOptions(Double value) {
        setValue(value);
    }

    @Override
    public Double value() {
        return value;
    }

    public void setValue(Double value) {
        if (value != null) {
            Checks.inRange("value", value, 0, 1, this);
        }
        this.value = value;
    }

    @Override
    public ChannelBinding binding() {
        return binding;
    }

    @Override
    public void checkFields() {
        ChannelOptions.super.checkFields();
        setValue(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof OpacityOptions that)) {
            return false;
        }
        return Objects.equals(value, that.value) && binding.equals(that.binding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, binding);
    }
}
