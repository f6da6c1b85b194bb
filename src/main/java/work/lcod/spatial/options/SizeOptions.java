package work.lcod.spatial.options;

import java.util.Objects;
import work.lcod.spatial.validation.Checks;

/**
 * Non-negative size, 10 unless set. Clients may not support variable size.
 */
public final class SizeOptions implements ChannelOptions<Double> {
    public static final double DEFAULT_SIZE = 10;

    private final ChannelBinding binding = new ChannelBinding();
    private Double value = DEFAULT_SIZE;

    public SizeOptions() {}

    public SizeOptions(Double value) {
        setValue(value);
    }

    @Override
    public Double value() {
        return value;
    }

    public void setValue(Double value) {
        if (value != null) {
            Checks.atLeast("value", value, 0, this);
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
        if (!(other instanceof SizeOptions that)) {
            return false;
        }
        return Objects.equals(value, that.value) && binding.equals(that.binding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, binding);
    }
}
