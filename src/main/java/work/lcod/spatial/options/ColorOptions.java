package work.lcod.spatial.options;

import java.util.Objects;
import work.lcod.spatial.shared.Color;

/**
 * Solid color or a colormap from data and mapping.
 */
public final class ColorOptions implements ChannelOptions<Color> {
    private final ChannelBinding binding = new ChannelBinding();
    private Color value;

    public ColorOptions() {}

    public ColorOptions(Color value) {
        this.value = value;
    }

    @Override
    public Color value() {
        return value;
    }

    public void setValue(Color value) {
        this.value = value;
    }

    @Override
    public ChannelBinding binding() {
        return binding;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ColorOptions that)) {
            return false;
        }
        return Objects.equals(value, that.value) && binding.equals(that.binding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, binding);
    }
}
