package work.lcod.spatial.options;

import java.util.Objects;
import work.lcod.spatial.shared.Color;

/**
 * Surface color: like {@link ColorOptions} plus a solid back-face color.
 */
public final class SurfaceColorOptions implements ChannelOptions<Color> {
    private final ChannelBinding binding = new ChannelBinding();
    private Color value;
    private Color back;

    public SurfaceColorOptions() {}

    public SurfaceColorOptions(Color value) {
        this.value = value;
    }

    @Override
    public Color value() {
        return value;
    }

    public void setValue(Color value) {
        this.value = value;
    }

    /**
     * Back color, only used if data is unspecified.
     */
    public Color back() {
        return back;
    }

    public void setBack(Color back) {
        this.back = back;
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
        if (!(other instanceof SurfaceColorOptions that)) {
            return false;
        }
        return Objects.equals(value, that.value) && Objects.equals(back, that.back) && binding.equals(that.binding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, back, binding);
    }
}
