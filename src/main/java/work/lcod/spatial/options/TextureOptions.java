package work.lcod.spatial.options;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.texture.TextureProjection;
import work.lcod.spatial.validation.Checks;
import work.lcod.spatial.validation.Validatable;

/**
 * A displayed texture with its opacity.
 */
public final class TextureOptions implements Validatable {
    private static final List<Class<?>> DATA_TYPES = List.of(TextureProjection.class);

    private double value = 1.0;
    private boolean visible = true;
    private Ref<TextureProjection> data;

    public TextureOptions() {}

    public TextureOptions(Ref<TextureProjection> data) {
        setData(data);
    }

    public double value() {
        return value;
    }

    public void setValue(double value) {
        Checks.inRange("value", value, 0, 1, this);
        this.value = value;
    }

    public boolean visible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    public Ref<TextureProjection> data() {
        return data;
    }

    public void setData(Ref<TextureProjection> data) {
        if (data != null) {
            data.checkTarget("data", this, DATA_TYPES);
        }
        this.data = data;
    }

    @Override
    public void checkFields() {
        Checks.inRange("value", value, 0, 1, this);
        Checks.required("data", data, this).checkTarget("data", this, DATA_TYPES);
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("data", data);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TextureOptions that)) {
            return false;
        }
        return Double.compare(value, that.value) == 0 && visible == that.visible && Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, visible, data);
    }
}
