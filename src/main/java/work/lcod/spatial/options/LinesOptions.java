package work.lcod.spatial.options;

import java.util.Objects;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.validation.Checks;

/**
 * Line-set options for lines without thickness.
 */
public final class LinesOptions implements LineSetOptions {
    private boolean visible = true;
    private OpacityOptions opacity = new OpacityOptions();
    private ColorOptions color = new ColorOptions();

    public static LinesOptions defaults() {
        var options = new LinesOptions();
        options.setOpacity(new OpacityOptions(1.0));
        options.setColor(new ColorOptions(Color.random()));
        return options;
    }

    @Override
    public boolean visible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    @Override
    public OpacityOptions opacity() {
        return opacity;
    }

    public void setOpacity(OpacityOptions opacity) {
        this.opacity = opacity;
    }

    @Override
    public ColorOptions color() {
        return color;
    }

    public void setColor(ColorOptions color) {
        this.color = color;
    }

    @Override
    public void checkFields() {
        Checks.required("opacity", opacity, this);
        Checks.required("color", color, this);
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("opacity", opacity);
        visitor.visit("color", color);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LinesOptions that)) {
            return false;
        }
        return visible == that.visible && Objects.equals(opacity, that.opacity) && Objects.equals(color, that.color);
    }

    @Override
    public int hashCode() {
        return Objects.hash(visible, opacity, color);
    }
}
