package work.lcod.spatial.options;

import java.util.Objects;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.validation.Checks;

public final class PointsOptions implements ElementOptions {
    private boolean visible = true;
    private OpacityOptions opacity = new OpacityOptions();
    private ColorOptions color = new ColorOptions();
    private SizeOptions size = new SizeOptions();
    private PointShape shape = PointShape.SQUARE;

    /**
     * Visible, random solid color, fully opaque.
     */
    public static PointsOptions defaults() {
        var options = new PointsOptions();
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

    public SizeOptions size() {
        return size;
    }

    public void setSize(SizeOptions size) {
        this.size = size;
    }

    public PointShape shape() {
        return shape;
    }

    public void setShape(PointShape shape) {
        this.shape = shape;
    }

    @Override
    public void checkFields() {
        Checks.required("opacity", opacity, this);
        Checks.required("color", color, this);
        Checks.required("size", size, this);
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("opacity", opacity);
        visitor.visit("color", color);
        visitor.visit("size", size);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PointsOptions that)) {
            return false;
        }
        return visible == that.visible
            && Objects.equals(opacity, that.opacity)
            && Objects.equals(color, that.color)
            && Objects.equals(size, that.size)
            && shape == that.shape;
    }

    @Override
    public int hashCode() {
        return Objects.hash(visible, opacity, color, size, shape);
    }
}
