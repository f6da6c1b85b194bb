package work.lcod.spatial.options;

import java.util.Objects;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.validation.Checks;

/**
 * Line-set options for lines with a finite radius, e.g. drillholes.
 */
public final class TubesOptions implements LineSetOptions {
    private boolean visible = true;
    private OpacityOptions opacity = new OpacityOptions();
    private ColorOptions color = new ColorOptions();
    private SizeOptions radius = new SizeOptions();

    public static TubesOptions defaults() {
        var options = new TubesOptions();
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

    public SizeOptions radius() {
        return radius;
    }

    public void setRadius(SizeOptions radius) {
        this.radius = radius;
    }

    @Override
    public void checkFields() {
        Checks.required("opacity", opacity, this);
        Checks.required("color", color, this);
        Checks.required("radius", radius, this);
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("opacity", opacity);
        visitor.visit("color", color);
        visitor.visit("radius", radius);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TubesOptions that)) {
            return false;
        }
        return visible == that.visible
            && Objects.equals(opacity, that.opacity)
            && Objects.equals(color, that.color)
            && Objects.equals(radius, that.radius);
    }

    @Override
    public int hashCode() {
        return Objects.hash(visible, opacity, color, radius);
    }
}
