package work.lcod.spatial.options;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.validation.Checks;

/**
 * Volume options showing cross-section slices at normalized positions along each axis.
 */
public final class VolumeSlicesOptions implements VolumeOptions {
    public static final int MAX_SLICES = 256;
    private static final List<Double> CENTER = List.of(0.5);

    private boolean visible = true;
    private OpacityOptions opacity = new OpacityOptions();
    private ColorOptions color = new ColorOptions();
    private WireframeOptions wireframe = new WireframeOptions();
    private List<Double> slicesU = CENTER;
    private List<Double> slicesV = CENTER;
    private List<Double> slicesW = CENTER;

    public static VolumeSlicesOptions defaults() {
        var options = new VolumeSlicesOptions();
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

    public WireframeOptions wireframe() {
        return wireframe;
    }

    public void setWireframe(WireframeOptions wireframe) {
        this.wireframe = wireframe;
    }

    public List<Double> slicesU() {
        return slicesU;
    }

    public void setSlicesU(List<Double> slicesU) {
        this.slicesU = checkSlices("slices_u", slicesU);
    }

    public List<Double> slicesV() {
        return slicesV;
    }

    public void setSlicesV(List<Double> slicesV) {
        this.slicesV = checkSlices("slices_v", slicesV);
    }

    public List<Double> slicesW() {
        return slicesW;
    }

    public void setSlicesW(List<Double> slicesW) {
        this.slicesW = checkSlices("slices_w", slicesW);
    }

    @Override
    public void checkFields() {
        Checks.required("opacity", opacity, this);
        Checks.required("color", color, this);
        Checks.required("wireframe", wireframe, this);
        checkSlices("slices_u", slicesU);
        checkSlices("slices_v", slicesV);
        checkSlices("slices_w", slicesW);
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("opacity", opacity);
        visitor.visit("color", color);
        visitor.visit("wireframe", wireframe);
    }

    private List<Double> checkSlices(String field, List<Double> slices) {
        List<Double> value = slices == null ? List.of() : slices;
        Checks.noNulls(field, value, this);
        Checks.maxSize(field, value, MAX_SLICES, this);
        Checks.eachInRange(field, value, 0, 1, this);
        return List.copyOf(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof VolumeSlicesOptions that)) {
            return false;
        }
        return visible == that.visible
            && Objects.equals(opacity, that.opacity)
            && Objects.equals(color, that.color)
            && Objects.equals(wireframe, that.wireframe)
            && slicesU.equals(that.slicesU)
            && slicesV.equals(that.slicesV)
            && slicesW.equals(that.slicesW);
    }

    @Override
    public int hashCode() {
        return Objects.hash(visible, opacity, color, wireframe, slicesU, slicesV, slicesW);
    }
}
