package work.lcod.spatial.options;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.validation.Checks;

/**
 * Volume options for display as a solid block model.
 */
public final class BlockModelOptions implements VolumeOptions {
    private boolean visible = true;
    private OpacityOptions opacity = new OpacityOptions();
    private ColorOptions color = new ColorOptions();
    private WireframeOptions wireframe = new WireframeOptions();
    // kept for older payloads, always empty
    private List<TextureOptions> textures = List.of();

    public static BlockModelOptions defaults() {
        var options = new BlockModelOptions();
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

    public List<TextureOptions> textures() {
        return textures;
    }

    public void setTextures(List<TextureOptions> textures) {
        List<TextureOptions> value = textures == null ? List.of() : textures;
        Checks.maxSize("textures", value, 0, this);
        this.textures = List.copyOf(value);
    }

    @Override
    public void checkFields() {
        Checks.required("opacity", opacity, this);
        Checks.required("color", color, this);
        Checks.required("wireframe", wireframe, this);
        Checks.maxSize("textures", textures, 0, this);
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("opacity", opacity);
        visitor.visit("color", color);
        visitor.visit("wireframe", wireframe);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BlockModelOptions that)) {
            return false;
        }
        return visible == that.visible
            && Objects.equals(opacity, that.opacity)
            && Objects.equals(color, that.color)
            && Objects.equals(wireframe, that.wireframe);
    }

    @Override
    public int hashCode() {
        return Objects.hash(visible, opacity, color, wireframe);
    }
}
