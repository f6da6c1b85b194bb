package work.lcod.spatial.options;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.validation.Checks;

public final class SurfaceOptions implements ElementOptions {
    private boolean visible = true;
    private OpacityOptions opacity = new OpacityOptions();
    private SurfaceColorOptions color = new SurfaceColorOptions();
    private WireframeOptions wireframe = new WireframeOptions();
    private List<TextureOptions> textures = List.of();

    /**
     * Visible, random solid color, fully opaque, no wireframe, no textures.
     */
    public static SurfaceOptions defaults() {
        var options = new SurfaceOptions();
        options.setOpacity(new OpacityOptions(1.0));
        options.setColor(new SurfaceColorOptions(Color.random()));
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
    public SurfaceColorOptions color() {
        return color;
    }

    public void setColor(SurfaceColorOptions color) {
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
        Checks.noNulls("textures", value, this);
        this.textures = List.copyOf(value);
    }

    @Override
    public void checkFields() {
        Checks.required("opacity", opacity, this);
        Checks.required("color", color, this);
        Checks.required("wireframe", wireframe, this);
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("opacity", opacity);
        visitor.visit("color", color);
        visitor.visit("wireframe", wireframe);
        for (int i = 0; i < textures.size(); i++) {
            visitor.visit("textures[" + i + "]", textures.get(i));
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SurfaceOptions that)) {
            return false;
        }
        return visible == that.visible
            && Objects.equals(opacity, that.opacity)
            && Objects.equals(color, that.color)
            && Objects.equals(wireframe, that.wireframe)
            && Objects.equals(textures, that.textures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(visible, opacity, color, wireframe, textures);
    }
}
