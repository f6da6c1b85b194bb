package work.lcod.spatial.element;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.options.PointsOptions;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.Checks;

/**
 * Points given by an N x 3 vertex array. Nodes and cells are the same N points.
 */
public final class PointSet extends Element {
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "pointset");

    private Ref<ArrayDescriptor> vertices;
    private PointsOptions defaults = PointsOptions.defaults();

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    @Override
    public List<Class<?>> allowedAttachments() {
        return DATA_AND_TEXTURES;
    }

    public Ref<ArrayDescriptor> vertices() {
        return vertices;
    }

    public void setVertices(Ref<ArrayDescriptor> vertices) {
        IndexArrays.checkVertices(vertices, this);
        this.vertices = vertices;
    }

    @Override
    public PointsOptions defaults() {
        return defaults;
    }

    public void setDefaults(PointsOptions defaults) {
        this.defaults = Checks.required("defaults", defaults, this);
    }

    @Override
    public OptionalLong numNodes() {
        return firstDimension(vertices);
    }

    @Override
    public OptionalLong numCells() {
        return numNodes();
    }

    @Override
    public void checkFields() {
        super.checkFields();
        IndexArrays.checkVertices(Checks.required("vertices", vertices, this), this);
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("vertices", vertices);
        super.visitChildren(visitor);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PointSet that)) {
            return false;
        }
        return sameElement(that) && Objects.equals(vertices, that.vertices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementHash(), vertices);
    }
}
