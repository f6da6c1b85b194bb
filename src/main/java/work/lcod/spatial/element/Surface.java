package work.lcod.spatial.element;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.options.SurfaceOptions;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.Checks;

/**
 * Triangulated surface given by vertices (N x 3) and triangle corner indices (M x 3).
 */
public final class Surface extends Element {
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "surface");

    private Ref<ArrayDescriptor> vertices;
    private Ref<ArrayDescriptor> triangles;
    private SurfaceOptions defaults = SurfaceOptions.defaults();

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

    public Ref<ArrayDescriptor> triangles() {
        return triangles;
    }

    public void setTriangles(Ref<ArrayDescriptor> triangles) {
        IndexArrays.checkIndices("triangles", triangles, 3, this);
        this.triangles = triangles;
    }

    @Override
    public SurfaceOptions defaults() {
        return defaults;
    }

    public void setDefaults(SurfaceOptions defaults) {
        this.defaults = Checks.required("defaults", defaults, this);
    }

    @Override
    public OptionalLong numNodes() {
        return firstDimension(vertices);
    }

    @Override
    public OptionalLong numCells() {
        return firstDimension(triangles);
    }

    @Override
    public void checkFields() {
        super.checkFields();
        IndexArrays.checkVertices(Checks.required("vertices", vertices, this), this);
        IndexArrays.checkIndices("triangles", Checks.required("triangles", triangles, this), 3, this);
    }

    @Override
    public void checkObject() {
        IndexArrays.checkBounds("triangles", triangles, vertices, this);
        super.checkObject();
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("vertices", vertices);
        visitor.visit("triangles", triangles);
        super.visitChildren(visitor);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Surface that)) {
            return false;
        }
        return sameElement(that) && Objects.equals(vertices, that.vertices) && Objects.equals(triangles, that.triangles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementHash(), vertices, triangles);
    }
}
