package work.lcod.spatial.element;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.options.LineSetOptions;
import work.lcod.spatial.options.LinesOptions;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.Checks;

/**
 * Line segments given by vertices (N x 3) and pairs of vertex indices (M x 2).
 */
public final class LineSet extends Element {
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "lineset");

    private Ref<ArrayDescriptor> vertices;
    private Ref<ArrayDescriptor> segments;
    private LineSetOptions defaults = LinesOptions.defaults();

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    @Override
    public List<Class<?>> allowedAttachments() {
        return DATA_ONLY;
    }

    public Ref<ArrayDescriptor> vertices() {
        return vertices;
    }

    public void setVertices(Ref<ArrayDescriptor> vertices) {
        IndexArrays.checkVertices(vertices, this);
        this.vertices = vertices;
    }

    public Ref<ArrayDescriptor> segments() {
        return segments;
    }

    public void setSegments(Ref<ArrayDescriptor> segments) {
        IndexArrays.checkIndices("segments", segments, 2, this);
        this.segments = segments;
    }

    @Override
    public LineSetOptions defaults() {
        return defaults;
    }

    public void setDefaults(LineSetOptions defaults) {
        this.defaults = Checks.required("defaults", defaults, this);
    }

    @Override
    public OptionalLong numNodes() {
        return firstDimension(vertices);
    }

    @Override
    public OptionalLong numCells() {
        return firstDimension(segments);
    }

    @Override
    public void checkFields() {
        super.checkFields();
        IndexArrays.checkVertices(Checks.required("vertices", vertices, this), this);
        IndexArrays.checkIndices("segments", Checks.required("segments", segments, this), 2, this);
    }

    @Override
    public void checkObject() {
        IndexArrays.checkBounds("segments", segments, vertices, this);
        super.checkObject();
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("vertices", vertices);
        visitor.visit("segments", segments);
        super.visitChildren(visitor);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LineSet that)) {
            return false;
        }
        return sameElement(that) && Objects.equals(vertices, that.vertices) && Objects.equals(segments, that.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementHash(), vertices, segments);
    }
}
