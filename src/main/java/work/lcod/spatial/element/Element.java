package work.lcod.spatial.element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.stream.Collectors;
import work.lcod.spatial.data.Attachment;
import work.lcod.spatial.data.DataBasic;
import work.lcod.spatial.data.DataCategory;
import work.lcod.spatial.data.Location;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.options.ElementOptions;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.resource.Resource;
import work.lcod.spatial.texture.TextureProjection;
import work.lcod.spatial.validation.Checks;
import work.lcod.spatial.validation.ValidationException;

/**
 * Geometry container. Subclasses derive their node and cell counts from their own geometry
 * fields; attached data must agree with those counts.
 *
 * <p>A count is unknown (empty) while the geometry defining it is missing or unresolved, and
 * length checks against an unknown count are skipped.
 */
public abstract class Element extends Resource {
    public static final String BASE_TYPE = "elements";
    public static final int MAX_DATA = 100;

    // Untyped payloads try these in order; category data must precede basic data.
    static final List<Class<?>> DATA_ONLY = List.of(DataCategory.class, DataBasic.class);
    static final List<Class<?>> DATA_AND_TEXTURES = List.of(
        DataCategory.class,
        DataBasic.class,
        TextureProjection.class
    );

    private List<Ref<Attachment>> data = List.of();

    public abstract OptionalLong numNodes();

    public abstract OptionalLong numCells();

    public abstract ElementOptions defaults();

    /**
     * Attachment types accepted in {@link #data()}.
     */
    public abstract List<Class<?>> allowedAttachments();

    /**
     * Locations data may bind to, with the matching count.
     */
    public Map<Location, OptionalLong> locationLengths() {
        Map<Location, OptionalLong> lengths = new LinkedHashMap<>();
        lengths.put(Location.NODES, numNodes());
        lengths.put(Location.CELLS, numCells());
        return lengths;
    }

    public List<Ref<Attachment>> data() {
        return data;
    }

    public void setData(List<Ref<Attachment>> data) {
        this.data = checkData(data == null ? List.of() : data);
    }

    @Override
    public void checkFields() {
        super.checkFields();
        checkData(data);
        Checks.required("defaults", defaults(), this);
    }

    @Override
    public void checkObject() {
        var lengths = locationLengths();
        for (int i = 0; i < data.size(); i++) {
            var attachment = data.get(i).value().orElse(null);
            if (!(attachment instanceof DataBasic bound) || !attachment.isLocationBound()) {
                continue;
            }
            checkAttached("data[" + i + "]", bound, lengths);
        }
    }

    private void checkAttached(String field, DataBasic attached, Map<Location, OptionalLong> lengths) {
        Location location = attached.location();
        if (!lengths.containsKey(location)) {
            throw ValidationException.invalid(
                field,
                "Invalid location " + (location == null ? null : location.wireName()) + " - valid values: "
                    + lengths.keySet().stream().map(Location::wireName).collect(Collectors.joining(", ")),
                this
            );
        }
        OptionalLong expected = lengths.get(location);
        OptionalLong actual = firstDimension(attached.array());
        if (expected.isEmpty() || actual.isEmpty()) {
            return;
        }
        if (actual.getAsLong() != expected.getAsLong()) {
            String label = attached.name() != null ? attached.name() : field;
            throw ValidationException.invalid(
                field,
                "data " + label + " length " + actual.getAsLong() + " does not match " + location.wireName()
                    + " length " + expected.getAsLong(),
                this
            );
        }
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        for (int i = 0; i < data.size(); i++) {
            visitor.visit("data[" + i + "]", data.get(i));
        }
        visitor.visit("defaults", defaults());
    }

    private List<Ref<Attachment>> checkData(List<Ref<Attachment>> value) {
        Checks.noNulls("data", value, this);
        Checks.maxSize("data", value, MAX_DATA, this);
        var allowed = allowedAttachments();
        for (int i = 0; i < value.size(); i++) {
            value.get(i).checkTarget("data[" + i + "]", this, allowed);
        }
        return List.copyOf(value);
    }

    /**
     * First dimension of a resolved array, empty when missing or unresolved.
     */
    static OptionalLong firstDimension(Ref<ArrayDescriptor> ref) {
        if (ref == null) {
            return OptionalLong.empty();
        }
        OptionalInt length = ref.value().map(ArrayDescriptor::length).orElse(OptionalInt.empty());
        return length.isPresent() ? OptionalLong.of(length.getAsInt()) : OptionalLong.empty();
    }

    protected final boolean sameElement(Element other) {
        return sameIdentity(other) && data.equals(other.data) && Objects.equals(defaults(), other.defaults());
    }

    protected final int elementHash() {
        return Objects.hash(identityHash(), data, defaults());
    }
}
