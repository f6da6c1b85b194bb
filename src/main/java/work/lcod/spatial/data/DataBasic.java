package work.lcod.spatial.data;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.mapping.Mapping;
import work.lcod.spatial.mapping.MappingContinuous;
import work.lcod.spatial.mapping.MappingDiscrete;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.resource.Resource;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.Checks;
import work.lcod.spatial.validation.ValidationException;

/**
 * Numeric attribute bound to the nodes or cells of an element. Use NaN for no-data; grid
 * values are in row-major order.
 */
public class DataBasic extends Resource implements Attachment {
    public static final String BASE_TYPE = "data";
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "basic");
    public static final int MAX_MAPPINGS = 100;

    private Ref<ArrayDescriptor> array;
    private Location location;
    private List<Ref<Mapping>> mappings = List.of();

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    @Override
    public boolean isLocationBound() {
        return true;
    }

    public Ref<ArrayDescriptor> array() {
        return array;
    }

    public void setArray(Ref<ArrayDescriptor> array) {
        checkArrayRef(array);
        this.array = array;
    }

    public Location location() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public List<Ref<Mapping>> mappings() {
        return mappings;
    }

    public void setMappings(List<Ref<Mapping>> mappings) {
        this.mappings = checkMappings(mappings == null ? List.of() : mappings);
    }

    /**
     * Mapping types accepted in {@link #mappings()}.
     */
    protected List<Class<?>> allowedMappings() {
        return List.of(MappingContinuous.class, MappingDiscrete.class);
    }

    /**
     * Value check on a resolved array.
     */
    protected void checkArray(ArrayDescriptor value) {
        if (value.rank() != 1) {
            throw ValidationException.invalid(
                "array",
                getClass().getSimpleName() + " must use 1D array, not shape " + value.shape(),
                this
            );
        }
    }

    @Override
    public void checkFields() {
        super.checkFields();
        checkArrayRef(Checks.required("array", array, this));
        Checks.required("location", location, this);
        checkMappings(mappings);
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        visitor.visit("array", array);
        for (int i = 0; i < mappings.size(); i++) {
            visitor.visit("mappings[" + i + "]", mappings.get(i));
        }
    }

    private void checkArrayRef(Ref<ArrayDescriptor> value) {
        if (value == null) {
            return;
        }
        value.checkTarget("array", this, List.of(ArrayDescriptor.class));
        value.value().ifPresent(this::checkArray);
    }

    private List<Ref<Mapping>> checkMappings(List<Ref<Mapping>> value) {
        Checks.noNulls("mappings", value, this);
        Checks.maxSize("mappings", value, MAX_MAPPINGS, this);
        var allowed = allowedMappings();
        for (int i = 0; i < value.size(); i++) {
            value.get(i).checkTarget("mappings[" + i + "]", this, allowed);
        }
        return List.copyOf(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        DataBasic that = (DataBasic) other;
        return sameIdentity(that)
            && Objects.equals(array, that.array)
            && location == that.location
            && Objects.equals(mappings, that.mappings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityHash(), array, location, mappings);
    }
}
