package work.lcod.spatial.mapping;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.Checks;
import work.lcod.spatial.validation.ValidationException;

/**
 * Maps integer indices onto category values. Array values without a matching index are no-data.
 */
public final class MappingCategory extends Mapping {
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "category");

    private MappingValues values;
    private List<Integer> indices;
    private List<Boolean> visibility;

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    public MappingValues values() {
        return values;
    }

    public void setValues(MappingValues values) {
        MappingValues.check(values, this);
        this.values = values;
    }

    public List<Integer> indices() {
        return indices;
    }

    public void setIndices(List<Integer> indices) {
        this.indices = checkIndices(indices);
    }

    public List<Boolean> visibility() {
        return visibility;
    }

    public void setVisibility(List<Boolean> visibility) {
        this.visibility = checkVisibility(visibility);
    }

    @Override
    public int bucketCount() {
        return values == null ? -1 : values.size();
    }

    @Override
    public void checkFields() {
        super.checkFields();
        MappingValues.check(Checks.required("values", values, this), this);
        checkIndices(Checks.required("indices", indices, this));
        checkVisibility(Checks.required("visibility", visibility, this));
    }

    @Override
    public void checkObject() {
        if (values.size() != indices.size()) {
            throw ValidationException.invalid("indices", "values and indices must be equal length", this);
        }
        if (values.size() != visibility.size()) {
            throw ValidationException.invalid("visibility", "values and visibility must be equal length", this);
        }
    }

    private List<Integer> checkIndices(List<Integer> value) {
        if (value == null) {
            return null;
        }
        Checks.noNulls("indices", value, this);
        Checks.maxSize("indices", value, MappingValues.MAX_SIZE, this);
        for (Integer index : value) {
            if (index < 0) {
                throw ValidationException.invalid("indices", "indices must be non-negative: " + value, this);
            }
        }
        Checks.unique("indices", value, this);
        return List.copyOf(value);
    }

    private List<Boolean> checkVisibility(List<Boolean> value) {
        if (value == null) {
            return null;
        }
        Checks.noNulls("visibility", value, this);
        Checks.maxSize("visibility", value, MappingValues.MAX_SIZE, this);
        return List.copyOf(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MappingCategory that)) {
            return false;
        }
        return sameIdentity(that)
            && Objects.equals(values, that.values)
            && Objects.equals(indices, that.indices)
            && Objects.equals(visibility, that.visibility);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityHash(), values, indices, visibility);
    }
}
