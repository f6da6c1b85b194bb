package work.lcod.spatial.mapping;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.Checks;
import work.lcod.spatial.validation.ValidationException;

/**
 * Maps continuous data onto discrete intervals split at {@code end_points}.
 *
 * <p>The first interval starts at -inf and the last ends at +inf, so there is one more value
 * than end point. {@code end_inclusive[i]} tells whether end point {@code i} belongs to the
 * lower interval.
 */
public final class MappingDiscrete extends Mapping {
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "discrete");
    static final int MAX_END_POINTS = 255;

    private MappingValues values;
    private List<Double> endPoints;
    private List<Boolean> endInclusive;
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

    public List<Double> endPoints() {
        return endPoints;
    }

    public void setEndPoints(List<Double> endPoints) {
        this.endPoints = checkEndPoints(endPoints);
    }

    public List<Boolean> endInclusive() {
        return endInclusive;
    }

    public void setEndInclusive(List<Boolean> endInclusive) {
        this.endInclusive = checkEndInclusive(endInclusive);
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
        checkEndPoints(Checks.required("end_points", endPoints, this));
        checkEndInclusive(Checks.required("end_inclusive", endInclusive, this));
        checkVisibility(Checks.required("visibility", visibility, this));
    }

    @Override
    public void checkObject() {
        if (values.size() != visibility.size()) {
            throw ValidationException.invalid("visibility", "values and visibility must be equal length", this);
        }
        if (values.size() != endPoints.size() + 1) {
            throw ValidationException.invalid("end_points", "values must be one longer than end points", this);
        }
        if (values.size() != endInclusive.size() + 1) {
            throw ValidationException.invalid("end_inclusive", "values must be one longer than end inclusive", this);
        }
    }

    private List<Double> checkEndPoints(List<Double> value) {
        if (value == null) {
            return null;
        }
        Checks.noNulls("end_points", value, this);
        Checks.maxSize("end_points", value, MAX_END_POINTS, this);
        Checks.nonDecreasing("end_points", value, "end points", this);
        return List.copyOf(value);
    }

    private List<Boolean> checkEndInclusive(List<Boolean> value) {
        if (value == null) {
            return null;
        }
        Checks.noNulls("end_inclusive", value, this);
        Checks.maxSize("end_inclusive", value, MAX_END_POINTS, this);
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
        if (!(other instanceof MappingDiscrete that)) {
            return false;
        }
        return sameIdentity(that)
            && Objects.equals(values, that.values)
            && Objects.equals(endPoints, that.endPoints)
            && Objects.equals(endInclusive, that.endInclusive)
            && Objects.equals(visibility, that.visibility);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityHash(), values, endPoints, endInclusive, visibility);
    }
}
