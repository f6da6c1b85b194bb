package work.lcod.spatial.options;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.data.DataBasic;
import work.lcod.spatial.data.DataCategory;
import work.lcod.spatial.mapping.Mapping;
import work.lcod.spatial.mapping.MappingCategory;
import work.lcod.spatial.mapping.MappingContinuous;
import work.lcod.spatial.mapping.MappingDiscrete;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.validation.ValidationException;

/**
 * The {@code (data, mapping)} pair a visual channel may use instead of a static value.
 */
public final class ChannelBinding {
    static final List<Class<?>> DATA_TYPES = List.of(DataCategory.class, DataBasic.class);
    static final List<Class<?>> MAPPING_TYPES = List.of(
        MappingContinuous.class,
        MappingDiscrete.class,
        MappingCategory.class
    );

    private Ref<DataBasic> data;
    private Ref<Mapping> mapping;

    public Ref<DataBasic> data() {
        return data;
    }

    void setData(Ref<DataBasic> data, Object owner) {
        if (data != null) {
            data.checkTarget("data", owner, DATA_TYPES);
        }
        this.data = data;
    }

    public Ref<Mapping> mapping() {
        return mapping;
    }

    void setMapping(Ref<Mapping> mapping, Object owner) {
        if (mapping != null) {
            mapping.checkTarget("mapping", owner, MAPPING_TYPES);
        }
        this.mapping = mapping;
    }

    void checkTargets(Object owner) {
        if (data != null) {
            data.checkTarget("data", owner, DATA_TYPES);
        }
        if (mapping != null) {
            mapping.checkTarget("mapping", owner, MAPPING_TYPES);
        }
    }

    /**
     * Data requires a mapping, whether or not it resolves; without data a value is required.
     */
    void checkPolicy(boolean hasValue, Object owner) {
        if (data != null && mapping == null) {
            throw ValidationException.missing(
                "mapping",
                "Mapping must be specified on visualization options if data is present",
                owner
            );
        }
        if (data == null && !hasValue) {
            throw ValidationException.missing(
                "value",
                "Value must be specified on visualization options if data is not",
                owner
            );
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ChannelBinding that)) {
            return false;
        }
        return Objects.equals(data, that.data) && Objects.equals(mapping, that.mapping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(data, mapping);
    }
}
