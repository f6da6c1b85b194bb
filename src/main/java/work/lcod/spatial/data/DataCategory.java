package work.lcod.spatial.data;

import java.util.List;
import java.util.Objects;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.files.DType;
import work.lcod.spatial.mapping.MappingCategory;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.Checks;
import work.lcod.spatial.validation.ValidationException;

/**
 * Integer attribute whose values are indices into the {@code categories} mapping. Values with
 * no matching category index are no-data.
 */
public final class DataCategory extends DataBasic {
    public static final TypeKey TYPE = new TypeKey(BASE_TYPE, "category");

    private Ref<MappingCategory> categories;

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    public Ref<MappingCategory> categories() {
        return categories;
    }

    public void setCategories(Ref<MappingCategory> categories) {
        checkCategories(categories);
        this.categories = categories;
    }

    @Override
    protected List<Class<?>> allowedMappings() {
        return List.of(MappingCategory.class);
    }

    @Override
    protected void checkArray(ArrayDescriptor value) {
        super.checkArray(value);
        if (value.kind() != DType.INTEGER) {
            throw ValidationException.invalid("array", "DataCategory must use integer array, not " + value.dtype(), this);
        }
    }

    @Override
    public void checkFields() {
        super.checkFields();
        checkCategories(Checks.required("categories", categories, this));
    }

    @Override
    public void visitChildren(ChildVisitor visitor) {
        super.visitChildren(visitor);
        visitor.visit("categories", categories);
    }

    private void checkCategories(Ref<MappingCategory> value) {
        if (value != null) {
            value.checkTarget("categories", this, List.of(MappingCategory.class));
        }
    }

    @Override
    public boolean equals(Object other) {
        return super.equals(other) && Objects.equals(categories, ((DataCategory) other).categories);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), categories);
    }
}
