package work.lcod.spatial.resource;

import java.util.Objects;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.shared.ShortString;
import work.lcod.spatial.validation.Validatable;

/**
 * Base of every registered resource: identity, naming and the type discriminator.
 */
public abstract class Resource implements Validatable {
    private String uid;
    private String name;
    private String description;

    public abstract TypeKey typeKey();

    public String uid() {
        return uid;
    }

    public void setUid(String uid) {
        this.uid = uid;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = ShortString.check("name", name, ShortString.NAME_MAX, this);
    }

    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = ShortString.check("description", description, ShortString.DESCRIPTION_MAX, this);
    }

    @Override
    public void checkFields() {
        ShortString.check("name", name, ShortString.NAME_MAX, this);
        ShortString.check("description", description, ShortString.DESCRIPTION_MAX, this);
    }

    protected final boolean sameIdentity(Resource other) {
        return Objects.equals(uid, other.uid)
            && Objects.equals(name, other.name)
            && Objects.equals(description, other.description);
    }

    protected final int identityHash() {
        return Objects.hash(typeKey(), uid, name, description);
    }

    @Override
    public String toString() {
        String label = name != null ? name : uid;
        return getClass().getSimpleName() + (label == null ? "" : "[" + label + "]");
    }
}
