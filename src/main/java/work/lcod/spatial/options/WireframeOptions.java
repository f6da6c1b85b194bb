package work.lcod.spatial.options;

import work.lcod.spatial.validation.Validatable;

public final class WireframeOptions implements Validatable {
    private boolean active;

    public WireframeOptions() {}

    public WireframeOptions(boolean active) {
        this.active = active;
    }

    public boolean active() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof WireframeOptions that && active == that.active;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(active);
    }
}
