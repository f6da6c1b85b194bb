package work.lcod.spatial.runtime;

import work.lcod.spatial.codec.DataFormats;
import work.lcod.spatial.codec.ElementFormats;
import work.lcod.spatial.codec.FileFormats;
import work.lcod.spatial.codec.MappingFormats;

/**
 * Shared registry bootstrap so the codec, reference checks, CLI and tests see the same types.
 */
public final class SpatialRegistry {
    private SpatialRegistry() {}

    /**
     * The process-wide registry, built on first use and frozen.
     */
    public static ResourceRegistry standard() {
        return Holder.STANDARD;
    }

    public static ResourceRegistry create() {
        var registry = new ResourceRegistry();
        FileFormats.register(registry);
        DataFormats.register(registry);
        MappingFormats.register(registry);
        ElementFormats.register(registry);
        return registry;
    }

    private static final class Holder {
        private static final ResourceRegistry STANDARD = create().freeze();
    }
}
