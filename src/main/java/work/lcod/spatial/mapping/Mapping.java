package work.lcod.spatial.mapping;

import work.lcod.spatial.resource.Resource;

/**
 * Transform from a data domain to display values with per-bucket visibility.
 */
public abstract class Mapping extends Resource {
    public static final String BASE_TYPE = "mappings";

    /**
     * Number of value buckets the mapping defines, or -1 while undefined.
     */
    public abstract int bucketCount();
}
