package work.lcod.spatial.options;

/**
 * Options accepted as volume defaults: {@link BlockModelOptions} or {@link VolumeSlicesOptions}.
 */
public interface VolumeOptions extends ElementOptions {}
