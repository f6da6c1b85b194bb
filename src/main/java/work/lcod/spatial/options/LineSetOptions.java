package work.lcod.spatial.options;

/**
 * Options accepted as line-set defaults: {@link LinesOptions} or {@link TubesOptions}.
 */
public interface LineSetOptions extends ElementOptions {}
