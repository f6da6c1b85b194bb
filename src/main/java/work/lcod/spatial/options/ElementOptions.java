package work.lcod.spatial.options;

import work.lcod.spatial.shared.Color;
import work.lcod.spatial.validation.Validatable;

/**
 * Default display options of an element. Each variant embeds its channel options by value.
 */
public interface ElementOptions extends Validatable {
    boolean visible();

    OpacityOptions opacity();

    ChannelOptions<Color> color();
}
