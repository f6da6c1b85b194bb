package work.lcod.spatial.options;

import work.lcod.spatial.data.DataBasic;
import work.lcod.spatial.mapping.Mapping;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.validation.Validatable;

/**
 * A visual channel set either to a single value or to data seen through a mapping.
 *
 * @param <V> value type of the channel
 */
public interface ChannelOptions<V> extends Validatable {
    V value();

    ChannelBinding binding();

    default Ref<DataBasic> data() {
        return binding().data();
    }

    default void setData(Ref<DataBasic> data) {
        binding().setData(data, this);
    }

    default Ref<Mapping> mapping() {
        return binding().mapping();
    }

    default void setMapping(Ref<Mapping> mapping) {
        binding().setMapping(mapping, this);
    }

    @Override
    default void checkFields() {
        binding().checkTargets(this);
    }

    @Override
    default void checkObject() {
        binding().checkPolicy(value() != null, this);
    }

    @Override
    default void visitChildren(ChildVisitor visitor) {
        visitor.visit("data", data());
        visitor.visit("mapping", mapping());
    }
}
