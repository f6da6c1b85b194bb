package work.lcod.spatial.interchange;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * Attribute of an exported element, bound to a location tag such as {@code vertices} or
 * {@code faces}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = InterchangeData.ScalarData.class, name = "ScalarData"),
    @JsonSubTypes.Type(value = InterchangeData.MappedData.class, name = "MappedData")
})
public interface InterchangeData {
    String name();

    String location();

    record ScalarData(String name, String description, String location, double[] array) implements InterchangeData {}

    /**
     * Integer indices looked up in the first legend; further legends map the same indices.
     */
    record MappedData(
        String name,
        String description,
        String location,
        int[] array,
        List<Legend> legends
    ) implements InterchangeData {}
}
