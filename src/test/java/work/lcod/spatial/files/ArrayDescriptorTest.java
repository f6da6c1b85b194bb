package work.lcod.spatial.files;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ArrayDescriptorTest {
    @Test
    void describedArraysAreNotMaterialized() {
        var array = ArrayDescriptor.describe(DType.FLOAT64, 4, 3);
        assertFalse(array.isMaterialized());
        assertEquals(2, array.rank());
        assertEquals(OptionalInt.of(4), array.length());
        assertTrue(array.max().isEmpty());
        assertThrows(IllegalStateException.class, array::rows);
    }

    @Test
    void rowsAndNestedFollowTheShape() {
        var array = ArrayDescriptor.ofIntegers(new long[][] {{0, 1}, {1, 2}});
        assertEquals(List.of(2, 2), array.shape());
        assertEquals(DType.INTEGER, array.kind());
        assertArrayEquals(new int[] {1, 2}, array.intRows()[1]);
        assertEquals(List.of(List.of(0L, 1L), List.of(1L, 2L)), array.nested());
        assertEquals(2.0, array.max().getAsDouble());
    }

    @Test
    void valuesMustMatchTheShape() {
        assertThrows(
            IllegalArgumentException.class,
            () -> new ArrayDescriptor(DType.FLOAT64, List.of(2, 3), new double[] {1, 2, 3}, null)
        );
        assertThrows(
            IllegalArgumentException.class,
            () -> new ArrayDescriptor(DType.INT32, List.of(1), new double[] {0.5}, null)
        );
        assertThrows(IllegalArgumentException.class, () -> ArrayDescriptor.of(new double[][] {{1, 2}, {3}}));
    }

    @Test
    void integerValuesMustFitTheDtype() {
        var error = assertThrows(
            IllegalArgumentException.class,
            () -> new ArrayDescriptor(DType.INT32, List.of(1), new double[] {3e9}, null)
        );
        assertTrue(error.getMessage().contains("Int32Array cannot hold 3000000000"));
        assertThrows(
            IllegalArgumentException.class,
            () -> new ArrayDescriptor("Uint8Array", List.of(1), new double[] {-1}, null)
        );
        assertThrows(
            IllegalArgumentException.class,
            () -> new ArrayDescriptor("Int16Array", List.of(1), new double[] {40000}, null)
        );

        var wide = new ArrayDescriptor("Uint32Array", List.of(2), new double[] {1, 3e9}, null);
        assertEquals(3e9, wide.max().getAsDouble());
        assertThrows(IllegalStateException.class, wide::intValues);
        assertArrayEquals(new int[] {4, 5}, ArrayDescriptor.ofIntegers(4, 5).intValues());
    }

    @Test
    void equalityCoversValues() {
        assertEquals(ArrayDescriptor.of(1, 2), ArrayDescriptor.of(1, 2));
        assertNotEquals(ArrayDescriptor.of(1, 2), ArrayDescriptor.of(1, 3));
        assertEquals(ArrayDescriptor.of(Double.NaN), ArrayDescriptor.of(Double.NaN));
    }

    @Test
    void dtypeTagsAreClassified() {
        assertEquals(DType.INTEGER, DType.classify("Uint8Array"));
        assertEquals(DType.FLOAT, DType.classify(DType.FLOAT32));
    }
}
