package work.lcod.spatial.files;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import work.lcod.spatial.resource.Resource;
import work.lcod.spatial.runtime.TypeKey;

/**
 * Numeric array known by shape and element type; values are present only once materialized.
 *
 * <p>Values are stored flat in row-major order. Shape and values never change after
 * construction.
 */
public final class ArrayDescriptor extends Resource {
    public static final TypeKey TYPE = new TypeKey("files", "array");

    private final List<Integer> shape;
    private final String dtype;
    private final double[] values;
    private final Long contentLength;

    public ArrayDescriptor(String dtype, List<Integer> shape, double[] values, Long contentLength) {
        if (dtype == null || dtype.isBlank()) {
            throw new IllegalArgumentException("dtype must be provided");
        }
        Objects.requireNonNull(shape, "shape");
        for (Integer dim : shape) {
            if (dim == null || dim < 0) {
                throw new IllegalArgumentException("shape dimensions must be non-negative: " + shape);
            }
        }
        if (contentLength != null && contentLength < 0) {
            throw new IllegalArgumentException("content_length must be non-negative: " + contentLength);
        }
        this.shape = List.copyOf(shape);
        this.dtype = dtype;
        this.contentLength = contentLength;
        if (values != null) {
            long expected = elementCount(this.shape);
            if (values.length != expected) {
                throw new IllegalArgumentException(
                    "array holds " + values.length + " values but shape " + shape + " needs " + expected
                );
            }
            if (DType.classify(dtype) == DType.INTEGER) {
                long[] range = DType.integerRange(dtype);
                for (double value : values) {
                    if (value != Math.rint(value)) {
                        throw new IllegalArgumentException(dtype + " cannot hold non-integer value " + value);
                    }
                    if (range != null && (value < range[0] || value > range[1])) {
                        throw new IllegalArgumentException(
                            dtype + " cannot hold " + (long) value + ", range is " + range[0] + ".." + range[1]
                        );
                    }
                }
            }
            this.values = values.clone();
        } else {
            this.values = null;
        }
    }

    /**
     * Descriptor of a remote array known only by element type and shape.
     */
    public static ArrayDescriptor describe(String dtype, int... shape) {
        return new ArrayDescriptor(dtype, boxed(shape), null, null);
    }

    public static ArrayDescriptor of(double... values) {
        return new ArrayDescriptor(DType.FLOAT64, List.of(values.length), values, null);
    }

    public static ArrayDescriptor of(double[][] rows) {
        int columns = rows.length == 0 ? 0 : rows[0].length;
        return new ArrayDescriptor(DType.FLOAT64, List.of(rows.length, columns), flatten(rows), null);
    }

    public static ArrayDescriptor ofIntegers(long... values) {
        double[] flat = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            flat[i] = values[i];
        }
        return new ArrayDescriptor(DType.INT32, List.of(values.length), flat, null);
    }

    public static ArrayDescriptor ofIntegers(long[][] rows) {
        double[][] converted = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            converted[i] = new double[rows[i].length];
            for (int j = 0; j < rows[i].length; j++) {
                converted[i][j] = rows[i][j];
            }
        }
        int columns = rows.length == 0 ? 0 : rows[0].length;
        return new ArrayDescriptor(DType.INT32, List.of(rows.length, columns), flatten(converted), null);
    }

    @Override
    public TypeKey typeKey() {
        return TYPE;
    }

    public List<Integer> shape() {
        return shape;
    }

    public String dtype() {
        return dtype;
    }

    public DType kind() {
        return DType.classify(dtype);
    }

    public Long contentLength() {
        return contentLength;
    }

    public int rank() {
        return shape.size();
    }

    /**
     * @return the first dimension, empty for rank-0 arrays
     */
    public OptionalInt length() {
        return shape.isEmpty() ? OptionalInt.empty() : OptionalInt.of(shape.get(0));
    }

    public boolean isMaterialized() {
        return values != null;
    }

    /**
     * @return a copy of the flat row-major values, or {@code null} when not materialized
     */
    public double[] values() {
        return values == null ? null : values.clone();
    }

    public OptionalDouble min() {
        return values == null ? OptionalDouble.empty() : Arrays.stream(values).min();
    }

    public OptionalDouble max() {
        return values == null ? OptionalDouble.empty() : Arrays.stream(values).max();
    }

    /**
     * Materialized rank-2 values as rows.
     */
    public double[][] rows() {
        requireMaterialized();
        if (rank() != 2) {
            throw new IllegalStateException("rows() needs a rank-2 array, shape is " + shape);
        }
        int columns = shape.get(1);
        double[][] rows = new double[shape.get(0)][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = Arrays.copyOfRange(values, i * columns, (i + 1) * columns);
        }
        return rows;
    }

    public int[][] intRows() {
        double[][] rows = rows();
        int[][] ints = new int[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            ints[i] = new int[rows[i].length];
            for (int j = 0; j < rows[i].length; j++) {
                ints[i][j] = toInt(rows[i][j]);
            }
        }
        return ints;
    }

    /**
     * Materialized values as ints; fails on values outside the int range.
     */
    public int[] intValues() {
        requireMaterialized();
        int[] ints = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            ints[i] = toInt(values[i]);
        }
        return ints;
    }

    private int toInt(double value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE || value != Math.rint(value)) {
            throw new IllegalStateException(dtype + " value " + value + " does not fit an int");
        }
        return (int) value;
    }

    /**
     * Rebuilds the nested list form of the values following the shape.
     */
    public Object nested() {
        requireMaterialized();
        if (shape.isEmpty()) {
            return values.length == 0 ? List.of() : box(values[0]);
        }
        return nest(0, 0);
    }

    private Object nest(int axis, int offset) {
        int size = shape.get(axis);
        List<Object> list = new ArrayList<>(size);
        if (axis == shape.size() - 1) {
            for (int i = 0; i < size; i++) {
                list.add(box(values[offset + i]));
            }
            return list;
        }
        int stride = (int) elementCount(shape.subList(axis + 1, shape.size()));
        for (int i = 0; i < size; i++) {
            list.add(nest(axis + 1, offset + i * stride));
        }
        return list;
    }

    private Number box(double value) {
        if (kind() == DType.INTEGER) {
            return (long) value;
        }
        return value;
    }

    private void requireMaterialized() {
        if (values == null) {
            throw new IllegalStateException("array values are not materialized");
        }
    }

    private static long elementCount(List<Integer> shape) {
        long count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }

    private static List<Integer> boxed(int[] shape) {
        List<Integer> list = new ArrayList<>(shape.length);
        for (int dim : shape) {
            list.add(dim);
        }
        return list;
    }

    private static double[] flatten(double[][] rows) {
        int columns = rows.length == 0 ? 0 : rows[0].length;
        double[] flat = new double[rows.length * columns];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != columns) {
                throw new IllegalArgumentException("ragged rows: row " + i + " has " + rows[i].length + " values, expected " + columns);
            }
            System.arraycopy(rows[i], 0, flat, i * columns, columns);
        }
        return flat;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ArrayDescriptor that)) {
            return false;
        }
        return sameIdentity(that)
            && shape.equals(that.shape)
            && dtype.equals(that.dtype)
            && Arrays.equals(values, that.values)
            && Objects.equals(contentLength, that.contentLength);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityHash(), shape, dtype, Arrays.hashCode(values), contentLength);
    }
}
