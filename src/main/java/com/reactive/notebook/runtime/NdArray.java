package com.reactive.notebook.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dense n-dimensional numeric array stored row-major. {@code integral} arrays
 * expose their elements as integers. Rendered as an {@code ndarray}.
 */
public final class NdArray {
    private final double[] data;
    private final int[] shape;
    private final boolean integral;

    public NdArray(double[] data, int[] shape, boolean integral) {
        long size = 1;
        for (int d : shape)
            size *= d;
        if (size != data.length)
            throw CellRuntimeException.valueError("cannot reshape array of size " + data.length
                    + " into shape " + shapeString(shape));
        this.data = data;
        this.shape = shape;
        this.integral = integral;
    }

    /** Builds an array from (possibly nested) lists of numbers. */
    public static NdArray fromNested(Object nested) {
        List<Integer> dims = new ArrayList<>();
        Object head = nested;
        while (head instanceof List<?> l) {
            dims.add(l.size());
            if (l.isEmpty())
                break;
            head = l.get(0);
        }
        int[] shape = dims.stream().mapToInt(Integer::intValue).toArray();
        if (shape.length == 0)
            throw CellRuntimeException.typeError("array() expects a list of numbers");
        int size = 1;
        for (int d : shape)
            size *= d;
        double[] data = new double[size];
        boolean[] integral = { true };
        int[] cursor = { 0 };
        fill(nested, 0, shape, data, cursor, integral);
        return new NdArray(data, shape, integral[0]);
    }

    private static void fill(Object value, int depth, int[] shape, double[] data, int[] cursor,
            boolean[] integral) {
        if (depth == shape.length) {
            if (value instanceof Long l) {
                data[cursor[0]++] = l;
            } else if (value instanceof Double d) {
                integral[0] = false;
                data[cursor[0]++] = d;
            } else if (value instanceof Boolean b) {
                data[cursor[0]++] = b ? 1 : 0;
            } else {
                throw CellRuntimeException.typeError("array elements must be numbers, not '"
                        + Values.typeName(value) + "'");
            }
            return;
        }
        if (!(value instanceof List<?> list) || list.size() != shape[depth])
            throw CellRuntimeException.valueError("setting an array element with a sequence: inhomogeneous shape");
        for (Object item : list)
            fill(item, depth + 1, shape, data, cursor, integral);
    }

    public static NdArray zeros(int[] shape) {
        int size = 1;
        for (int d : shape) {
            if (d < 0)
                throw CellRuntimeException.valueError("negative dimensions are not allowed");
            size *= d;
        }
        return new NdArray(new double[size], shape, false);
    }

    public double[] data() {
        return data;
    }

    public int[] shape() {
        return shape.clone();
    }

    public boolean integral() {
        return integral;
    }

    public int ndim() {
        return shape.length;
    }

    public int size() {
        return data.length;
    }

    public Object element(int flatIndex) {
        return box(data[flatIndex]);
    }

    Object box(double v) {
        return integral ? (Object) (long) v : (Object) v;
    }

    /** Indexes the first axis: a scalar for 1-D arrays, otherwise a sub-array copy. */
    public Object get(int index) {
        int n = shape[0];
        if (index < 0)
            index += n;
        if (index < 0 || index >= n)
            throw new CellRuntimeException("IndexError",
                    "index " + index + " is out of bounds for axis 0 with size " + n);
        if (shape.length == 1)
            return element(index);
        int stride = data.length / n;
        return new NdArray(Arrays.copyOfRange(data, index * stride, (index + 1) * stride),
                Arrays.copyOfRange(shape, 1, shape.length), integral);
    }

    public void set(int index, double value) {
        if (shape.length != 1)
            throw CellRuntimeException.typeError("item assignment is only supported on 1-D arrays");
        int n = shape[0];
        if (index < 0)
            index += n;
        if (index < 0 || index >= n)
            throw new CellRuntimeException("IndexError",
                    "index " + index + " is out of bounds for axis 0 with size " + n);
        data[index] = value;
    }

    public NdArray slice(int from, int to) {
        int stride = shape[0] == 0 ? 0 : data.length / shape[0];
        int[] s = shape.clone();
        s[0] = Math.max(0, to - from);
        return new NdArray(Arrays.copyOfRange(data, from * stride, Math.max(from, to) * stride), s, integral);
    }

    public NdArray reshape(int[] newShape) {
        return new NdArray(data.clone(), newShape, integral);
    }

    /** Nested lists mirroring the shape. */
    public List<Object> toList() {
        int[] cursor = { 0 };
        return toList(0, cursor);
    }

    private List<Object> toList(int depth, int[] cursor) {
        List<Object> out = new ArrayList<>(shape[depth]);
        for (int i = 0; i < shape[depth]; i++) {
            if (depth == shape.length - 1)
                out.add(element(cursor[0]++));
            else
                out.add(toList(depth + 1, cursor));
        }
        return out;
    }

    public static String shapeString(int[] shape) {
        if (shape.length == 1)
            return "(" + shape[0] + ",)";
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < shape.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(shape[i]);
        }
        return sb.append(')').toString();
    }
}
