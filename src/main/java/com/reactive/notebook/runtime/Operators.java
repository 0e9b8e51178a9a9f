package com.reactive.notebook.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Arithmetic and comparison operators. Integer arithmetic is exact and raises
 * {@code OverflowError} instead of wrapping; arrays and columns combine
 * element-wise with scalars and with operands of the same shape.
 */
public final class Operators {

    private Operators() {
    }

    public static Object binary(String op, Object left, Object right) {
        switch (op) {
            case "==":
                return Values.equal(left, right);
            case "!=":
                return !Values.equal(left, right);
            case "<":
                return Values.compare(left, right, op) < 0;
            case "<=":
                return Values.compare(left, right, op) <= 0;
            case ">":
                return Values.compare(left, right, op) > 0;
            case ">=":
                return Values.compare(left, right, op) >= 0;
            case "in":
                return Values.contains(right, left);
            case "not in":
                return !Values.contains(right, left);
            default:
                return arithmetic(op, left, right);
        }
    }

    public static Object negate(Object v) {
        if (v instanceof Long l) {
            if (l == Long.MIN_VALUE)
                throw overflow();
            return -l;
        }
        if (v instanceof Double d)
            return -d;
        if (v instanceof NdArray || v instanceof Column)
            return arithmetic("*", v, -1L);
        throw CellRuntimeException.typeError("bad operand type for unary -: '" + Values.typeName(v) + "'");
    }

    private static Object arithmetic(String op, Object a, Object b) {
        if (a instanceof NdArray || b instanceof NdArray)
            return arrayOp(op, a, b);
        if (a instanceof Column || b instanceof Column)
            return columnOp(op, a, b);
        if (a instanceof Long x && b instanceof Long y)
            return integerOp(op, x, y);
        if (Values.isNumber(a) && Values.isNumber(b))
            return doubleOp(op, Values.toDouble(a), Values.toDouble(b));
        switch (op) {
            case "+":
                if (a instanceof String s && b instanceof String t)
                    return s + t;
                if (a instanceof List<?> l && b instanceof List<?> m) {
                    List<Object> out = new ArrayList<>(l);
                    out.addAll(m);
                    return out;
                }
                break;
            case "*":
                if (a instanceof String s && b instanceof Long n)
                    return n <= 0 ? "" : s.repeat(Math.toIntExact(n));
                if (a instanceof Long n && b instanceof String s)
                    return n <= 0 ? "" : s.repeat(Math.toIntExact(n));
                if (a instanceof List<?> l && b instanceof Long n)
                    return repeat(l, n);
                if (a instanceof Long n && b instanceof List<?> l)
                    return repeat(l, n);
                break;
            default:
                break;
        }
        throw CellRuntimeException.typeError("unsupported operand type(s) for " + op + ": '"
                + Values.typeName(a) + "' and '" + Values.typeName(b) + "'");
    }

    private static List<Object> repeat(List<?> items, long n) {
        List<Object> out = new ArrayList<>();
        for (long i = 0; i < n; i++) {
            CancellationToken.checkThread();
            out.addAll(items);
        }
        return out;
    }

    private static Object integerOp(String op, long x, long y) {
        try {
            switch (op) {
                case "+":
                    return Math.addExact(x, y);
                case "-":
                    return Math.subtractExact(x, y);
                case "*":
                    return Math.multiplyExact(x, y);
                case "/":
                    if (y == 0)
                        throw zeroDivision("division by zero");
                    return (double) x / (double) y;
                case "//":
                    if (y == 0)
                        throw zeroDivision("integer division or modulo by zero");
                    return Math.floorDiv(x, y);
                case "%":
                    if (y == 0)
                        throw zeroDivision("integer division or modulo by zero");
                    return Math.floorMod(x, y);
                case "**":
                    if (y < 0)
                        return Math.pow(x, y);
                    return power(x, y);
                default:
                    throw new IllegalArgumentException("Unknown operator " + op);
            }
        } catch (ArithmeticException e) {
            throw overflow();
        }
    }

    private static long power(long base, long exp) {
        long result = 1;
        long b = base;
        long e = exp;
        while (e > 0) {
            if ((e & 1) == 1)
                result = Math.multiplyExact(result, b);
            e >>= 1;
            if (e > 0)
                b = Math.multiplyExact(b, b);
        }
        return result;
    }

    private static double doubleOp(String op, double x, double y) {
        switch (op) {
            case "+":
                return x + y;
            case "-":
                return x - y;
            case "*":
                return x * y;
            case "/":
                if (y == 0)
                    throw zeroDivision("float division by zero");
                return x / y;
            case "//":
                if (y == 0)
                    throw zeroDivision("float floor division by zero");
                return Math.floor(x / y);
            case "%":
                if (y == 0)
                    throw zeroDivision("float modulo");
                return x - y * Math.floor(x / y);
            case "**":
                return Math.pow(x, y);
            default:
                throw new IllegalArgumentException("Unknown operator " + op);
        }
    }

    private static NdArray arrayOp(String op, Object a, Object b) {
        NdArray left = a instanceof NdArray x ? x : null;
        NdArray right = b instanceof NdArray y ? y : null;
        if ((left == null && !Values.isNumber(a)) || (right == null && !Values.isNumber(b)))
            throw CellRuntimeException.typeError("unsupported operand type(s) for " + op + ": '"
                    + Values.typeName(a) + "' and '" + Values.typeName(b) + "'");
        if (left != null && right != null && !Arrays.equals(left.shape(), right.shape()))
            throw CellRuntimeException.valueError("operands could not be broadcast together with shapes "
                    + NdArray.shapeString(left.shape()) + " " + NdArray.shapeString(right.shape()));
        NdArray shapeSource = left != null ? left : right;
        int n = shapeSource.size();
        double[] out = new double[n];
        boolean integral = (left == null ? a instanceof Long : left.integral())
                && (right == null ? b instanceof Long : right.integral())
                && !op.equals("/") && !op.equals("**");
        for (int i = 0; i < n; i++) {
            double x = left != null ? left.data()[i] : Values.toDouble(a);
            double y = right != null ? right.data()[i] : Values.toDouble(b);
            out[i] = elementOp(op, x, y);
        }
        return new NdArray(out, shapeSource.shape(), integral);
    }

    private static double elementOp(String op, double x, double y) {
        switch (op) {
            case "+":
                return x + y;
            case "-":
                return x - y;
            case "*":
                return x * y;
            case "/":
                return x / y;
            case "//":
                return Math.floor(x / y);
            case "%":
                return y == 0 ? Double.NaN : x - y * Math.floor(x / y);
            case "**":
                return Math.pow(x, y);
            default:
                throw new IllegalArgumentException("Unknown operator " + op);
        }
    }

    private static Column columnOp(String op, Object a, Object b) {
        Column left = a instanceof Column x ? x : null;
        Column right = b instanceof Column y ? y : null;
        if (left != null && right != null && left.size() != right.size())
            throw CellRuntimeException.valueError("can only combine columns of the same length");
        Column shapeSource = left != null ? left : right;
        List<Object> out = new ArrayList<>(shapeSource.size());
        for (int i = 0; i < shapeSource.size(); i++) {
            Object x = left != null ? left.values().get(i) : a;
            Object y = right != null ? right.values().get(i) : b;
            out.add(x == null || y == null ? null : arithmetic(op, x, y));
        }
        return new Column(shapeSource.name(), out);
    }

    /** Sorts in place with the language's ordering. */
    public static void sort(List<Object> items) {
        Collections.sort(items, (x, y) -> Values.compare(x, y, "<"));
    }

    private static CellRuntimeException zeroDivision(String message) {
        return new CellRuntimeException("ZeroDivisionError", message);
    }

    private static CellRuntimeException overflow() {
        return new CellRuntimeException("OverflowError", "integer overflow");
    }
}
