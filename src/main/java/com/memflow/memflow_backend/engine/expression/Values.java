package com.memflow.memflow_backend.engine.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memflow.memflow_backend.exception.EvaluationException;
import com.memflow.memflow_backend.exception.UndefinedVariableException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Value semantics shared by the expression evaluator, the template renderer and the
 * assignment operators: truthiness, equality, ordering, arithmetic and rendering.
 *
 * Integral numbers are handled as {@code long}, everything else numeric as {@code double}.
 */
public final class Values {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Upper bound on strings and lists built by repetition
    static final int MAX_SEQUENCE_LENGTH = 1_000_000;

    private Values() {
    }

    // ── Classification ───────────────────────────────────────────────────────

    public static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    /** Normalises any {@link Number} to {@code Long} or {@code Double}; other values pass through. */
    public static Object normalize(Object value) {
        if (value instanceof Long || value instanceof Double) return value;
        if (value instanceof BigInteger big) {
            if (big.bitLength() < 64) return big.longValue();
            return big.doubleValue();
        }
        if (value instanceof BigDecimal dec) return dec.doubleValue();
        if (isIntegral(value)) return ((Number) value).longValue();
        if (value instanceof Number n) return n.doubleValue();
        return value;
    }

    public static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof Undefined) return "undefined";
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (isIntegral(value)) return "integer";
        if (value instanceof Number) return "float";
        if (value instanceof List<?>) return "array";
        if (value instanceof Map<?, ?>) return "object";
        return value.getClass().getSimpleName();
    }

    // ── Truthiness & equality ────────────────────────────────────────────────

    public static boolean truthy(Object value) {
        if (value == null || value instanceof Undefined) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number) {
            Object n = normalize(value);
            return n instanceof Long l ? l != 0L : (Double) n != 0.0d;
        }
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    public static boolean looseEquals(Object left, Object right) {
        if (left instanceof Undefined) left = null;
        if (right instanceof Undefined) right = null;
        if (left == null || right == null) return left == right;
        if (left instanceof Number && right instanceof Number) {
            Object l = normalize(left);
            Object r = normalize(right);
            if (l instanceof Long a && r instanceof Long b) return a.longValue() == b.longValue();
            return ((Number) l).doubleValue() == ((Number) r).doubleValue();
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) return false;
            Iterator<?> ia = a.iterator();
            Iterator<?> ib = b.iterator();
            while (ia.hasNext()) {
                if (!looseEquals(ia.next(), ib.next())) return false;
            }
            return true;
        }
        if (left instanceof Map<?, ?> a && right instanceof Map<?, ?> b) {
            if (!a.keySet().equals(b.keySet())) return false;
            for (Object key : a.keySet()) {
                if (!looseEquals(a.get(key), b.get(key))) return false;
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    public static int compare(Object left, Object right, String operator) {
        if (left instanceof Number && right instanceof Number) {
            Object l = normalize(left);
            Object r = normalize(right);
            if (l instanceof Long a && r instanceof Long b) return Long.compare(a, b);
            return Double.compare(((Number) l).doubleValue(), ((Number) r).doubleValue());
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left instanceof Boolean a && right instanceof Boolean b) {
            return Boolean.compare(a, b);
        }
        throw unsupported(operator, left, right);
    }

    public static boolean contains(Object container, Object item) {
        if (container instanceof Undefined) return false;
        if (container instanceof String s) {
            if (item instanceof Undefined) return false;
            if (!(item instanceof String needle)) {
                throw new EvaluationException("'in <string>' requires a string on the left, got " + typeName(item));
            }
            return s.contains(needle);
        }
        if (container instanceof Collection<?> c) {
            for (Object element : c) {
                if (looseEquals(element, item)) return true;
            }
            return false;
        }
        if (container instanceof Map<?, ?> m) {
            return m.containsKey(item);
        }
        throw new EvaluationException("Argument of type " + typeName(container) + " is not a container");
    }

    // ── Arithmetic ───────────────────────────────────────────────────────────

    public static Object add(Object left, Object right) {
        checkDefined(left, right);
        if (left instanceof Number && right instanceof Number) {
            Object l = normalize(left);
            Object r = normalize(right);
            if (l instanceof Long a && r instanceof Long b) return exact(() -> Math.addExact(a, b));
            return ((Number) l).doubleValue() + ((Number) r).doubleValue();
        }
        if (left instanceof String a && right instanceof String b) {
            return a + b;
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            List<Object> joined = new ArrayList<>(a);
            joined.addAll(b);
            return joined;
        }
        throw unsupported("+", left, right);
    }

    public static Object subtract(Object left, Object right) {
        Object[] n = numbers("-", left, right);
        if (n[0] instanceof Long a && n[1] instanceof Long b) return exact(() -> Math.subtractExact(a, b));
        return ((Number) n[0]).doubleValue() - ((Number) n[1]).doubleValue();
    }

    public static Object multiply(Object left, Object right) {
        checkDefined(left, right);
        if (left instanceof String s && isIntegral(right)) {
            return repeatString(s, ((Number) right).longValue());
        }
        if (left instanceof List<?> list && isIntegral(right)) {
            return repeatList(list, ((Number) right).longValue());
        }
        Object[] n = numbers("*", left, right);
        if (n[0] instanceof Long a && n[1] instanceof Long b) return exact(() -> Math.multiplyExact(a, b));
        return ((Number) n[0]).doubleValue() * ((Number) n[1]).doubleValue();
    }

    /** True division: always a {@code double}, like the numeric division users expect from formulas. */
    public static Object divide(Object left, Object right) {
        Object[] n = numbers("/", left, right);
        double divisor = ((Number) n[1]).doubleValue();
        if (divisor == 0.0d) {
            throw new EvaluationException("Division by zero");
        }
        return ((Number) n[0]).doubleValue() / divisor;
    }

    public static Object floorDivide(Object left, Object right) {
        Object[] n = numbers("//", left, right);
        if (((Number) n[1]).doubleValue() == 0.0d) {
            throw new EvaluationException("Division by zero");
        }
        if (n[0] instanceof Long a && n[1] instanceof Long b) return Math.floorDiv(a, b);
        return Math.floor(((Number) n[0]).doubleValue() / ((Number) n[1]).doubleValue());
    }

    public static Object modulo(Object left, Object right) {
        Object[] n = numbers("%", left, right);
        if (((Number) n[1]).doubleValue() == 0.0d) {
            throw new EvaluationException("Modulo by zero");
        }
        if (n[0] instanceof Long a && n[1] instanceof Long b) return Math.floorMod(a, b);
        double a = ((Number) n[0]).doubleValue();
        double b = ((Number) n[1]).doubleValue();
        return a - b * Math.floor(a / b);
    }

    public static Object power(Object left, Object right) {
        Object[] n = numbers("**", left, right);
        if (n[0] instanceof Long base && n[1] instanceof Long exponent && exponent >= 0) {
            return exact(() -> {
                long result = 1L;
                long b = base;
                long e = exponent;
                while (e > 0) {
                    if ((e & 1L) == 1L) result = Math.multiplyExact(result, b);
                    e >>= 1;
                    if (e > 0) b = Math.multiplyExact(b, b);
                }
                return result;
            });
        }
        double a = ((Number) n[0]).doubleValue();
        double b = ((Number) n[1]).doubleValue();
        if (a == 0.0d && b < 0) {
            throw new EvaluationException("Zero cannot be raised to a negative power");
        }
        return Math.pow(a, b);
    }

    public static Object negate(Object value) {
        checkDefined(value);
        Object n = normalize(value);
        if (n instanceof Long l) return exact(() -> Math.negateExact(l));
        if (n instanceof Double d) return -d;
        throw new EvaluationException("Bad operand type for unary -: " + typeName(value));
    }

    public static Object plus(Object value) {
        checkDefined(value);
        Object n = normalize(value);
        if (n instanceof Long || n instanceof Double) return n;
        throw new EvaluationException("Bad operand type for unary +: " + typeName(value));
    }

    // ── Rendering ────────────────────────────────────────────────────────────

    /** Text form used when a value is substituted into a template. */
    public static String stringify(Object value) {
        if (value == null || value instanceof Undefined) return "";
        if (value instanceof String s) return s;
        if (value instanceof Double d) {
            if (!d.isInfinite() && !d.isNaN() && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString(d.longValue());
            }
            return d.toString();
        }
        if (value instanceof Number || value instanceof Boolean) return value.toString();
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Object[] numbers(String operator, Object left, Object right) {
        checkDefined(left, right);
        if (!(left instanceof Number) || !(right instanceof Number)) {
            throw unsupported(operator, left, right);
        }
        return new Object[]{normalize(left), normalize(right)};
    }

    private static void checkDefined(Object... operands) {
        for (Object operand : operands) {
            if (operand instanceof Undefined u) {
                throw new UndefinedVariableException(u.getName());
            }
        }
    }

    private static String repeatString(String s, long count) {
        if (count <= 0 || s.isEmpty()) return "";
        if (repeatedLength(s.length(), count) > MAX_SEQUENCE_LENGTH) {
            throw new EvaluationException("Repeated string would exceed " + MAX_SEQUENCE_LENGTH + " characters");
        }
        return s.repeat((int) count);
    }

    private static List<Object> repeatList(List<?> list, long count) {
        List<Object> result = new ArrayList<>();
        if (count <= 0 || list.isEmpty()) return result;
        if (repeatedLength(list.size(), count) > MAX_SEQUENCE_LENGTH) {
            throw new EvaluationException("Repeated list would exceed " + MAX_SEQUENCE_LENGTH + " elements");
        }
        for (long i = 0; i < count; i++) {
            result.addAll(list);
        }
        return result;
    }

    private static long repeatedLength(int length, long count) {
        try {
            return Math.multiplyExact(length, count);
        } catch (ArithmeticException e) {
            throw new EvaluationException("Repetition count " + count + " is too large", e);
        }
    }

    private static Object exact(LongSupplier op) {
        try {
            return op.getAsLong();
        } catch (ArithmeticException e) {
            throw new EvaluationException("Integer overflow", e);
        }
    }

    static EvaluationException unsupported(String operator, Object left, Object right) {
        return new EvaluationException("Unsupported operand types for " + operator + ": "
                + typeName(left) + " and " + typeName(right));
    }
}
