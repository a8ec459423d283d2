package com.memflow.memflow_backend.engine.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memflow.memflow_backend.exception.EvaluationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Template filters ({@code {{ name | upper }}}). The set is fixed; a template naming any
 * other filter fails to parse.
 */
final class Filters {

    @FunctionalInterface
    private interface Filter {
        Object apply(Object value, List<Object> arguments);
    }

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, Filter> FILTERS = new HashMap<>();

    static {
        FILTERS.put("upper", (value, args) -> text(value).toUpperCase(Locale.ROOT));
        FILTERS.put("lower", (value, args) -> text(value).toLowerCase(Locale.ROOT));
        FILTERS.put("capitalize", (value, args) -> capitalize(text(value)));
        FILTERS.put("title", (value, args) -> title(text(value)));
        FILTERS.put("trim", (value, args) -> text(value).strip());
        FILTERS.put("string", (value, args) -> text(value));
        FILTERS.put("length", (value, args) -> length(value));
        FILTERS.put("count", (value, args) -> length(value));
        FILTERS.put("default", Filters::defaultValue);
        FILTERS.put("d", Filters::defaultValue);
        FILTERS.put("join", Filters::join);
        FILTERS.put("first", (value, args) -> edge(value, true));
        FILTERS.put("last", (value, args) -> edge(value, false));
        FILTERS.put("replace", Filters::replace);
        FILTERS.put("round", Filters::round);
        FILTERS.put("int", Filters::toInt);
        FILTERS.put("float", Filters::toFloat);
        FILTERS.put("abs", (value, args) -> abs(value));
        FILTERS.put("list", (value, args) -> items(value, "list"));
        FILTERS.put("sort", (value, args) -> sort(value));
        FILTERS.put("reverse", (value, args) -> reverse(value));
        FILTERS.put("dictsort", (value, args) -> dictsort(value));
        FILTERS.put("sum", (value, args) -> sum(value));
        FILTERS.put("tojson", (value, args) -> toJson(value));
    }

    private Filters() {
    }

    static boolean isKnown(String name) {
        return FILTERS.containsKey(name);
    }

    static boolean acceptsUndefined(String name) {
        return "default".equals(name) || "d".equals(name);
    }

    static Object apply(String name, Object value, List<Object> arguments) {
        Filter filter = FILTERS.get(name);
        if (filter == null) {
            throw new EvaluationException("Unknown filter '" + name + "'");
        }
        return filter.apply(value, arguments);
    }

    // ── Strings ──────────────────────────────────────────────────────────────

    private static String text(Object value) {
        return Values.stringify(value);
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) return s;
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }

    private static String title(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean wordStart = true;
        for (char c : s.toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                sb.append(wordStart ? Character.toUpperCase(c) : Character.toLowerCase(c));
                wordStart = false;
            } else {
                sb.append(c);
                wordStart = true;
            }
        }
        return sb.toString();
    }

    private static Object replace(Object value, List<Object> args) {
        if (args.size() != 2) {
            throw new EvaluationException("replace expects 2 arguments, got " + args.size());
        }
        return text(value).replace(text(args.get(0)), text(args.get(1)));
    }

    private static Object join(Object value, List<Object> args) {
        String separator = args.isEmpty() ? "" : text(args.get(0));
        StringJoiner joiner = new StringJoiner(separator);
        for (Object item : items(value, "join")) {
            joiner.add(text(item));
        }
        return joiner.toString();
    }

    private static Object toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value instanceof Undefined ? null : value);
        } catch (JsonProcessingException e) {
            throw new EvaluationException("Value cannot be written as JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ── Fallbacks ────────────────────────────────────────────────────────────

    /** {@code default(value="", boolean=false)}: with {@code boolean} true, falsy values are replaced too. */
    private static Object defaultValue(Object value, List<Object> args) {
        Object fallback = args.isEmpty() ? "" : args.get(0);
        boolean replaceFalsy = args.size() > 1 && Values.truthy(args.get(1));
        if (value instanceof Undefined || (replaceFalsy && !Values.truthy(value))) {
            return fallback;
        }
        return value;
    }

    // ── Numbers ──────────────────────────────────────────────────────────────

    private static Object round(Object value, List<Object> args) {
        if (!(value instanceof Number number)) {
            throw new EvaluationException("round expects a number, got " + Values.typeName(value));
        }
        int precision = args.isEmpty() ? 0 : (int) integer(args.get(0), "round precision");
        return BigDecimal.valueOf(number.doubleValue()).setScale(precision, RoundingMode.HALF_UP).doubleValue();
    }

    private static Object toInt(Object value, List<Object> args) {
        Object fallback = args.isEmpty() ? 0L : args.get(0);
        Object n = Values.normalize(value);
        if (n instanceof Long) return n;
        if (n instanceof Double d) return d.isNaN() || d.isInfinite() ? fallback : (long) d.doubleValue();
        if (n instanceof Boolean b) return b ? 1L : 0L;
        if (n instanceof String s) {
            try {
                return new BigDecimal(s.strip()).longValue();
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static Object toFloat(Object value, List<Object> args) {
        Object fallback = args.isEmpty() ? 0.0d : args.get(0);
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.strip());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static Object abs(Object value) {
        Object n = Values.normalize(value);
        if (n instanceof Long l) {
            if (l == Long.MIN_VALUE) throw new EvaluationException("Integer overflow");
            return Math.abs(l);
        }
        if (n instanceof Double d) return Math.abs(d);
        throw new EvaluationException("abs expects a number, got " + Values.typeName(value));
    }

    private static Object sum(Object value) {
        Object total = 0L;
        for (Object item : items(value, "sum")) {
            total = Values.add(total, item);
        }
        return total;
    }

    private static long integer(Object value, String what) {
        if (!Values.isIntegral(value)) {
            throw new EvaluationException(what + " must be an integer, got " + Values.typeName(value));
        }
        return ((Number) value).longValue();
    }

    // ── Sequences ────────────────────────────────────────────────────────────

    private static Object length(Object value) {
        if (value == null || value instanceof Undefined) return 0L;
        if (value instanceof String s) return (long) s.length();
        if (value instanceof Collection<?> c) return (long) c.size();
        if (value instanceof Map<?, ?> m) return (long) m.size();
        throw new EvaluationException("Value of type " + Values.typeName(value) + " has no length");
    }

    private static Object edge(Object value, boolean first) {
        List<Object> items = items(value, first ? "first" : "last");
        if (items.isEmpty()) {
            return new Undefined(first ? "first" : "last");
        }
        return items.get(first ? 0 : items.size() - 1);
    }

    private static Object sort(Object value) {
        List<Object> sorted = items(value, "sort");
        sorted.sort((a, b) -> Values.compare(a, b, "sort"));
        return sorted;
    }

    private static Object reverse(Object value) {
        if (value instanceof String s) {
            return new StringBuilder(s).reverse().toString();
        }
        List<Object> reversed = items(value, "reverse");
        Collections.reverse(reversed);
        return reversed;
    }

    /** Entries of a mapping as {@code [key, value]} pairs ordered by key. */
    private static Object dictsort(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new EvaluationException("dictsort expects an object, got " + Values.typeName(value));
        }
        List<Object> pairs = new ArrayList<>(map.size());
        map.entrySet().stream()
                .sorted((a, b) -> Values.stringify(a.getKey()).compareTo(Values.stringify(b.getKey())))
                .forEach(entry -> pairs.add(Arrays.asList(entry.getKey(), entry.getValue())));
        return pairs;
    }

    /** Iteration order used by filters and {@code for} blocks: list elements, mapping keys, characters. */
    static List<Object> items(Object value, String what) {
        if (value instanceof Undefined) return new ArrayList<>();
        if (value instanceof Collection<?> c) return new ArrayList<>(c);
        if (value instanceof Map<?, ?> m) return new ArrayList<>(m.keySet());
        if (value instanceof String s) {
            List<Object> chars = new ArrayList<>(s.length());
            s.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars;
        }
        throw new EvaluationException(what + ": value of type " + Values.typeName(value) + " is not iterable");
    }
}
