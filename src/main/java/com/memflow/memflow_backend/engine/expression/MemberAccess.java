package com.memflow.memflow_backend.engine.expression;

import com.memflow.memflow_backend.exception.EvaluationException;
import com.memflow.memflow_backend.exception.UndefinedVariableException;

import java.util.List;
import java.util.Map;

/**
 * Attribute and subscript access. Only mappings expose attributes; there is no
 * reflective access to Java objects.
 */
final class MemberAccess {

    private MemberAccess() {
    }

    static Object attribute(Object target, String name, boolean strict) {
        if (target instanceof Undefined u) {
            if (strict) throw new UndefinedVariableException(u.getName() + "." + name);
            return u.child(name);
        }
        if (target instanceof Map<?, ?> map) {
            if (map.containsKey(name)) {
                return map.get(name);
            }
            if (strict) throw new UndefinedVariableException(name);
            return new Undefined(name);
        }
        if (strict) {
            throw new EvaluationException("Value of type " + Values.typeName(target) + " has no attribute '" + name + "'");
        }
        return new Undefined(name);
    }

    static Object index(Object target, Object key, boolean strict) {
        if (target instanceof Undefined u) {
            if (strict) throw new UndefinedVariableException(u.getName() + "[" + Values.stringify(key) + "]");
            return u.child(Values.stringify(key));
        }
        if (target instanceof Map<?, ?> map) {
            if (map.containsKey(key)) {
                return map.get(key);
            }
            return missing(strict, "Key not found: '" + Values.stringify(key) + "'", key);
        }
        if (target instanceof List<?> list) {
            int position = position(key, list.size());
            if (position < 0) {
                return missing(strict, "List index out of range: " + Values.stringify(key), key);
            }
            return list.get(position);
        }
        if (target instanceof String s) {
            int position = position(key, s.length());
            if (position < 0) {
                return missing(strict, "String index out of range: " + Values.stringify(key), key);
            }
            return String.valueOf(s.charAt(position));
        }
        if (strict) {
            throw new EvaluationException("Value of type " + Values.typeName(target) + " is not subscriptable");
        }
        return new Undefined(Values.stringify(key));
    }

    private static int position(Object key, int size) {
        if (!Values.isIntegral(key)) {
            throw new EvaluationException("Sequence indices must be integers, got " + Values.typeName(key));
        }
        long index = ((Number) key).longValue();
        if (index < 0) index += size;
        return index < 0 || index >= size ? -1 : (int) index;
    }

    private static Object missing(boolean strict, String message, Object key) {
        if (strict) throw new EvaluationException(message);
        return new Undefined(Values.stringify(key));
    }
}
