package fleet.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filters task parameters down to values a recording file can hold: string,
 * number, boolean, null, lists and string-keyed maps of those (recursively).
 * Enum constants are kept as their name. Anything else (callables, live page
 * elements, arbitrary objects) is dropped.
 */
public final class JsonValues {

    private JsonValues() { }

    /** Returns true when {@code value} can be written to a recording. */
    public static boolean isRepresentable(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) return true;
        if (value instanceof Enum<?>) return true;
        if (value instanceof Number n) return isPlainNumber(n);
        if (value instanceof Collection<?> c) {
            return c.stream().allMatch(JsonValues::isRepresentable);
        }
        if (value instanceof Object[] arr) {
            for (Object o : arr) {
                if (!isRepresentable(o)) return false;
            }
            return true;
        }
        if (value instanceof Map<?, ?> m) {
            for (Map.Entry<?, ?> e : m.entrySet()) {
                if (!(e.getKey() instanceof String) || !isRepresentable(e.getValue())) return false;
            }
            return true;
        }
        return false;
    }

    /**
     * Copies positional parameters, dropping entries that are not representable.
     * Arrays are copied as lists.
     */
    public static List<Object> filterArgs(List<?> args) {
        List<Object> out = new ArrayList<>();
        if (args == null) return out;
        for (Object a : args) {
            if (isRepresentable(a)) {
                out.add(copy(a));
            }
        }
        return out;
    }

    /** Copies named parameters, dropping entries whose value is not representable. */
    public static Map<String, Object> filterKwargs(Map<String, ?> kwargs) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (kwargs == null) return out;
        kwargs.forEach((k, v) -> {
            if (isRepresentable(v)) {
                out.put(k, copy(v));
            }
        });
        return out;
    }

    private static boolean isPlainNumber(Number n) {
        if (n instanceof Double d) return !d.isNaN() && !d.isInfinite();
        if (n instanceof Float f)  return !f.isNaN() && !f.isInfinite();
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof java.math.BigInteger || n instanceof java.math.BigDecimal;
    }

    private static Object copy(Object value) {
        if (value instanceof Enum<?> e) return e.name();
        if (value instanceof Collection<?> c) {
            List<Object> list = new ArrayList<>(c.size());
            c.forEach(o -> list.add(copy(o)));
            return list;
        }
        if (value instanceof Object[] arr) {
            List<Object> list = new ArrayList<>(arr.length);
            for (Object o : arr) list.add(copy(o));
            return list;
        }
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> map = new LinkedHashMap<>();
            m.forEach((k, v) -> map.put((String) k, copy(v)));
            return map;
        }
        return value;
    }
}
