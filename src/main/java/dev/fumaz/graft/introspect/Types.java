package dev.fumaz.graft.introspect;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Classification and conversion helpers for scalar parameter types.
 */
public final class Types {

    private static final Map<Class<?>, Class<?>> WRAPPERS = new HashMap<>();

    static {
        WRAPPERS.put(boolean.class, Boolean.class);
        WRAPPERS.put(byte.class, Byte.class);
        WRAPPERS.put(short.class, Short.class);
        WRAPPERS.put(char.class, Character.class);
        WRAPPERS.put(int.class, Integer.class);
        WRAPPERS.put(long.class, Long.class);
        WRAPPERS.put(float.class, Float.class);
        WRAPPERS.put(double.class, Double.class);
        WRAPPERS.put(void.class, Void.class);
    }

    private Types() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * Builtin types carry no identity worth binding by type: primitives and their wrappers, strings, numbers,
     * enums, arrays, collections and maps.
     */
    public static boolean isBuiltin(@NotNull Class<?> type) {
        return type.isPrimitive()
                || WRAPPERS.containsValue(type)
                || type == String.class
                || type == CharSequence.class
                || type == Number.class
                || type.isEnum()
                || type.isArray()
                || Collection.class.isAssignableFrom(type)
                || Map.class.isAssignableFrom(type);
    }

    public static @NotNull Class<?> wrap(@NotNull Class<?> type) {
        Class<?> wrapper = WRAPPERS.get(type);
        return wrapper == null ? type : wrapper;
    }

    /**
     * Converts the textual form of a default value to {@code type}.
     *
     * @throws IllegalArgumentException if the text cannot represent a value of {@code type}
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static @Nullable Object convert(@NotNull String text, @NotNull Class<?> type) {
        Class<?> target = wrap(type);

        if (target == String.class || target == CharSequence.class || target == Object.class) {
            return text;
        }

        if (target == Boolean.class) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);

            if (!normalized.equals("true") && !normalized.equals("false")) {
                throw new IllegalArgumentException("Not a boolean: " + text);
            }

            return Boolean.valueOf(normalized);
        }

        if (target == Character.class) {
            if (text.length() != 1) {
                throw new IllegalArgumentException("Not a single character: " + text);
            }

            return text.charAt(0);
        }

        if (target == Integer.class) {
            return Integer.valueOf(text.trim());
        }

        if (target == Long.class) {
            return Long.valueOf(text.trim());
        }

        if (target == Short.class) {
            return Short.valueOf(text.trim());
        }

        if (target == Byte.class) {
            return Byte.valueOf(text.trim());
        }

        if (target == Double.class || target == Number.class) {
            return Double.valueOf(text.trim());
        }

        if (target == Float.class) {
            return Float.valueOf(text.trim());
        }

        if (target.isEnum()) {
            return Enum.valueOf((Class<? extends Enum>) target, text.trim());
        }

        throw new IllegalArgumentException("Cannot convert a default value to " + type.getName());
    }

}
