package dev.fumaz.graft.introspect;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Describes one parameter of a constructor, method or function.
 * <p>
 * Instances are immutable; the {@code with*} methods return modified copies.
 */
public final class ParameterDescriptor {

    private final @NotNull String name;
    private final @Nullable Class<?> type;
    private final @NotNull List<Class<?>> alternatives;
    private final boolean builtin;
    private final boolean hasDefault;
    private final @Nullable Object defaultValue;
    private final boolean nullable;
    private final @Nullable String bindingName;

    private ParameterDescriptor(@NotNull String name,
                                @Nullable Class<?> type,
                                @NotNull List<Class<?>> alternatives,
                                boolean builtin,
                                boolean hasDefault,
                                @Nullable Object defaultValue,
                                boolean nullable,
                                @Nullable String bindingName) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
        this.alternatives = alternatives;
        this.builtin = builtin;
        this.hasDefault = hasDefault;
        this.defaultValue = defaultValue;
        this.nullable = nullable;
        this.bindingName = bindingName;
    }

    public static @NotNull ParameterDescriptor typed(@NotNull String name, @NotNull Class<?> type) {
        Objects.requireNonNull(type, "type");
        return new ParameterDescriptor(name, type, Collections.emptyList(), Types.isBuiltin(type), false, null,
                false, null);
    }

    public static @NotNull ParameterDescriptor untyped(@NotNull String name) {
        return new ParameterDescriptor(name, null, Collections.emptyList(), false, false, null, false, null);
    }

    /**
     * A parameter accepting any one of several types. Autowiring never guesses which one to build.
     */
    public static @NotNull ParameterDescriptor union(@NotNull String name, @NotNull Class<?>... alternatives) {
        return composite(name, alternatives);
    }

    /**
     * A parameter whose value must satisfy every one of several types.
     */
    public static @NotNull ParameterDescriptor intersection(@NotNull String name, @NotNull Class<?>... bounds) {
        return composite(name, bounds);
    }

    private static ParameterDescriptor composite(String name, Class<?>... types) {
        if (types.length < 2) {
            throw new IllegalArgumentException("A composite parameter type needs at least two members");
        }

        return new ParameterDescriptor(name, null, Collections.unmodifiableList(Arrays.asList(types.clone())),
                false, false, null, false, null);
    }

    public @NotNull ParameterDescriptor withDefault(@Nullable Object value) {
        return new ParameterDescriptor(name, type, alternatives, builtin, true, value, nullable, bindingName);
    }

    /**
     * Marks the parameter as accepting {@code null}, with {@code null} as its default.
     */
    public @NotNull ParameterDescriptor asNullable() {
        return new ParameterDescriptor(name, type, alternatives, builtin, true, null, true, bindingName);
    }

    public @NotNull ParameterDescriptor named(@NotNull String bindingName) {
        Objects.requireNonNull(bindingName, "bindingName");
        return new ParameterDescriptor(name, type, alternatives, builtin, hasDefault, defaultValue, nullable,
                bindingName);
    }

    public @NotNull String getName() {
        return name;
    }

    /**
     * @return the declared type, or {@code null} when the parameter is untyped or composite
     */
    public @Nullable Class<?> getType() {
        return type;
    }

    public @NotNull List<Class<?>> getAlternatives() {
        return alternatives;
    }

    public boolean isUnionOrIntersection() {
        return !alternatives.isEmpty();
    }

    public boolean isBuiltin() {
        return builtin;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public @Nullable Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * @return the id this parameter is explicitly bound to, if any
     */
    public @Nullable String getBindingName() {
        return bindingName;
    }

    public @NotNull String describeType() {
        if (isUnionOrIntersection()) {
            return alternatives.stream().map(Class::getName).collect(Collectors.joining("|"));
        }

        return type == null ? "(untyped)" : type.getName();
    }

    @Override
    public String toString() {
        return describeType() + " " + name;
    }

}
