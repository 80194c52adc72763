package dev.fumaz.graft.container;

import dev.fumaz.graft.exception.ContainerException;
import dev.fumaz.graft.exception.Diagnostic;
import dev.fumaz.graft.introspect.Invocable;
import dev.fumaz.graft.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A {@link Container} produces instances for ids, either from registered bindings or by autowiring class
 * constructors.
 * <p>
 * Ids are arbitrary strings; a class is identified by {@link Class#getName()}, and every {@link Class} overload
 * delegates to the string form.
 */
public interface Container {

    static @NotNull Container create() {
        return create(ContainerOptions.defaults());
    }

    static @NotNull Container create(@NotNull ContainerOptions options) {
        return new GraftContainer(options);
    }

    /**
     * Resolves {@code id}: its binding if one is registered, otherwise the class it names, autowired.
     *
     * @throws dev.fumaz.graft.exception.NotFoundException if the id is neither bound nor a class
     */
    @Nullable Object get(@NotNull String id);

    <T> @Nullable T get(@NotNull Class<T> type);

    /**
     * @return whether {@code id} is bound or names an instantiable class; {@code false} when {@code id} sits on an
     * alias cycle
     */
    boolean has(@NotNull String id);

    default boolean has(@NotNull Class<?> type) {
        return has(type.getName());
    }

    /**
     * @return whether a factory or value was registered for {@code id}. Classes cached through {@code @Singleton}
     * without a registration do not count.
     */
    boolean hasBinding(@NotNull String id);

    default boolean hasBinding(@NotNull Class<?> type) {
        return hasBinding(type.getName());
    }

    void set(@NotNull String id, @Nullable Object factoryOrValue);

    default void set(@NotNull String id, @NotNull Provider<?> factory) {
        set(id, (Object) factory);
    }

    default void set(@NotNull String id) {
        set(id, (Object) null);
    }

    default void set(@NotNull Class<?> type) {
        set(type.getName(), (Object) null);
    }

    default void set(@NotNull Class<?> type, @Nullable Object factoryOrValue) {
        set(type.getName(), factoryOrValue);
    }

    default void set(@NotNull Class<?> type, @NotNull Provider<?> factory) {
        set(type.getName(), (Object) factory);
    }

    /**
     * Like {@link #set(String, Object)}, but the first resolved value is cached and returned by every later lookup.
     */
    void singleton(@NotNull String id, @Nullable Object factoryOrValue);

    default void singleton(@NotNull String id, @NotNull Provider<?> factory) {
        singleton(id, (Object) factory);
    }

    default void singleton(@NotNull String id) {
        singleton(id, (Object) null);
    }

    default void singleton(@NotNull Class<?> type) {
        singleton(type.getName(), (Object) null);
    }

    default void singleton(@NotNull Class<?> type, @Nullable Object factoryOrValue) {
        singleton(type.getName(), factoryOrValue);
    }

    default void singleton(@NotNull Class<?> type, @NotNull Provider<?> factory) {
        singleton(type.getName(), (Object) factory);
    }

    void setAlias(@NotNull String alias, @NotNull String id);

    default void setAlias(@NotNull String alias, @NotNull Class<?> type) {
        setAlias(alias, type.getName());
    }

    /**
     * Removes the binding of {@code id}, its cached singleton, and the alias named {@code id}.
     *
     * @return whether anything was removed
     */
    boolean forget(@NotNull String id);

    default boolean forget(@NotNull Class<?> type) {
        return forget(type.getName());
    }

    /**
     * Drops the cached singleton of {@code id} while keeping its binding.
     *
     * @return whether an instance was cached
     */
    boolean forgetInstance(@NotNull String id);

    default boolean forgetInstance(@NotNull Class<?> type) {
        return forgetInstance(type.getName());
    }

    void clear();

    /**
     * Calls {@code method} on {@code target}, resolving its parameters. Entries of {@code overrides} keyed by a
     * parameter name are passed verbatim.
     */
    @Nullable Object invokeMethod(@NotNull Object target, @NotNull String method, @NotNull Map<String, ?> overrides);

    /**
     * Calls {@code method} of {@code type}. Static methods need no receiver; otherwise the receiver is the binding of
     * {@code type} if there is one, else an instance made with its no-arg constructor.
     */
    @Nullable Object invokeMethod(@NotNull Class<?> type, @NotNull String method,
                                  @NotNull Map<String, ?> overrides);

    /**
     * Like {@link #invokeMethod(Class, String, Map)}, with the class looked up by name.
     */
    @Nullable Object invokeMethod(@NotNull String className, @NotNull String method,
                                  @NotNull Map<String, ?> overrides);

    default @Nullable Object invokeMethod(@NotNull Object target, @NotNull String method) {
        return invokeMethod(target, method, Collections.emptyMap());
    }

    default @Nullable Object invokeMethod(@NotNull Class<?> type, @NotNull String method) {
        return invokeMethod(type, method, Collections.emptyMap());
    }

    default @Nullable Object invokeMethod(@NotNull String className, @NotNull String method) {
        return invokeMethod(className, method, Collections.emptyMap());
    }

    @Nullable Object invokeFunction(@NotNull Invocable function, @NotNull Map<String, ?> overrides);

    default @Nullable Object invokeFunction(@NotNull Invocable function) {
        return invokeFunction(function, Collections.emptyMap());
    }

    default @Nullable Object invokeFunction(@NotNull Method function, @NotNull Map<String, ?> overrides) {
        return invokeFunction(Invocable.of(function), overrides);
    }

    default @NotNull List<Diagnostic> explain(@NotNull Throwable error) {
        return ContainerException.explain(error);
    }

    @NotNull Set<String> getBindingIds();

    @NotNull Map<String, String> getAliases();

}
