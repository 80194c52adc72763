package dev.fumaz.graft.introspect;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Reports what the container needs to know about types: whether they exist, how to construct them and which
 * methods they declare.
 * <p>
 * Implementations may throw anything; the container rewraps such failures.
 */
public interface TypeIntrospector {

    boolean isKnownType(@NotNull String id);

    default boolean isInstantiable(@NotNull String id) {
        TypeDescriptor descriptor = describe(id);
        return descriptor != null && descriptor.getKind().isInstantiable();
    }

    /**
     * @return the descriptor for {@code id}, or {@code null} if the id names no known type
     */
    @Nullable TypeDescriptor describe(@NotNull String id);

    default @Nullable Object construct(@NotNull TypeDescriptor descriptor, @NotNull Object[] arguments)
            throws Throwable {
        return descriptor.instantiate(arguments);
    }

    @Nullable Class<?> findClass(@NotNull String id);

    /**
     * @return the method called {@code name} declared by {@code type} or its supertypes, or {@code null}
     */
    @Nullable Invocable findMethod(@NotNull Class<?> type, @NotNull String name);

}
