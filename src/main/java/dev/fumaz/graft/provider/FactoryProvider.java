package dev.fumaz.graft.provider;

import dev.fumaz.graft.container.Container;
import dev.fumaz.graft.exception.FactoryException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Runs a user factory, rewrapping anything it throws as a {@link FactoryException} tagged with the binding id.
 * Only {@link VirtualMachineError}s pass through untouched.
 *
 * @param <T> the type of the value
 */
public final class FactoryProvider<T> implements Provider<T> {

    private final @NotNull String id;
    private final @NotNull Provider<T> factory;

    public FactoryProvider(@NotNull String id, @NotNull Provider<T> factory) {
        this.id = Objects.requireNonNull(id, "id");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public @Nullable T provide(@NotNull Container container) {
        try {
            return factory.provide(container);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable throwable) {
            throw new FactoryException(id, throwable);
        }
    }

}
