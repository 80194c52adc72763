package dev.fumaz.graft.provider;

import dev.fumaz.graft.container.Container;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link ValueProvider} is a {@link Provider} that always returns the same literal value.
 *
 * @param <T> the type of the value
 */
public final class ValueProvider<T> implements Provider<T> {

    private final @Nullable T value;

    public ValueProvider(@Nullable T value) {
        this.value = value;
    }

    @Override
    public @Nullable T provide(@NotNull Container container) {
        return value;
    }

    public @Nullable T getValue() {
        return value;
    }

}
