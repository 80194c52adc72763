package dev.fumaz.graft.provider;

import dev.fumaz.graft.container.Container;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link Provider} produces the value bound to an id.
 *
 * @param <T> the type of the value
 */
@FunctionalInterface
public interface Provider<T> {

    static <T> @NotNull Provider<T> value(@Nullable T value) {
        return new ValueProvider<>(value);
    }

    @Nullable T provide(@NotNull Container container) throws Exception;

}
