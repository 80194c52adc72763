package dev.fumaz.graft.bind;

import dev.fumaz.graft.container.Container;
import dev.fumaz.graft.exception.FactoryException;
import dev.fumaz.graft.provider.Provider;
import dev.fumaz.graft.provider.SingletonProvider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A {@link Binding} is a link between a canonical id and a {@link Provider}.
 */
public final class Binding {

    private final @NotNull String id;
    private final @NotNull BindingKind kind;
    private final @NotNull Provider<?> provider;
    private final @Nullable String target;
    private final boolean shared;

    private Binding(@NotNull String id,
                    @NotNull BindingKind kind,
                    @NotNull Provider<?> provider,
                    @Nullable String target,
                    boolean shared) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.provider = shared ? new SingletonProvider<>(id, provider) : provider;
        this.target = target;
        this.shared = shared;
    }

    public static @NotNull Binding factory(@NotNull String id, @NotNull Provider<?> provider, boolean shared) {
        return new Binding(id, BindingKind.FACTORY, provider, null, shared);
    }

    public static @NotNull Binding value(@NotNull String id, @NotNull Provider<?> provider, boolean shared) {
        return new Binding(id, BindingKind.VALUE, provider, null, shared);
    }

    /**
     * @param target the id of the concrete class to autowire
     */
    public static @NotNull Binding autowire(@NotNull String id,
                                            @NotNull String target,
                                            @NotNull Provider<?> provider,
                                            boolean shared) {
        return new Binding(id, BindingKind.AUTOWIRE, provider, Objects.requireNonNull(target, "target"), shared);
    }

    public @Nullable Object provide(@NotNull Container container) {
        try {
            return provider.provide(container);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new FactoryException(id, e);
        }
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull BindingKind getKind() {
        return kind;
    }

    /**
     * @return the class autowired by an {@link BindingKind#AUTOWIRE} binding, otherwise {@code null}
     */
    public @Nullable String getTarget() {
        return target;
    }

    public boolean isShared() {
        return shared;
    }

    public boolean isCached() {
        return shared && ((SingletonProvider<?>) provider).isCreated();
    }

    boolean evict() {
        return shared && ((SingletonProvider<?>) provider).evict();
    }

    @Override
    public String toString() {
        return "Binding{" + id + ", " + kind + (target == null ? "" : " -> " + target)
                + (shared ? ", shared" : "") + "}";
    }

}
