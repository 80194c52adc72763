package dev.fumaz.graft.introspect;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything the container needs to know about a type to autowire it.
 */
public final class TypeDescriptor {

    /**
     * Builds an instance from constructor arguments ordered like {@link #getParameters()}.
     */
    @FunctionalInterface
    public interface Instantiator {

        @Nullable Object instantiate(@NotNull Object[] arguments) throws Throwable;

    }

    private final @NotNull String id;
    private final @NotNull TypeKind kind;
    private final @NotNull List<ParameterDescriptor> parameters;
    private final @Nullable Instantiator instantiator;
    private final boolean singleton;

    private TypeDescriptor(@NotNull String id,
                           @NotNull TypeKind kind,
                           @NotNull List<ParameterDescriptor> parameters,
                           @Nullable Instantiator instantiator,
                           boolean singleton) {
        this.id = id;
        this.kind = kind;
        this.parameters = parameters;
        this.instantiator = instantiator;
        this.singleton = singleton;
    }

    public static @NotNull TypeDescriptor notInstantiable(@NotNull String id, @NotNull TypeKind kind) {
        if (kind.isInstantiable()) {
            throw new IllegalArgumentException("Concrete types need an instantiator");
        }

        return new TypeDescriptor(id, kind, Collections.emptyList(), null, false);
    }

    public static @NotNull Builder builder(@NotNull String id) {
        return new Builder(id);
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull TypeKind getKind() {
        return kind;
    }

    public @NotNull List<ParameterDescriptor> getParameters() {
        return parameters;
    }

    /**
     * @return whether instances of this type are cached once autowired
     */
    public boolean isSingleton() {
        return singleton;
    }

    public @Nullable Object instantiate(@NotNull Object[] arguments) throws Throwable {
        if (instantiator == null) {
            throw new IllegalStateException(id + " cannot be instantiated");
        }

        return instantiator.instantiate(arguments);
    }

    public static final class Builder {

        private final @NotNull String id;
        private final @NotNull List<ParameterDescriptor> parameters = new ArrayList<>();
        private @Nullable Instantiator instantiator;
        private boolean singleton;

        private Builder(@NotNull String id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public @NotNull Builder parameter(@NotNull ParameterDescriptor parameter) {
            parameters.add(Objects.requireNonNull(parameter, "parameter"));
            return this;
        }

        public @NotNull Builder singleton(boolean singleton) {
            this.singleton = singleton;
            return this;
        }

        public @NotNull Builder instantiator(@NotNull Instantiator instantiator) {
            this.instantiator = Objects.requireNonNull(instantiator, "instantiator");
            return this;
        }

        public @NotNull TypeDescriptor build() {
            if (instantiator == null) {
                throw new IllegalStateException("No instantiator configured for " + id);
            }

            return new TypeDescriptor(id, TypeKind.CONCRETE,
                    Collections.unmodifiableList(new ArrayList<>(parameters)), instantiator, singleton);
        }
    }

}
