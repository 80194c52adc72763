package dev.fumaz.graft.container;

import dev.fumaz.graft.introspect.ReflectionTypeIntrospector;
import dev.fumaz.graft.introspect.TypeIntrospector;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Immutable configuration of a {@link Container}.
 */
public final class ContainerOptions {

    private static final ContainerOptions DEFAULTS = builder().build();

    private final @Nullable TypeIntrospector introspector;
    private final @Nullable ClassLoader classLoader;
    private final boolean autowire;
    private final boolean selfBinding;
    private final boolean loggerInjection;

    private ContainerOptions(Builder builder) {
        this.introspector = builder.introspector;
        this.classLoader = builder.classLoader;
        this.autowire = builder.autowire;
        this.selfBinding = builder.selfBinding;
        this.loggerInjection = builder.loggerInjection;
    }

    public static @NotNull ContainerOptions defaults() {
        return DEFAULTS;
    }

    public static @NotNull Builder builder() {
        return new Builder();
    }

    /**
     * @return the configured introspector, or a reflective one over the configured class loader
     */
    public @NotNull TypeIntrospector createIntrospector() {
        if (introspector != null) {
            return introspector;
        }

        return classLoader == null ? new ReflectionTypeIntrospector() : new ReflectionTypeIntrospector(classLoader);
    }

    /**
     * @return whether unbound classes are built by autowiring their constructors
     */
    public boolean isAutowire() {
        return autowire;
    }

    /**
     * @return whether an unbound {@link Container} dependency receives the container itself
     */
    public boolean isSelfBinding() {
        return selfBinding;
    }

    /**
     * @return whether an unbound {@link java.util.logging.Logger} dependency receives a logger named after the type
     * being built
     */
    public boolean isLoggerInjection() {
        return loggerInjection;
    }

    public static final class Builder {

        private @Nullable TypeIntrospector introspector;
        private @Nullable ClassLoader classLoader;
        private boolean autowire = true;
        private boolean selfBinding = true;
        private boolean loggerInjection = true;

        private Builder() {
        }

        public @NotNull Builder introspector(@NotNull TypeIntrospector introspector) {
            this.introspector = Objects.requireNonNull(introspector, "introspector");
            return this;
        }

        public @NotNull Builder classLoader(@NotNull ClassLoader classLoader) {
            this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
            return this;
        }

        public @NotNull Builder autowire(boolean autowire) {
            this.autowire = autowire;
            return this;
        }

        public @NotNull Builder selfBinding(boolean selfBinding) {
            this.selfBinding = selfBinding;
            return this;
        }

        public @NotNull Builder loggerInjection(boolean loggerInjection) {
            this.loggerInjection = loggerInjection;
            return this;
        }

        public @NotNull ContainerOptions build() {
            return new ContainerOptions(this);
        }
    }

}
