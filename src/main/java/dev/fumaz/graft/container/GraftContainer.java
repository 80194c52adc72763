package dev.fumaz.graft.container;

import dev.fumaz.graft.bind.AliasTable;
import dev.fumaz.graft.bind.Binding;
import dev.fumaz.graft.bind.BindingKind;
import dev.fumaz.graft.bind.BindingRegistry;
import dev.fumaz.graft.context.ResolutionTracker;
import dev.fumaz.graft.exception.AliasCycleException;
import dev.fumaz.graft.exception.BindingException;
import dev.fumaz.graft.exception.ContainerException;
import dev.fumaz.graft.exception.NotFoundException;
import dev.fumaz.graft.exception.ResolutionException;
import dev.fumaz.graft.introspect.Invocable;
import dev.fumaz.graft.introspect.TypeDescriptor;
import dev.fumaz.graft.introspect.TypeIntrospector;
import dev.fumaz.graft.introspect.Types;
import dev.fumaz.graft.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

public class GraftContainer implements Container {

    private static final Logger LOGGER = Logger.getLogger(GraftContainer.class.getName());

    private final @NotNull ContainerOptions options;
    private final @NotNull TypeIntrospector introspector;
    private final @NotNull ResolutionTracker tracker;
    private final @NotNull AliasTable aliases;
    private final @NotNull BindingRegistry registry;
    private final @NotNull BindingRegistry implicitSingletons;
    private final @NotNull AutowiringResolver resolver;
    private final @NotNull Invoker invoker;

    public GraftContainer(@NotNull ContainerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.introspector = options.createIntrospector();
        this.tracker = new ResolutionTracker();
        this.aliases = new AliasTable();
        this.registry = new BindingRegistry(introspector, this::autowiring);
        this.implicitSingletons = new BindingRegistry(introspector, this::autowiring);

        ParameterResolver parameters = new ParameterResolver(this, tracker, options);
        this.resolver = new AutowiringResolver(this, introspector, tracker, parameters);
        this.invoker = new Invoker(this, introspector, parameters);
    }

    public GraftContainer() {
        this(ContainerOptions.defaults());
    }

    @Override
    public @Nullable Object get(@NotNull String id) {
        Objects.requireNonNull(id, "id");
        boolean outermost = tracker.isIdle();

        try {
            return resolve(id);
        } catch (RuntimeException e) {
            if (outermost) {
                LOGGER.log(Level.FINE, "Failed to resolve " + id, e);
            }

            throw e;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> @Nullable T get(@NotNull Class<T> type) {
        Object value = get(type.getName());

        if (value != null && !Types.wrap(type).isInstance(value)) {
            throw new BindingException("Binding for " + type.getName() + " produced an instance of "
                    + value.getClass().getName());
        }

        return (T) value;
    }

    @Override
    public boolean has(@NotNull String id) {
        String canonical = canonicalizeOrNull(id);

        if (canonical == null) {
            return false;
        }

        if (registry.contains(canonical)) {
            return true;
        }

        if (!options.isAutowire()) {
            return false;
        }

        try {
            return introspector.isInstantiable(canonical);
        } catch (RuntimeException | LinkageError e) {
            LOGGER.log(Level.FINE, "Introspection of " + canonical + " failed", e);
            return false;
        }
    }

    @Override
    public boolean hasBinding(@NotNull String id) {
        String canonical = canonicalizeOrNull(id);
        return canonical != null && registry.contains(canonical);
    }

    @Override
    public void set(@NotNull String id, @Nullable Object factoryOrValue) {
        String canonical = aliases.canonicalize(id);
        registry.set(canonical, factoryOrValue);
        implicitSingletons.remove(canonical);
    }

    @Override
    public void singleton(@NotNull String id, @Nullable Object factoryOrValue) {
        String canonical = aliases.canonicalize(id);
        registry.singleton(canonical, factoryOrValue);
        implicitSingletons.remove(canonical);
    }

    @Override
    public void setAlias(@NotNull String alias, @NotNull String id) {
        aliases.set(alias, id);
        LOGGER.fine(() -> "Aliased " + alias + " to " + id);
    }

    @Override
    public boolean forget(@NotNull String id) {
        boolean removedBinding = registry.remove(id);
        boolean removedImplicit = implicitSingletons.remove(id);
        boolean removedAlias = aliases.remove(id);

        return removedBinding || removedImplicit || removedAlias;
    }

    @Override
    public boolean forgetInstance(@NotNull String id) {
        String canonical = aliases.canonicalize(id);
        boolean evicted = registry.evict(canonical);

        return implicitSingletons.evict(canonical) || evicted;
    }

    @Override
    public void clear() {
        registry.clear();
        implicitSingletons.clear();
        aliases.clear();
        LOGGER.fine("Cleared container");
    }

    @Override
    public @Nullable Object invokeMethod(@NotNull Object target,
                                         @NotNull String method,
                                         @NotNull Map<String, ?> overrides) {
        return invoker.invokeMethod(target, method, overrides);
    }

    @Override
    public @Nullable Object invokeMethod(@NotNull Class<?> type,
                                         @NotNull String method,
                                         @NotNull Map<String, ?> overrides) {
        return invoker.invokeMethod(type, method, overrides);
    }

    @Override
    public @Nullable Object invokeMethod(@NotNull String className,
                                         @NotNull String method,
                                         @NotNull Map<String, ?> overrides) {
        return invoker.invokeMethod(className, method, overrides);
    }

    @Override
    public @Nullable Object invokeFunction(@NotNull Invocable function, @NotNull Map<String, ?> overrides) {
        return invoker.invokeFunction(function, overrides);
    }

    @Override
    public @NotNull Set<String> getBindingIds() {
        return registry.ids();
    }

    @Override
    public @NotNull Map<String, String> getAliases() {
        return aliases.snapshot();
    }

    @Nullable TypeDescriptor describe(@NotNull String id) {
        try {
            return introspector.describe(id);
        } catch (ContainerException e) {
            throw e;
        } catch (RuntimeException | LinkageError e) {
            throw new ResolutionException("Cannot introspect " + id, tracker.chain(), e);
        }
    }

    private @Nullable Object resolve(String id) {
        String canonical = aliases.canonicalize(id);
        Binding binding = registry.find(canonical);

        if (binding != null) {
            LOGGER.finer(() -> "Resolving " + canonical + " from " + binding);
            return provide(binding);
        }

        if (!options.isAutowire()) {
            throw new NotFoundException(id);
        }

        TypeDescriptor descriptor = describe(canonical);

        if (descriptor == null) {
            throw new NotFoundException(id);
        }

        if (descriptor.isSingleton() && descriptor.getKind().isInstantiable()) {
            Binding shared = implicitSingletons.registerIfAbsent(
                    Binding.autowire(canonical, canonical, autowiring(canonical), true));
            return provide(shared);
        }

        return resolver.resolve(canonical);
    }

    private @Nullable String canonicalizeOrNull(@NotNull String id) {
        try {
            return aliases.canonicalize(id);
        } catch (AliasCycleException e) {
            LOGGER.log(Level.FINE, "Alias cycle while looking up " + id, e);
            return null;
        }
    }

    private @Nullable Object provide(Binding binding) {
        if (binding.getKind() != BindingKind.FACTORY) {
            return binding.provide(this);
        }

        tracker.enter(binding.getId());

        try {
            return binding.provide(this);
        } finally {
            tracker.exit(binding.getId());
        }
    }

    private @NotNull Provider<Object> autowiring(@NotNull String target) {
        return container -> resolver.resolve(target);
    }

}
