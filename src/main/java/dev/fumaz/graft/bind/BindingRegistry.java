package dev.fumaz.graft.bind;

import dev.fumaz.graft.exception.BindingException;
import dev.fumaz.graft.exception.ContainerException;
import dev.fumaz.graft.introspect.TypeIntrospector;
import dev.fumaz.graft.provider.FactoryProvider;
import dev.fumaz.graft.provider.Provider;
import dev.fumaz.graft.provider.ValueProvider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds exactly one {@link Binding} per canonical id.
 * <p>
 * Registration normalizes whatever it is given into a binding: a {@link Provider} or {@link Supplier} becomes a
 * factory, {@code null} autowires the id itself, a {@link Class} autowires that implementation and any other value
 * is bound literally. Writes are serialized; lookups share a read lock. Providers are never invoked under the lock.
 */
public final class BindingRegistry {

    /**
     * Creates the provider that autowires a concrete class.
     */
    @FunctionalInterface
    public interface AutowireFactory {

        @NotNull Provider<?> create(@NotNull String target);

    }

    private static final Logger LOGGER = Logger.getLogger(BindingRegistry.class.getName());

    private final @NotNull TypeIntrospector introspector;
    private final @NotNull AutowireFactory autowireFactory;
    private final Map<String, Binding> bindings = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public BindingRegistry(@NotNull TypeIntrospector introspector, @NotNull AutowireFactory autowireFactory) {
        this.introspector = Objects.requireNonNull(introspector, "introspector");
        this.autowireFactory = Objects.requireNonNull(autowireFactory, "autowireFactory");
    }

    /**
     * Binds {@code id}, replacing any previous binding and its cached singleton.
     *
     * @throws BindingException if {@code source} cannot be turned into a binding
     */
    public @NotNull Binding set(@NotNull String id, @Nullable Object source) {
        return register(normalize(id, source, false));
    }

    public @NotNull Binding singleton(@NotNull String id, @Nullable Object source) {
        return register(normalize(id, source, true));
    }

    public @NotNull Binding register(@NotNull Binding binding) {
        lock.writeLock().lock();

        try {
            Binding previous = bindings.put(binding.getId(), binding);

            if (previous != null && previous.isCached()) {
                LOGGER.fine(() -> "Replaced " + previous + ", discarding its cached instance");
            }
        } finally {
            lock.writeLock().unlock();
        }

        LOGGER.fine(() -> "Registered " + binding);
        return binding;
    }

    /**
     * Registers {@code binding} unless its id is already bound.
     *
     * @return the binding now registered for the id
     */
    public @NotNull Binding registerIfAbsent(@NotNull Binding binding) {
        lock.writeLock().lock();

        try {
            Binding existing = bindings.get(binding.getId());

            if (existing != null) {
                return existing;
            }

            bindings.put(binding.getId(), binding);
        } finally {
            lock.writeLock().unlock();
        }

        LOGGER.fine(() -> "Registered " + binding);
        return binding;
    }

    public @Nullable Binding find(@NotNull String id) {
        lock.readLock().lock();

        try {
            return bindings.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(@NotNull String id) {
        return find(id) != null;
    }

    public boolean remove(@NotNull String id) {
        Binding removed;
        lock.writeLock().lock();

        try {
            removed = bindings.remove(id);
        } finally {
            lock.writeLock().unlock();
        }

        if (removed != null) {
            LOGGER.fine(() -> "Removed " + removed);
        }

        return removed != null;
    }

    /**
     * Drops the cached singleton of {@code id} while keeping its binding.
     *
     * @return whether an instance was cached
     */
    public boolean evict(@NotNull String id) {
        Binding binding = find(id);
        boolean evicted = binding != null && binding.evict();

        if (evicted) {
            LOGGER.fine(() -> "Evicted cached instance of " + id);
        }

        return evicted;
    }

    public void clear() {
        lock.writeLock().lock();

        try {
            bindings.clear();
        } finally {
            lock.writeLock().unlock();
        }

        LOGGER.fine("Cleared all bindings");
    }

    public @NotNull Set<String> ids() {
        lock.readLock().lock();

        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(bindings.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    private Binding normalize(String id, @Nullable Object source, boolean shared) {
        Objects.requireNonNull(id, "id");

        if (source instanceof Provider) {
            Provider<?> factory = (Provider<?>) source;
            return Binding.factory(id, new FactoryProvider<>(id, factory), shared);
        }

        if (source instanceof Supplier) {
            Supplier<?> supplier = (Supplier<?>) source;
            return Binding.factory(id, new FactoryProvider<>(id, container -> supplier.get()), shared);
        }

        if (source == null) {
            if (!isKnownType(id)) {
                throw new BindingException("Cannot autowire '" + id + "' because no such class exists");
            }

            return Binding.autowire(id, id, autowireFactory.create(id), shared);
        }

        if (source instanceof Class) {
            String target = ((Class<?>) source).getName();

            if (!isInstantiable(target)) {
                throw new BindingException("Cannot bind '" + id + "' to " + target
                        + " because it is not an instantiable class");
            }

            return Binding.autowire(id, target, autowireFactory.create(target), shared);
        }

        return Binding.value(id, new ValueProvider<>(source), shared);
    }

    private boolean isKnownType(String id) {
        try {
            return introspector.isKnownType(id);
        } catch (ContainerException e) {
            throw e;
        } catch (RuntimeException | LinkageError e) {
            LOGGER.log(Level.FINE, "Introspection of " + id + " failed", e);
            throw new BindingException("Cannot inspect '" + id + "' while binding it", e);
        }
    }

    private boolean isInstantiable(String id) {
        try {
            return introspector.isInstantiable(id);
        } catch (ContainerException e) {
            throw e;
        } catch (RuntimeException | LinkageError e) {
            LOGGER.log(Level.FINE, "Introspection of " + id + " failed", e);
            throw new BindingException("Cannot inspect '" + id + "' while binding it", e);
        }
    }

}
