package dev.fumaz.graft.provider;

import dev.fumaz.graft.container.Container;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;

/**
 * A {@link SingletonProvider} caches the first value produced by its delegate.
 * <p>
 * Creation is serialized per provider, so concurrent first lookups build exactly one instance. A failed creation
 * caches nothing. {@code null} is a legitimate cached value.
 * <p>
 * Two shared providers whose creations need each other and start on different threads would otherwise wait on each
 * other forever; the creation lock detects that and fails the waiter that would
 * close the cycle with a {@link dev.fumaz.graft.exception.CircularDependencyException}.
 *
 * @param <T> the type of the value
 */
public final class SingletonProvider<T> implements Provider<T> {

    private static final Object UNSET = new Object();
    private static final VarHandle INSTANCE_HANDLE;

    static {
        try {
            INSTANCE_HANDLE = MethodHandles.lookup().findVarHandle(SingletonProvider.class, "instance", Object.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final @NotNull Provider<T> delegate;
    private final @NotNull CycleDetectingLock lock;
    private Object instance = UNSET;

    public SingletonProvider(@NotNull String id, @NotNull Provider<T> delegate) {
        this.lock = new CycleDetectingLock(Objects.requireNonNull(id, "id"));
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public @Nullable T provide(@NotNull Container container) throws Exception {
        Object local = INSTANCE_HANDLE.getAcquire(this);

        if (local != UNSET) {
            return cast(local);
        }

        try {
            lock.lock();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }

        try {
            local = INSTANCE_HANDLE.getAcquire(this);

            if (local == UNSET) {
                local = delegate.provide(container);
                INSTANCE_HANDLE.setRelease(this, local);
            }

            return cast(local);
        } finally {
            lock.unlock();
        }
    }

    public boolean isCreated() {
        return INSTANCE_HANDLE.getAcquire(this) != UNSET;
    }

    /**
     * Drops the cached value, if any. The next lookup runs the delegate again. A creation already in flight still
     * publishes its value.
     *
     * @return whether a value was cached
     */
    public boolean evict() {
        Object previous = INSTANCE_HANDLE.getAndSet(this, UNSET);
        return previous != UNSET;
    }

    @SuppressWarnings("unchecked")
    private T cast(Object value) {
        return (T) value;
    }

}
