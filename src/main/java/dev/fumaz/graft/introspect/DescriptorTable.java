package dev.fumaz.graft.introspect;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * An explicit table of {@link TypeDescriptor}s, one per registered type id.
 * <p>
 * Describes constructor shapes reflection cannot express, such as untyped or union-typed parameters, and ids that
 * name no class at all. Ids missing from the table are looked up in the fallback introspector, if any.
 */
public final class DescriptorTable implements TypeIntrospector {

    private final ConcurrentMap<String, TypeDescriptor> descriptors = new ConcurrentHashMap<>();
    private final @Nullable TypeIntrospector fallback;

    public DescriptorTable() {
        this(null);
    }

    public DescriptorTable(@Nullable TypeIntrospector fallback) {
        this.fallback = fallback;
    }

    public static @NotNull DescriptorTable withReflection() {
        return new DescriptorTable(new ReflectionTypeIntrospector());
    }

    public @NotNull DescriptorTable register(@NotNull TypeDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        descriptors.put(descriptor.getId(), descriptor);
        return this;
    }

    public @NotNull DescriptorTable registerInterface(@NotNull String id) {
        return register(TypeDescriptor.notInstantiable(id, TypeKind.INTERFACE));
    }

    public @NotNull DescriptorTable registerAbstract(@NotNull String id) {
        return register(TypeDescriptor.notInstantiable(id, TypeKind.ABSTRACT));
    }

    @Override
    public boolean isKnownType(@NotNull String id) {
        if (descriptors.containsKey(id)) {
            return true;
        }

        return fallback != null && fallback.isKnownType(id);
    }

    @Override
    public @Nullable TypeDescriptor describe(@NotNull String id) {
        TypeDescriptor descriptor = descriptors.get(id);

        if (descriptor != null) {
            return descriptor;
        }

        return fallback == null ? null : fallback.describe(id);
    }

    @Override
    public @Nullable Class<?> findClass(@NotNull String id) {
        return fallback == null ? null : fallback.findClass(id);
    }

    @Override
    public @Nullable Invocable findMethod(@NotNull Class<?> type, @NotNull String name) {
        return fallback == null ? null : fallback.findMethod(type, name);
    }

}
