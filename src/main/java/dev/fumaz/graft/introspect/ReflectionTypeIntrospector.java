package dev.fumaz.graft.introspect;

import dev.fumaz.graft.annotation.DefaultValue;
import dev.fumaz.graft.annotation.Inject;
import dev.fumaz.graft.annotation.Named;
import dev.fumaz.graft.annotation.Singleton;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Introspects classes through {@code java.lang.reflect}.
 * <p>
 * Parameter names are read from the {@code MethodParameters} attribute, so classes should be compiled with
 * {@code -parameters}; otherwise names fall back to {@code arg0}, {@code arg1} and so on.
 */
public final class ReflectionTypeIntrospector implements TypeIntrospector {

    private final @NotNull ClassLoader classLoader;
    private final ConcurrentMap<String, Class<?>> classes = new ConcurrentHashMap<>();
    private final ClassValue<TypeDescriptor> descriptors = new ClassValue<TypeDescriptor>() {
        @Override
        protected TypeDescriptor computeValue(Class<?> type) {
            return describeClass(type);
        }
    };

    public ReflectionTypeIntrospector() {
        this(defaultClassLoader());
    }

    public ReflectionTypeIntrospector(@NotNull ClassLoader classLoader) {
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    @Override
    public boolean isKnownType(@NotNull String id) {
        return findClass(id) != null;
    }

    @Override
    public @Nullable TypeDescriptor describe(@NotNull String id) {
        Class<?> type = findClass(id);
        return type == null ? null : descriptors.get(type);
    }

    @Override
    public @Nullable Class<?> findClass(@NotNull String id) {
        Class<?> cached = classes.get(id);

        if (cached != null) {
            return cached;
        }

        try {
            Class<?> loaded = Class.forName(id, false, classLoader);
            classes.putIfAbsent(id, loaded);
            return loaded;
        } catch (ClassNotFoundException | LinkageError e) {
            return null;
        }
    }

    @Override
    public @Nullable Invocable findMethod(@NotNull Class<?> type, @NotNull String name) {
        Class<?> current = type;

        while (current != null) {
            for (Method method : current.getDeclaredMethods()) {
                if (method.getName().equals(name) && !method.isSynthetic() && !method.isBridge()) {
                    return describeMethod(method);
                }
            }

            current = current.getSuperclass();
        }

        for (Method method : type.getMethods()) {
            if (method.getName().equals(name)) {
                return describeMethod(method);
            }
        }

        return null;
    }

    static @NotNull Invocable describeMethod(@NotNull Method method) {
        List<ParameterDescriptor> parameters = describeParameters(method);
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        String description = method.getDeclaringClass().getName() + "::" + method.getName();
        method.setAccessible(true);

        return new Invocable() {
            @Override
            public @NotNull String describe() {
                return description;
            }

            @Override
            public @NotNull List<ParameterDescriptor> getParameters() {
                return parameters;
            }

            @Override
            public boolean requiresReceiver() {
                return !isStatic;
            }

            @Override
            public @Nullable Object invoke(@Nullable Object receiver, @NotNull Object[] arguments) throws Throwable {
                try {
                    return method.invoke(isStatic ? null : receiver, arguments);
                } catch (InvocationTargetException e) {
                    throw unwrap(e);
                }
            }
        };
    }

    private static TypeDescriptor describeClass(Class<?> type) {
        String id = type.getName();

        if (type.isInterface()) {
            return TypeDescriptor.notInstantiable(id, TypeKind.INTERFACE);
        }

        if (type.isPrimitive() || type.isArray() || type.isEnum()
                || type.isAnonymousClass() || type.isLocalClass()
                || (type.isMemberClass() && !Modifier.isStatic(type.getModifiers()))) {
            return TypeDescriptor.notInstantiable(id, TypeKind.UNSUPPORTED);
        }

        if (Modifier.isAbstract(type.getModifiers())) {
            return TypeDescriptor.notInstantiable(id, TypeKind.ABSTRACT);
        }

        Constructor<?> constructor = selectConstructor(type);

        if (constructor == null) {
            return TypeDescriptor.notInstantiable(id, TypeKind.NO_ELIGIBLE_CONSTRUCTOR);
        }

        constructor.setAccessible(true);

        TypeDescriptor.Builder builder = TypeDescriptor.builder(id)
                .singleton(type.isAnnotationPresent(Singleton.class))
                .instantiator(arguments -> {
                    try {
                        return constructor.newInstance(arguments);
                    } catch (InvocationTargetException e) {
                        throw unwrap(e);
                    }
                });

        for (ParameterDescriptor parameter : describeParameters(constructor)) {
            builder.parameter(parameter);
        }

        return builder.build();
    }

    private static @Nullable Constructor<?> selectConstructor(Class<?> type) {
        Constructor<?>[] declared = type.getDeclaredConstructors();
        Constructor<?> injectable = null;
        Constructor<?> zeroArg = null;

        for (Constructor<?> constructor : declared) {
            if (constructor.isAnnotationPresent(Inject.class)) {
                if (injectable != null) {
                    return null;
                }

                injectable = constructor;
            }

            if (constructor.getParameterCount() == 0) {
                zeroArg = constructor;
            }
        }

        if (injectable != null) {
            return injectable;
        }

        if (declared.length == 1) {
            return declared[0];
        }

        return zeroArg;
    }

    private static List<ParameterDescriptor> describeParameters(Executable executable) {
        Parameter[] parameters = executable.getParameters();

        if (parameters.length == 0) {
            return Collections.emptyList();
        }

        List<ParameterDescriptor> described = new ArrayList<>(parameters.length);

        for (Parameter parameter : parameters) {
            described.add(describeParameter(parameter));
        }

        return Collections.unmodifiableList(described);
    }

    private static ParameterDescriptor describeParameter(Parameter parameter) {
        String name = parameter.getName();
        Type generic = parameter.getParameterizedType();
        ParameterDescriptor descriptor;

        if (generic instanceof TypeVariable && ((TypeVariable<?>) generic).getBounds().length > 1) {
            Type[] bounds = ((TypeVariable<?>) generic).getBounds();
            Class<?>[] erased = new Class<?>[bounds.length];

            for (int i = 0; i < bounds.length; i++) {
                erased[i] = erase(bounds[i]);
            }

            descriptor = ParameterDescriptor.intersection(name, erased);
        } else if (parameter.getType() == Object.class) {
            descriptor = ParameterDescriptor.untyped(name);
        } else {
            descriptor = ParameterDescriptor.typed(name, parameter.getType());
        }

        Named named = parameter.getAnnotation(Named.class);

        if (named != null) {
            descriptor = descriptor.named(named.value());
        }

        DefaultValue defaultValue = parameter.getAnnotation(DefaultValue.class);

        if (defaultValue != null) {
            descriptor = descriptor.withDefault(Types.convert(defaultValue.value(), parameter.getType()));
        }

        Inject inject = parameter.getAnnotation(Inject.class);

        if (inject != null && inject.optional() && !parameter.getType().isPrimitive()) {
            descriptor = descriptor.asNullable();
        }

        return descriptor;
    }

    private static Class<?> erase(Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        }

        if (type instanceof ParameterizedType) {
            return erase(((ParameterizedType) type).getRawType());
        }

        if (type instanceof TypeVariable) {
            Type[] bounds = ((TypeVariable<?>) type).getBounds();
            return bounds.length == 0 ? Object.class : erase(bounds[0]);
        }

        return Object.class;
    }

    private static Throwable unwrap(InvocationTargetException exception) {
        Throwable target = exception.getTargetException();
        return target != null ? target : exception;
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : ReflectionTypeIntrospector.class.getClassLoader();
    }

}
