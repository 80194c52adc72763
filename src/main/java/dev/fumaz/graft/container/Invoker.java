package dev.fumaz.graft.container;

import dev.fumaz.graft.exception.ContainerException;
import dev.fumaz.graft.exception.InvocationException;
import dev.fumaz.graft.introspect.Invocable;
import dev.fumaz.graft.introspect.TypeDescriptor;
import dev.fumaz.graft.introspect.TypeIntrospector;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Calls methods and functions with container-supplied arguments.
 * <p>
 * The receiver of an instance method is never autowired: it is either supplied, bound, or built with its no-arg
 * constructor.
 */
final class Invoker {

    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final @NotNull GraftContainer container;
    private final @NotNull TypeIntrospector introspector;
    private final @NotNull ParameterResolver parameters;

    Invoker(@NotNull GraftContainer container,
            @NotNull TypeIntrospector introspector,
            @NotNull ParameterResolver parameters) {
        this.container = container;
        this.introspector = introspector;
        this.parameters = parameters;
    }

    @Nullable Object invokeMethod(@NotNull Object target, @NotNull String method, @NotNull Map<String, ?> overrides) {
        Invocable invocable = findMethod(target.getClass(), method);
        return invoke(invocable, target, target.getClass().getName(), overrides);
    }

    @Nullable Object invokeMethod(@NotNull Class<?> type, @NotNull String method, @NotNull Map<String, ?> overrides) {
        Invocable invocable = findMethod(type, method);
        Object receiver = invocable.requiresReceiver() ? receiverFor(type, method) : null;

        return invoke(invocable, receiver, type.getName(), overrides);
    }

    @Nullable Object invokeMethod(@NotNull String className,
                                  @NotNull String method,
                                  @NotNull Map<String, ?> overrides) {
        Class<?> type;

        try {
            type = introspector.findClass(className);
        } catch (RuntimeException | LinkageError e) {
            throw new ContainerException("Cannot look up class " + className, e);
        }

        if (type == null) {
            throw new ContainerException("Class " + className + " does not exist");
        }

        return invokeMethod(type, method, overrides);
    }

    @Nullable Object invokeFunction(@NotNull Invocable function, @NotNull Map<String, ?> overrides) {
        if (function.requiresReceiver()) {
            throw new ContainerException(function.describe() + " is an instance method; invoke it on a target");
        }

        return invoke(function, null, function.describe(), overrides);
    }

    private Invocable findMethod(Class<?> type, String method) {
        Invocable invocable;

        try {
            invocable = introspector.findMethod(type, method);
        } catch (RuntimeException | LinkageError e) {
            throw new ContainerException("Cannot inspect method " + method + " of class " + type.getName(), e);
        }

        if (invocable == null) {
            throw new ContainerException("Method " + method + " does not exist in class " + type.getName());
        }

        return invocable;
    }

    private Object receiverFor(Class<?> type, String method) {
        String id = type.getName();

        if (container.hasBinding(id)) {
            Object bound = container.get(id);

            if (!type.isInstance(bound)) {
                throw new ContainerException("Cannot invoke " + method + ": the binding for " + id
                        + " did not produce an instance of it");
            }

            return bound;
        }

        TypeDescriptor descriptor = container.describe(id);

        if (descriptor == null || !descriptor.getKind().isInstantiable() || !descriptor.getParameters().isEmpty()) {
            throw new ContainerException("Cannot invoke " + method + " without an instance of " + id
                    + ": it has no binding and no no-arg constructor");
        }

        try {
            return introspector.construct(descriptor, NO_ARGUMENTS);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable throwable) {
            throw new ContainerException("Failed to create an instance of " + id + " to invoke " + method,
                    throwable);
        }
    }

    private @Nullable Object invoke(Invocable invocable,
                                    @Nullable Object receiver,
                                    String requester,
                                    Map<String, ?> overrides) {
        Object[] arguments = parameters.resolve(invocable.describe(), requester, invocable.getParameters(),
                overrides);

        try {
            return invocable.invoke(receiver, arguments);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable throwable) {
            throw new InvocationException(invocable.describe(), throwable);
        }
    }

}
