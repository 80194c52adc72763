package dev.fumaz.graft.container;

import dev.fumaz.graft.context.ResolutionTracker;
import dev.fumaz.graft.exception.ParameterResolutionException;
import dev.fumaz.graft.introspect.ParameterDescriptor;
import dev.fumaz.graft.introspect.TypeDescriptor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Supplies arguments for constructor, method and function parameters.
 * <p>
 * Scalar parameters are looked up by parameter name (or {@link dev.fumaz.graft.annotation.Named} id); class
 * parameters by their type's id, falling back to autowiring. An explicit binding always beats autowiring.
 */
final class ParameterResolver {

    private static final Logger LOGGER = Logger.getLogger(ParameterResolver.class.getName());
    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final @NotNull GraftContainer container;
    private final @NotNull ResolutionTracker tracker;
    private final @NotNull ContainerOptions options;

    ParameterResolver(@NotNull GraftContainer container,
                      @NotNull ResolutionTracker tracker,
                      @NotNull ContainerOptions options) {
        this.container = container;
        this.tracker = tracker;
        this.options = options;
    }

    /**
     * @param owner       the constructor, method or function the parameters belong to, for messages
     * @param requester   the id of the type being built, naming injected loggers
     * @param overrides   values keyed by parameter name, used verbatim
     */
    @NotNull Object[] resolve(@NotNull String owner,
                              @NotNull String requester,
                              @NotNull List<ParameterDescriptor> parameters,
                              @NotNull Map<String, ?> overrides) {
        if (parameters.isEmpty()) {
            return NO_ARGUMENTS;
        }

        Object[] arguments = new Object[parameters.size()];

        for (int i = 0; i < arguments.length; i++) {
            arguments[i] = resolve(owner, requester, parameters.get(i), overrides);
        }

        return arguments;
    }

    @NotNull Object[] resolve(@NotNull String owner,
                              @NotNull String requester,
                              @NotNull List<ParameterDescriptor> parameters) {
        return resolve(owner, requester, parameters, Collections.emptyMap());
    }

    private @Nullable Object resolve(String owner,
                                     String requester,
                                     ParameterDescriptor parameter,
                                     Map<String, ?> overrides) {
        String name = parameter.getName();

        if (overrides.containsKey(name)) {
            return overrides.get(name);
        }

        if (parameter.isUnionOrIntersection()) {
            throw failure(owner, parameter, "union and intersection types (" + parameter.describeType()
                    + ") are not supported");
        }

        Class<?> type = parameter.getType();

        if (type == null) {
            if (parameter.hasDefault()) {
                return useDefault(owner, parameter);
            }

            throw failure(owner, parameter, "it has no declared type and no default value");
        }

        String bindingName = parameter.getBindingName();

        if (parameter.isBuiltin()) {
            String key = bindingName != null ? bindingName : name;

            if (container.hasBinding(key)) {
                LOGGER.finer(() -> "Resolving " + owner + " parameter '" + name + "' from binding '" + key + "'");
                return container.get(key);
            }

            if (parameter.hasDefault()) {
                return useDefault(owner, parameter);
            }

            throw failure(owner, parameter, "it is a " + type.getName() + " with no binding named '" + key
                    + "' and no default value");
        }

        if (bindingName != null && container.hasBinding(bindingName)) {
            return container.get(bindingName);
        }

        String typeId = type.getName();

        if (container.hasBinding(typeId)) {
            return container.get(typeId);
        }

        if (type == Container.class && options.isSelfBinding()) {
            return container;
        }

        if (type == Logger.class && options.isLoggerInjection()) {
            return Logger.getLogger(requester);
        }

        if (options.isAutowire()) {
            TypeDescriptor descriptor = container.describe(typeId);

            if (descriptor != null && descriptor.getKind().isInstantiable()) {
                return container.get(typeId);
            }
        }

        if (parameter.hasDefault()) {
            return useDefault(owner, parameter);
        }

        String problem = bindingName != null
                ? "no binding named '" + bindingName + "' or for " + typeId + " exists and it cannot be autowired"
                : "no binding for " + typeId + " exists and it cannot be autowired";

        throw failure(owner, parameter, problem);
    }

    private @Nullable Object useDefault(String owner, ParameterDescriptor parameter) {
        LOGGER.finer(() -> "Using the default value of " + owner + " parameter '" + parameter.getName() + "'");
        return parameter.getDefaultValue();
    }

    private ParameterResolutionException failure(String owner, ParameterDescriptor parameter, String problem) {
        return new ParameterResolutionException(owner, parameter.getName(), problem, tracker.chain());
    }

}
