package dev.fumaz.graft.introspect;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A method or free function whose parameters the container can supply.
 */
public interface Invocable {

    static @NotNull Invocable of(@NotNull Method method) {
        return ReflectionTypeIntrospector.describeMethod(method);
    }

    static @NotNull FunctionBuilder function(@NotNull String name) {
        return new FunctionBuilder(name);
    }

    @NotNull String describe();

    @NotNull List<ParameterDescriptor> getParameters();

    /**
     * @return whether {@link #invoke} needs a non-null receiver
     */
    boolean requiresReceiver();

    @Nullable Object invoke(@Nullable Object receiver, @NotNull Object[] arguments) throws Throwable;

    @FunctionalInterface
    interface Body {

        @Nullable Object apply(@NotNull Object[] arguments) throws Exception;

    }

    final class FunctionBuilder {

        private final @NotNull String name;
        private final @NotNull List<ParameterDescriptor> parameters = new ArrayList<>();

        private FunctionBuilder(@NotNull String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public @NotNull FunctionBuilder parameter(@NotNull ParameterDescriptor parameter) {
            parameters.add(Objects.requireNonNull(parameter, "parameter"));
            return this;
        }

        public @NotNull FunctionBuilder parameter(@NotNull String name, @NotNull Class<?> type) {
            return parameter(ParameterDescriptor.typed(name, type));
        }

        public @NotNull Invocable body(@NotNull Body body) {
            Objects.requireNonNull(body, "body");
            List<ParameterDescriptor> snapshot = Collections.unmodifiableList(new ArrayList<>(parameters));

            return new Invocable() {
                @Override
                public @NotNull String describe() {
                    return "function " + name;
                }

                @Override
                public @NotNull List<ParameterDescriptor> getParameters() {
                    return snapshot;
                }

                @Override
                public boolean requiresReceiver() {
                    return false;
                }

                @Override
                public @Nullable Object invoke(@Nullable Object receiver, @NotNull Object[] arguments)
                        throws Exception {
                    return body.apply(arguments);
                }
            };
        }
    }

}
