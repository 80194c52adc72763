package dev.fumaz.graft.container;

import dev.fumaz.graft.annotation.DefaultValue;
import dev.fumaz.graft.exception.ContainerException;
import dev.fumaz.graft.exception.InvocationException;
import dev.fumaz.graft.exception.ParameterResolutionException;
import dev.fumaz.graft.introspect.Invocable;
import dev.fumaz.graft.introspect.ParameterDescriptor;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MethodInjectionTest {

    @Test
    void invokesMethodOnClassWithAutowiredArguments() {
        Container container = Container.create();

        Object result = container.invokeMethod(PostsController.class, "index");

        assertTrue(result instanceof Request, "the parameter should be autowired");
    }

    @Test
    void invokesMethodOnClassName() {
        Container container = Container.create();

        Object result = container.invokeMethod(PostsController.class.getName(), "index");

        assertTrue(result instanceof Request);
    }

    @Test
    void invokesMethodOnGivenTarget() {
        Container container = Container.create();
        CountingController controller = new CountingController();

        container.invokeMethod(controller, "increment");
        container.invokeMethod(controller, "increment");

        assertEquals(2, controller.count);
    }

    @Test
    void sharedDependenciesAreInjectedIntoMethods() {
        Container container = Container.create();
        container.singleton(Request.class);

        Object result = container.invokeMethod(PostsController.class, "index");

        assertSame(container.get(Request.class), result);
    }

    @Test
    void scalarMethodParametersAreResolvedByName() {
        Container container = Container.create();
        container.set("env", "staging");

        assertEquals("staging", container.invokeMethod(EnvController.class, "index"));
    }

    @Test
    void overridesArePassedVerbatim() {
        Container container = Container.create();
        container.set("env", "staging");

        assertEquals("production",
                container.invokeMethod(EnvController.class, "index", Map.of("env", "production")));
        assertNull(container.invokeMethod(EnvController.class, "index", Collections.singletonMap("env", null)),
                "a null override should be passed as is");
    }

    @Test
    void overridesMixWithResolvedParameters() {
        Container container = Container.create();

        Object result = container.invokeMethod(MixedController.class, "describe", Map.of("env", "dev"));

        assertEquals("Request@dev", result);
    }

    @Test
    void receiverComesFromItsBinding() {
        Container container = Container.create();
        container.set(Configured.class, c -> new Configured("bound"));

        assertEquals("bound", container.invokeMethod(Configured.class, "name"));
    }

    @Test
    void receiverWithoutBindingOrNoArgConstructorIsRejected() {
        Container container = Container.create();

        assertThrows(ContainerException.class, () -> container.invokeMethod(Configured.class, "name"));
    }

    @Test
    void staticMethodsNeedNoReceiver() {
        Container container = Container.create();

        assertEquals("hello world", container.invokeMethod(Configured.class, "greet"));
    }

    @Test
    void missingClassIsRejected() {
        Container container = Container.create();

        ContainerException exception = assertThrows(ContainerException.class,
                () -> container.invokeMethod("com.example.Missing", "index"));

        assertTrue(exception.getMessage().contains("com.example.Missing"));
    }

    @Test
    void missingMethodIsRejected() {
        Container container = Container.create();

        ContainerException exception = assertThrows(ContainerException.class,
                () -> container.invokeMethod(PostsController.class, "destroy"));

        assertTrue(exception.getMessage().contains("destroy"));
    }

    @Test
    void methodFailuresAreWrapped() {
        Container container = Container.create();

        InvocationException exception = assertThrows(InvocationException.class,
                () -> container.invokeMethod(Failing.class, "explode"));

        assertTrue(exception.getCause() instanceof IllegalStateException);
        assertEquals("nope", exception.getCause().getMessage());
    }

    @Test
    void unresolvableMethodParameterFails() {
        Container container = Container.create();

        ParameterResolutionException exception = assertThrows(ParameterResolutionException.class,
                () -> container.invokeMethod(EnvController.class, "index"));

        assertEquals("env", exception.getParameter());
    }

    @Test
    void functionsUseDefaultsAndOverrides() {
        Container container = Container.create();
        Invocable summary = Invocable.function("summary")
                .parameter(ParameterDescriptor.typed("count", int.class).withDefault(10))
                .parameter(ParameterDescriptor.typed("name", String.class).withDefault("foo"))
                .body(arguments -> arguments[0] + ":" + arguments[1]);

        assertEquals("10:foo", container.invokeFunction(summary));
        assertEquals("10:bar", container.invokeFunction(summary, Map.of("name", "bar")));
    }

    @Test
    void functionsReceiveAutowiredArguments() {
        Container container = Container.create();
        container.singleton(Request.class);
        Invocable handler = Invocable.function("handler")
                .parameter("request", Request.class)
                .body(arguments -> arguments[0]);

        assertSame(container.get(Request.class), container.invokeFunction(handler));
    }

    @Test
    void untypedFunctionParameterWithoutDefaultFails() {
        Container container = Container.create();
        Invocable function = Invocable.function("loose")
                .parameter(ParameterDescriptor.untyped("value"))
                .body(arguments -> arguments[0]);

        assertThrows(ParameterResolutionException.class, () -> container.invokeFunction(function));
        assertEquals("given", container.invokeFunction(function, Map.of("value", "given")));
    }

    @Test
    void staticMethodsCanBeInvokedAsFunctions() throws Exception {
        Container container = Container.create();
        Method greet = Configured.class.getDeclaredMethod("greet", String.class);

        assertEquals("hello world", container.invokeFunction(greet, Collections.emptyMap()));
        assertEquals("hello graft", container.invokeFunction(greet, Map.of("name", "graft")));
    }

    @Test
    void instanceMethodsCannotBeInvokedAsFunctions() throws Exception {
        Container container = Container.create();
        Method name = Configured.class.getDeclaredMethod("name");

        assertThrows(ContainerException.class, () -> container.invokeFunction(name, Collections.emptyMap()));
    }

    @Test
    void functionFailuresAreWrapped() {
        Container container = Container.create();
        Invocable failing = Invocable.function("failing").body(arguments -> {
            throw new java.io.IOException("disk");
        });

        InvocationException exception = assertThrows(InvocationException.class,
                () -> container.invokeFunction(failing));

        assertEquals("disk", exception.getCause().getMessage());
    }

    static class Request {
    }

    static class PostsController {
        public Request index(Request request) {
            return request;
        }
    }

    static class EnvController {
        public String index(String env) {
            return env;
        }
    }

    static class MixedController {
        public String describe(Request request, String env) {
            return request.getClass().getSimpleName() + "@" + env;
        }
    }

    static class CountingController {
        int count;

        public void increment() {
            count++;
        }
    }

    static class Configured {
        final String name;

        Configured(String name) {
            this.name = name;
        }

        String name() {
            return name;
        }

        static String greet(@DefaultValue("world") String name) {
            return "hello " + name;
        }
    }

    static class Failing {
        public void explode() {
            throw new IllegalStateException("nope");
        }
    }

}
