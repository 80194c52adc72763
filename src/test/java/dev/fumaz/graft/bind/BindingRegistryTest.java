package dev.fumaz.graft.bind;

import dev.fumaz.graft.container.Container;
import dev.fumaz.graft.exception.BindingException;
import dev.fumaz.graft.exception.FactoryException;
import dev.fumaz.graft.introspect.ReflectionTypeIntrospector;
import dev.fumaz.graft.provider.Provider;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BindingRegistryTest {

    private final Container container = Container.create();
    private final BindingRegistry registry = new BindingRegistry(new ReflectionTypeIntrospector(),
            target -> c -> "autowired:" + target);

    @Test
    void providersBecomeFactories() {
        Provider<String> provider = c -> "made";
        Binding binding = registry.set("id", provider);

        assertEquals(BindingKind.FACTORY, binding.getKind());
        assertEquals("made", binding.provide(container));
    }

    @Test
    void suppliersBecomeFactories() {
        Supplier<String> supplier = () -> "supplied";
        Binding binding = registry.set("id", supplier);

        assertEquals(BindingKind.FACTORY, binding.getKind());
        assertEquals("supplied", binding.provide(container));
    }

    @Test
    void nullAutowiresTheIdItself() {
        Binding binding = registry.set(Widget.class.getName(), null);

        assertEquals(BindingKind.AUTOWIRE, binding.getKind());
        assertEquals(Widget.class.getName(), binding.getTarget());
        assertEquals("autowired:" + Widget.class.getName(), binding.provide(container));
    }

    @Test
    void classValuesAutowireTheImplementation() {
        Binding binding = registry.set(Part.class.getName(), Widget.class);

        assertEquals(BindingKind.AUTOWIRE, binding.getKind());
        assertEquals(Widget.class.getName(), binding.getTarget());
    }

    @Test
    void otherValuesAreLiterals() {
        Object value = new Object();
        Binding binding = registry.set("value", value);

        assertEquals(BindingKind.VALUE, binding.getKind());
        assertSame(value, binding.provide(container));
    }

    @Test
    void nullForAnUnknownIdIsRejected() {
        assertThrows(BindingException.class, () -> registry.set("no.such.Type", null));
        assertFalse(registry.contains("no.such.Type"));
    }

    @Test
    void nonInstantiableClassValueIsRejected() {
        assertThrows(BindingException.class, () -> registry.set("part", Part.class));
    }

    @Test
    void checkedFactoryFailuresAreTaggedWithTheId() {
        Provider<String> failing = c -> {
            throw new java.io.IOException("offline");
        };
        Binding binding = registry.set("remote", failing);

        FactoryException exception = assertThrows(FactoryException.class, () -> binding.provide(container));

        assertEquals("remote", exception.getId());
        assertEquals("offline", exception.getCause().getMessage());
    }

    @Test
    void sharedBindingsCacheAndEvict() {
        AtomicInteger calls = new AtomicInteger();
        Provider<Integer> counter = c -> calls.incrementAndGet();
        Binding binding = registry.singleton("counter", counter);

        assertTrue(binding.isShared());
        assertFalse(binding.isCached());
        assertEquals(1, binding.provide(container));
        assertEquals(1, binding.provide(container));
        assertTrue(binding.isCached());

        assertTrue(registry.evict("counter"));
        assertFalse(registry.evict("counter"));
        assertEquals(2, binding.provide(container));
    }

    @Test
    void evictIgnoresNonSharedBindings() {
        registry.set("value", 1);

        assertFalse(registry.evict("value"));
        assertFalse(registry.evict("missing"));
    }

    @Test
    void registerIfAbsentKeepsTheExistingBinding() {
        Binding first = registry.set("id", 1);
        Binding returned = registry.registerIfAbsent(Binding.value("id", Provider.value(2), false));

        assertSame(first, returned);
        assertEquals(1, registry.find("id").provide(container));
    }

    @Test
    void removeAndClear() {
        registry.set("one", 1);
        registry.set("two", 2);

        assertTrue(registry.remove("one"));
        assertFalse(registry.remove("one"));
        assertNull(registry.find("one"));
        assertEquals(1, registry.ids().size());

        registry.clear();

        assertTrue(registry.ids().isEmpty());
    }

    interface Part {
    }

    static class Widget implements Part {
    }

}
