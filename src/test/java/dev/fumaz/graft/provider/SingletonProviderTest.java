package dev.fumaz.graft.provider;

import dev.fumaz.graft.container.Container;
import dev.fumaz.graft.exception.FactoryException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SingletonProviderTest {

    private final Container container = Container.create();

    @Test
    void cachesTheFirstValue() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        SingletonProvider<Object> provider = new SingletonProvider<>("service", c -> {
            calls.incrementAndGet();
            return new Object();
        });

        assertFalse(provider.isCreated());

        Object first = provider.provide(container);

        assertTrue(provider.isCreated());
        assertSame(first, provider.provide(container));
        assertEquals(1, calls.get());
    }

    @Test
    void evictionForcesRecreation() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        SingletonProvider<Integer> provider = new SingletonProvider<>("counter", c -> calls.incrementAndGet());

        assertEquals(1, provider.provide(container));
        assertTrue(provider.evict());
        assertFalse(provider.evict());
        assertEquals(2, provider.provide(container));
    }

    @Test
    void factoryProviderTagsFailures() {
        FactoryProvider<Object> provider = new FactoryProvider<>("broken", c -> {
            throw new IllegalStateException("down");
        });

        FactoryException exception = assertThrows(FactoryException.class, () -> provider.provide(container));

        assertEquals("broken", exception.getId());
        assertEquals("down", exception.getCause().getMessage());
    }

    @Test
    void valueProviderReturnsItsValue() throws Exception {
        Object value = new Object();

        assertSame(value, Provider.value(value).provide(container));
    }

}
