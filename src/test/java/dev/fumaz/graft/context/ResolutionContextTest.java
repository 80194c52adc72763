package dev.fumaz.graft.context;

import dev.fumaz.graft.exception.CircularDependencyException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResolutionContextTest {

    @Test
    void tracksTheChainOutermostFirst() {
        ResolutionContext context = new ResolutionContext();
        context.push("root");
        context.push("child");

        assertEquals(Arrays.asList("root", "child"), context.chain());
        assertEquals("root -> child", context.breadcrumb());
        assertEquals(2, context.depth());
        assertTrue(context.contains("child"));
    }

    @Test
    void reEnteringAnIdIsACycle() {
        ResolutionContext context = new ResolutionContext();
        context.push("root");
        context.push("a");
        context.push("b");

        CircularDependencyException exception = assertThrows(CircularDependencyException.class,
                () -> context.push("a"));

        assertEquals(Arrays.asList("root", "a", "b", "a"), exception.getChain());
        assertTrue(exception.getMessage().contains("root -> a -> b -> a"));
        assertEquals(3, context.depth(), "a rejected push should not change the stack");
    }

    @Test
    void popsInReverseOrder() {
        ResolutionContext context = new ResolutionContext();
        context.push("a");
        context.push("b");

        assertThrows(IllegalStateException.class, () -> context.pop("a"));

        context.pop("b");
        context.pop("a");

        assertTrue(context.isEmpty());
        assertFalse(context.contains("a"));
        assertEquals("(root)", context.breadcrumb());
    }

    @Test
    void idMayBeResolvedAgainAfterItCompletes() {
        ResolutionContext context = new ResolutionContext();
        context.push("a");
        context.pop("a");
        context.push("a");

        assertEquals(1, context.depth());
    }

}
