package dev.fumaz.graft.context;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * Hands each thread its own {@link ResolutionContext}.
 * <p>
 * A context is created when the outermost frame is entered and discarded once it exits, so nested lookups made by
 * factories on the same thread share it while concurrent calls never do.
 */
public final class ResolutionTracker {

    private final ThreadLocal<ResolutionContext> contexts = new ThreadLocal<>();

    public void enter(@NotNull String id) {
        ResolutionContext context = contexts.get();

        if (context == null) {
            context = new ResolutionContext();
            contexts.set(context);
        }

        try {
            context.push(id);
        } finally {
            if (context.isEmpty()) {
                contexts.remove();
            }
        }
    }

    public void exit(@NotNull String id) {
        ResolutionContext context = contexts.get();

        if (context == null) {
            throw new IllegalStateException("No active resolution while exiting " + id);
        }

        try {
            context.pop(id);
        } finally {
            if (context.isEmpty()) {
                contexts.remove();
            }
        }
    }

    public @Nullable ResolutionContext current() {
        return contexts.get();
    }

    public boolean isIdle() {
        return contexts.get() == null;
    }

    public @NotNull List<String> chain() {
        ResolutionContext context = contexts.get();
        return context == null ? Collections.emptyList() : context.chain();
    }

}
