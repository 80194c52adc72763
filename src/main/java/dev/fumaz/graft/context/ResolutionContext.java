package dev.fumaz.graft.context;

import dev.fumaz.graft.exception.CircularDependencyException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The ids currently being resolved by one top-level call, outermost first.
 */
public final class ResolutionContext {

    private final List<String> stack = new ArrayList<>();
    private final Set<String> inProgress = new HashSet<>();

    /**
     * @throws CircularDependencyException if {@code id} is already being resolved
     */
    public void push(@NotNull String id) {
        if (inProgress.contains(id)) {
            List<String> chain = new ArrayList<>(stack);
            chain.add(id);
            throw new CircularDependencyException(chain);
        }

        stack.add(id);
        inProgress.add(id);
    }

    public void pop(@NotNull String id) {
        if (stack.isEmpty() || !stack.get(stack.size() - 1).equals(id)) {
            throw new IllegalStateException("Resolution stack mismatch while exiting " + id);
        }

        stack.remove(stack.size() - 1);
        inProgress.remove(id);
    }

    public boolean contains(@NotNull String id) {
        return inProgress.contains(id);
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    public int depth() {
        return stack.size();
    }

    public @NotNull List<String> chain() {
        return Collections.unmodifiableList(new ArrayList<>(stack));
    }

    public @NotNull String breadcrumb() {
        return stack.isEmpty() ? "(root)" : String.join(" -> ", stack);
    }

}
