package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Base unchecked exception for Graft-specific failures.
 * <p>
 * Thrown directly for structural problems detected by the invoker, such as a missing class or method.
 */
public class ContainerException extends RuntimeException {

    public ContainerException(String message) {
        super(message);
    }

    public ContainerException(String message, Throwable cause) {
        super(message, cause);
    }

    public ContainerException(Throwable cause) {
        super(cause);
    }

    public @NotNull ErrorKind getKind() {
        return ErrorKind.CONTAINER;
    }

    /**
     * Flattens the causal chain of {@code throwable}, outermost first.
     * <p>
     * Throwables that are not container exceptions report their simple class name as the kind.
     *
     * @param throwable the failure to explain
     * @return one {@link Diagnostic} per link of the chain
     */
    public static @NotNull List<Diagnostic> explain(@Nullable Throwable throwable) {
        if (throwable == null) {
            return Collections.emptyList();
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = throwable;

        while (current != null && visited.add(current)) {
            diagnostics.add(Diagnostic.of(current));
            current = current.getCause();
        }

        return diagnostics;
    }

    public static @NotNull Throwable rootCause(@NotNull Throwable throwable) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = throwable;

        while (current.getCause() != null && visited.add(current)) {
            current = current.getCause();
        }

        return current;
    }

}
