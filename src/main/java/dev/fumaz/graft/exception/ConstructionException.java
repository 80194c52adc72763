package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Wraps a failure raised by a constructor invoked during autowiring.
 */
public class ConstructionException extends ResolutionException {

    public ConstructionException(@NotNull String id, @NotNull List<String> chain, @NotNull Throwable cause) {
        super("Failed to create an instance of " + id + ": " + cause.getMessage()
                + " (while resolving " + breadcrumb(chain) + ")", chain, cause);
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.CONSTRUCTION;
    }

}
