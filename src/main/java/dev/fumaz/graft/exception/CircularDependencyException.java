package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

import java.util.List;

public class CircularDependencyException extends ResolutionException {

    public CircularDependencyException(@NotNull List<String> cycle) {
        super("Circular dependency detected: " + breadcrumb(cycle), cycle);
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.CIRCULAR_DEPENDENCY;
    }

}
