package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when an id has no binding and does not name a resolvable type.
 */
public class NotFoundException extends ContainerException {

    private final @NotNull String id;

    public NotFoundException(@NotNull String id) {
        super("Binding for '" + id + "' not found and not instantiable in the container");
        this.id = id;
    }

    public @NotNull String getId() {
        return id;
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.NOT_FOUND;
    }

}
