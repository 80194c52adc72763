package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Wraps a failure raised by a registered factory, tagged with the id it was bound to.
 */
public class FactoryException extends BindingException {

    private final @NotNull String id;

    public FactoryException(@NotNull String id, @NotNull Throwable cause) {
        super("Factory for '" + id + "' threw: " + cause.getMessage(), cause);
        this.id = id;
    }

    public @NotNull String getId() {
        return id;
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.FACTORY;
    }

}
