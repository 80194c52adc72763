package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Indicates an invalid binding, supplied at registration time or detected while invoking it.
 */
public class BindingException extends ContainerException {

    public BindingException(String message) {
        super(message);
    }

    public BindingException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.BINDING;
    }

}
