package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Wraps a failure raised by a method or function called through the invoker.
 */
public class InvocationException extends ContainerException {

    public InvocationException(@NotNull String target, @NotNull Throwable cause) {
        super("Invocation of " + target + " threw: " + cause.getMessage(), cause);
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.INVOCATION;
    }

}
