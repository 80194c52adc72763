package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Signals alias misuse, such as an alias pointing at itself.
 */
public class AliasException extends BindingException {

    public AliasException(String message) {
        super(message);
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.ALIAS;
    }

}
