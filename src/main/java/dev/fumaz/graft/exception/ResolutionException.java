package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * Signals a failure while autowiring a type. Carries the resolution chain active when it was raised.
 */
public class ResolutionException extends ContainerException {

    private final @NotNull List<String> chain;

    public ResolutionException(String message, @NotNull List<String> chain) {
        super(message);
        this.chain = Collections.unmodifiableList(chain);
    }

    public ResolutionException(String message, @NotNull List<String> chain, Throwable cause) {
        super(message, cause);
        this.chain = Collections.unmodifiableList(chain);
    }

    /**
     * @return the ids under construction, outermost first
     */
    public @NotNull List<String> getChain() {
        return chain;
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.RESOLUTION;
    }

    protected static @NotNull String breadcrumb(@NotNull List<String> chain) {
        return chain.isEmpty() ? "(root)" : String.join(" -> ", chain);
    }

}
