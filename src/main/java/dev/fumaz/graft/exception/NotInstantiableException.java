package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Thrown when the target of autowiring cannot be constructed at all.
 */
public class NotInstantiableException extends ResolutionException {

    public enum Reason {
        INTERFACE("an interface"),
        ABSTRACT("an abstract class"),
        NO_ELIGIBLE_CONSTRUCTOR("a class without an eligible constructor"),
        UNSUPPORTED("not a constructible class");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final @NotNull String id;
    private final @NotNull Reason reason;

    public NotInstantiableException(@NotNull String id, @NotNull Reason reason, @NotNull List<String> chain) {
        super("Cannot instantiate " + id + " because it is " + reason.getDescription()
                + " (while resolving " + breadcrumb(chain) + ")", chain);
        this.id = id;
        this.reason = reason;
    }

    public @NotNull String getId() {
        return id;
    }

    public @NotNull Reason getReason() {
        return reason;
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.NOT_INSTANTIABLE;
    }

}
