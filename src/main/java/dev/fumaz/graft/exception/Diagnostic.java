package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A single link of an explained failure chain.
 */
public final class Diagnostic {

    private final @NotNull String kind;
    private final @NotNull String message;

    public Diagnostic(@NotNull String kind, @NotNull String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
    }

    static @NotNull Diagnostic of(@NotNull Throwable throwable) {
        String kind = throwable instanceof ContainerException
                ? ((ContainerException) throwable).getKind().name()
                : throwable.getClass().getSimpleName();
        String message = throwable.getMessage();

        return new Diagnostic(kind, message == null ? "" : message);
    }

    public @NotNull String getKind() {
        return kind;
    }

    public @NotNull String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof Diagnostic)) {
            return false;
        }

        Diagnostic that = (Diagnostic) o;
        return kind.equals(that.kind) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }

}
