package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

public class AliasCycleException extends AliasException {

    private final @NotNull List<String> chain;

    public AliasCycleException(@NotNull List<String> chain) {
        super("Alias cycle detected: " + String.join(" -> ", chain));
        this.chain = Collections.unmodifiableList(chain);
    }

    public @NotNull List<String> getChain() {
        return chain;
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.ALIAS_CYCLE;
    }

}
