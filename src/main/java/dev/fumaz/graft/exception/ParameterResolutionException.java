package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

import java.util.List;

public class ParameterResolutionException extends ResolutionException {

    private final @NotNull String owner;
    private final @NotNull String parameter;

    public ParameterResolutionException(@NotNull String owner,
                                        @NotNull String parameter,
                                        @NotNull String problem,
                                        @NotNull List<String> chain) {
        super("Cannot resolve parameter '" + parameter + "' of " + owner + ": " + problem
                + " (while resolving " + breadcrumb(chain) + ")", chain);
        this.owner = owner;
        this.parameter = parameter;
    }

    /**
     * @return the constructor, method or function declaring the parameter
     */
    public @NotNull String getOwner() {
        return owner;
    }

    public @NotNull String getParameter() {
        return parameter;
    }

    @Override
    public @NotNull ErrorKind getKind() {
        return ErrorKind.PARAMETER_RESOLUTION;
    }

}
