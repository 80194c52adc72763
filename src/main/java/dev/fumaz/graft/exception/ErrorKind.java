package dev.fumaz.graft.exception;

/**
 * Classifies a {@link ContainerException} for diagnostics.
 */
public enum ErrorKind {

    CONTAINER,
    NOT_FOUND,
    BINDING,
    ALIAS,
    ALIAS_CYCLE,
    FACTORY,
    RESOLUTION,
    CIRCULAR_DEPENDENCY,
    NOT_INSTANTIABLE,
    PARAMETER_RESOLUTION,
    CONSTRUCTION,
    INVOCATION

}
