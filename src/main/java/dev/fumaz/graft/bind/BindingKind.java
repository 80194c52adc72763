package dev.fumaz.graft.bind;

/**
 * How a {@link Binding} produces its value, decided once at registration time.
 */
public enum BindingKind {

    /**
     * A user-supplied {@link dev.fumaz.graft.provider.Provider}.
     */
    FACTORY,

    /**
     * A literal value returned as is.
     */
    VALUE,

    /**
     * A concrete class built by autowiring its constructor.
     */
    AUTOWIRE

}
