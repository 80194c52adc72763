package dev.fumaz.graft.introspect;

public enum TypeKind {

    CONCRETE,
    INTERFACE,
    ABSTRACT,
    NO_ELIGIBLE_CONSTRUCTOR,
    UNSUPPORTED;

    public boolean isInstantiable() {
        return this == CONCRETE;
    }

}
