package dev.fumaz.graft.annotation;

import java.lang.annotation.*;

/**
 * Resolves a parameter from the binding with the given id instead of its name or type.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Named {

    String value();

}
