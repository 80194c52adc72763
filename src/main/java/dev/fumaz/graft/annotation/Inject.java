package dev.fumaz.graft.annotation;

import java.lang.annotation.*;

/**
 * Marks the constructor used for autowiring, or a parameter that may be left {@code null} when its type cannot be
 * resolved.
 */
@Target({ElementType.CONSTRUCTOR, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Inject {
    boolean optional() default false;
}
