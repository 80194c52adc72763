package dev.fumaz.graft.annotation;

import java.lang.annotation.*;

/**
 * Marks a class as a singleton. An autowired singleton is cached on first resolution even without an explicit
 * binding.
 */
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Singleton {
}
