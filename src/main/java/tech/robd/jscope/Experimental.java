package tech.robd.jscope;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a dispatch mode or factory whose timing guarantees may still change between releases.
 */
@Retention(RetentionPolicy.SOURCE)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.FIELD})
@Documented
public @interface Experimental {
    /**
     * @return why the element is experimental
     */
    String value() default "Timing of this dispatch path may change";
}
