package io.github.wphillipmoore.edgegrid.json;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Drops the annotated property from serialized JSON when its value is empty: {@code null}, an empty
 * string, {@code false}, zero, an empty array or an empty object.
 *
 * <p>Unannotated properties are always written, {@code null} included.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface OmitEmpty {}
