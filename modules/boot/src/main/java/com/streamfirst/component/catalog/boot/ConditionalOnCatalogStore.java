package com.streamfirst.component.catalog.boot;

import org.springframework.context.annotation.Conditional;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Matches when {@code catalog.store} binds to the given store. The property is bound the same
 * way {@link CatalogProperties} binds it, so {@code in-memory}, {@code in_memory} and
 * {@code IN_MEMORY} all select the same beans.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
@Conditional(OnCatalogStoreCondition.class)
public @interface ConditionalOnCatalogStore {

    CatalogProperties.Store value();
}
