package com.streamfirst.component.catalog.boot;

import org.springframework.boot.autoconfigure.condition.ConditionMessage;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

import java.util.Map;

class OnCatalogStoreCondition extends SpringBootCondition {

    static final String STORE_PROPERTY = "catalog.store";

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        Map<String, Object> attributes = metadata.getAnnotationAttributes(ConditionalOnCatalogStore.class.getName());
        CatalogProperties.Store required = (CatalogProperties.Store) attributes.get("value");
        CatalogProperties.Store configured = Binder.get(context.getEnvironment())
                .bind(STORE_PROPERTY, CatalogProperties.Store.class)
                .orElse(new CatalogProperties().getStore());

        ConditionMessage.Builder message = ConditionMessage.forCondition(ConditionalOnCatalogStore.class, required);
        if (configured == required) {
            return ConditionOutcome.match(message.because(STORE_PROPERTY + " is " + configured));
        }
        return ConditionOutcome.noMatch(message.because(STORE_PROPERTY + " is " + configured));
    }
}
