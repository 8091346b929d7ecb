package com.streamfirst.component.catalog.boot;

import com.streamfirst.component.catalog.adapters.InMemoryCandidateAdapter;
import com.streamfirst.component.catalog.adapters.jdbc.JdbcCandidateAdapter;
import com.streamfirst.component.catalog.application.LatestComponentResolver;
import com.streamfirst.component.catalog.application.TieBreakPolicy;
import com.streamfirst.component.catalog.domain.ComponentCandidate;
import com.streamfirst.component.catalog.domain.ComponentId;
import com.streamfirst.component.catalog.domain.ComponentIdentity;
import com.streamfirst.component.catalog.domain.ComponentNamespace;
import com.streamfirst.component.catalog.domain.TaxonomyScope;
import com.streamfirst.component.catalog.ports.CandidatePort;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.transaction.annotation.Isolation;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentCatalogConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ComponentCatalogConfiguration.class);

    @Test
    void defaultsToInMemoryStoreAndLastVisitedTieBreak() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(InMemoryCandidateAdapter.class);
            assertThat(context).hasSingleBean(CandidatePort.class);
            assertThat(context).doesNotHaveBean(JdbcCandidateAdapter.class);
            assertThat(context).hasSingleBean(LatestComponentResolver.class);
            assertThat(context.getBean(CatalogProperties.class).getTieBreak()).isEqualTo(TieBreakPolicy.LAST_VISITED);
        });
    }

    @Test
    void bindsRelaxedPropertyValues() {
        contextRunner
                .withPropertyValues(
                        "catalog.tie-break=lowest-identifier",
                        "catalog.jdbc.query-timeout=5s",
                        "catalog.jdbc.isolation=serializable")
                .run(context -> {
                    CatalogProperties properties = context.getBean(CatalogProperties.class);
                    assertThat(properties.getStore()).isEqualTo(CatalogProperties.Store.IN_MEMORY);
                    assertThat(properties.getTieBreak()).isEqualTo(TieBreakPolicy.LOWEST_IDENTIFIER);
                    assertThat(properties.getJdbc().getQueryTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(properties.getJdbc().getIsolation()).isEqualTo(Isolation.SERIALIZABLE);
                });
    }

    @Test
    void wiresResolverToInMemoryStore() {
        contextRunner.withPropertyValues("catalog.tie-break=lowest-identifier").run(context -> {
            InMemoryCandidateAdapter store = context.getBean(InMemoryCandidateAdapter.class);
            ComponentIdentity image = ComponentIdentity.of(ComponentNamespace.REDHAT, "ubi9-container", "OCI", "noarch");
            TaxonomyScope stream = TaxonomyScope.productStream("o:redhat:rhel:9.2.0.z");
            store.registerComponent(ComponentCandidate.of("f2", image, 0, "9.2", "755"), stream);
            store.registerComponent(ComponentCandidate.of("e1", image, 0, "9.2", "755"), stream);

            LatestComponentResolver resolver = context.getBean(LatestComponentResolver.class);

            assertThat(resolver.resolveLatest("ProductStream", stream.ofuri(), "OCI", ComponentNamespace.REDHAT,
                    "ubi9-container", "noarch", false)).contains(ComponentId.of("e1"));
        });
    }

    @Test
    void switchesToJdbcStore() {
        contextRunner
                .withPropertyValues(
                        "catalog.store=jdbc",
                        "spring.datasource.url=jdbc:postgresql://localhost:5432/catalog",
                        "spring.datasource.username=catalog")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(JdbcCandidateAdapter.class);
                    assertThat(context).doesNotHaveBean(InMemoryCandidateAdapter.class);
                    assertThat(context).hasSingleBean(LatestComponentResolver.class);
                });
    }

    @Test
    void selectsStoreFromAnySpellingTheEnumAccepts() {
        for (String spelling : new String[] {"IN_MEMORY", "in_memory", "In-Memory"}) {
            contextRunner.withPropertyValues("catalog.store=" + spelling).run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context.getBean(CatalogProperties.class).getStore()).isEqualTo(CatalogProperties.Store.IN_MEMORY);
                assertThat(context).hasSingleBean(InMemoryCandidateAdapter.class);
                assertThat(context).hasSingleBean(CandidatePort.class);
            });
        }

        contextRunner
                .withPropertyValues(
                        "catalog.store=JDBC",
                        "spring.datasource.url=jdbc:postgresql://localhost:5432/catalog")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(JdbcCandidateAdapter.class);
                    assertThat(context).doesNotHaveBean(InMemoryCandidateAdapter.class);
                });
    }

    @Test
    void rejectsUnknownStore() {
        contextRunner.withPropertyValues("catalog.store=cassandra").run(context ->
                assertThat(context).hasFailed());
    }
}
