package com.streamfirst.component.catalog.boot;

import com.streamfirst.component.catalog.application.TieBreakPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.transaction.annotation.Isolation;

import java.time.Duration;

/**
 * Settings bound from the {@code catalog.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    /**
     * Where component builds are read from.
     */
    public enum Store {
        /** Process-local catalog, empty at startup */
        IN_MEMORY,
        /** Relational catalog configured through spring.datasource */
        JDBC
    }

    private Store store = Store.IN_MEMORY;

    /** How exact epoch/version/release ties between duplicate builds are broken */
    private TieBreakPolicy tieBreak = TieBreakPolicy.LAST_VISITED;

    private final Jdbc jdbc = new Jdbc();

    @Data
    public static class Jdbc {
        /** Statement timeout around each candidate fetch */
        private Duration queryTimeout = Duration.ofSeconds(30);

        /** Isolation of the read-only snapshot transaction */
        private Isolation isolation = Isolation.REPEATABLE_READ;
    }
}
