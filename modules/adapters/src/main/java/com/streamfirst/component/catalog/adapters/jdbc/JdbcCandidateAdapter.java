package com.streamfirst.component.catalog.adapters.jdbc;

import com.streamfirst.component.catalog.domain.ComponentCandidate;
import com.streamfirst.component.catalog.domain.ComponentId;
import com.streamfirst.component.catalog.domain.ComponentIdentity;
import com.streamfirst.component.catalog.domain.ComponentNamespace;
import com.streamfirst.component.catalog.domain.EpochVersionRelease;
import com.streamfirst.component.catalog.domain.RootComponentPredicate;
import com.streamfirst.component.catalog.domain.TaxonomyScope;
import com.streamfirst.component.catalog.ports.CandidateAccessException;
import com.streamfirst.component.catalog.ports.CandidatePort;
import com.streamfirst.component.catalog.ports.CandidateQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * CandidatePort backed by the relational component catalog.
 * Every scan runs one query inside a read-only transaction and streams its rows into the
 * reducer before the transaction ends, so a fold never mixes rows from two snapshots.
 */
@Slf4j
public class JdbcCandidateAdapter implements CandidatePort {

    static final String ROOT_COMPONENTS_CONDITION = "((c.type = '" + RootComponentPredicate.RPM
            + "' AND c.arch = '" + RootComponentPredicate.SOURCE_ARCH + "')"
            + " OR c.type = '" + RootComponentPredicate.RPM_MODULE + "'"
            + " OR (c.type = '" + RootComponentPredicate.CONTAINER_IMAGE
            + "' AND c.arch = '" + RootComponentPredicate.NOARCH + "')"
            + " OR (c.type = '" + RootComponentPredicate.GITHUB + "' AND c.arch = '" + RootComponentPredicate.NOARCH
            + "' AND c.namespace = '" + ComponentNamespace.REDHAT.name() + "'))";

    private static final String SELECT = """
            SELECT c.uuid, c.namespace, c.name, c.type, c.arch, c.epoch, c.version, c.release
            FROM core_component c
            INNER JOIN %s m ON c.uuid = m.component_id
            INNER JOIN %s n ON m.%s = n.uuid
            WHERE n.ofuri = ?
            """;

    private static final RowMapper<ComponentCandidate> CANDIDATE_MAPPER = (rs, rowNum) -> {
        ComponentIdentity identity = ComponentIdentity.of(
                ComponentNamespace.valueOf(rs.getString("namespace")),
                rs.getString("name"),
                rs.getString("type"),
                rs.getString("arch"));
        return new ComponentCandidate(
                ComponentId.of(rs.getString("uuid")),
                identity,
                new EpochVersionRelease(rs.getInt("epoch"), rs.getString("version"), rs.getString("release")));
    };

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    /**
     * @param dataSource the catalog database
     * @param transactionManager manages the read-only snapshot transactions
     * @param queryTimeout statement timeout applied to every scan
     * @param isolationLevel one of the {@link TransactionDefinition} isolation constants
     */
    public JdbcCandidateAdapter(DataSource dataSource, PlatformTransactionManager transactionManager,
                                Duration queryTimeout, int isolationLevel) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(queryTimeoutSeconds(queryTimeout));
        this.jdbcTemplate.setFetchSize(100);

        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setReadOnly(true);
        this.transactionTemplate.setIsolationLevel(isolationLevel);
        this.transactionTemplate.setName(getClass().getSimpleName());
        log.info("JDBC candidate adapter using query timeout {} and isolation level {}", queryTimeout, isolationLevel);
    }

    /**
     * JDBC statement timeouts are whole seconds and 0 disables them, so any positive
     * timeout is rounded up to at least one second.
     */
    static int queryTimeoutSeconds(Duration queryTimeout) {
        if (queryTimeout.isNegative() || queryTimeout.isZero()) {
            return 0;
        }
        long seconds = queryTimeout.toSeconds() + (queryTimeout.toNanosPart() > 0 ? 1 : 0);
        return (int) Math.min(seconds, Integer.MAX_VALUE);
    }

    @Override
    public <R> R scanCandidates(CandidateQuery query, Function<Stream<ComponentCandidate>, R> reducer) {
        ComponentIdentity identity = query.identity();
        List<Object> args = new ArrayList<>();
        String sql = scopedSelect(query.scope(), query.includeInactiveStreams(), args)
                + " AND c.namespace = ? AND c.name = ? AND c.type = ? AND c.arch = ?";
        args.add(identity.namespace().name());
        args.add(identity.name());
        args.add(identity.type());
        args.add(identity.arch());
        return scan(sql, args, reducer, query);
    }

    @Override
    public <R> R scanRootComponents(TaxonomyScope scope, boolean includeInactiveStreams,
                                    Function<Stream<ComponentCandidate>, R> reducer) {
        List<Object> args = new ArrayList<>();
        String sql = scopedSelect(scope, includeInactiveStreams, args) + " AND " + ROOT_COMPONENTS_CONDITION;
        return scan(sql, args, reducer, scope);
    }

    private String scopedSelect(TaxonomyScope scope, boolean includeInactiveStreams, List<Object> args) {
        ScopeJoin join = ScopeJoin.forType(scope.type());
        StringBuilder sql = new StringBuilder(
                String.format(SELECT, join.membershipTable(), join.nodeTable(), join.nodeKey()));
        args.add(scope.ofuri());
        if (scope.type().isActiveFlagged() && !includeInactiveStreams) {
            sql.append(" AND n.active");
        }
        return sql.toString();
    }

    private <R> R scan(String sql, List<Object> args, Function<Stream<ComponentCandidate>, R> reducer, Object target) {
        log.debug("Scanning candidates for {}", target);
        try {
            return transactionTemplate.execute(status -> {
                try (Stream<ComponentCandidate> rows = jdbcTemplate.queryForStream(sql, CANDIDATE_MAPPER, args.toArray())) {
                    return reducer.apply(rows);
                }
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to scan candidates for {}", target, e);
            throw new CandidateAccessException("Failed to scan candidates for " + target, e);
        }
    }
}
