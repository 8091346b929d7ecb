package com.streamfirst.component.catalog.ports;

import com.streamfirst.component.catalog.domain.ComponentCandidate;
import com.streamfirst.component.catalog.domain.TaxonomyScope;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Port for read-only access to the component catalog.
 * Yields the builds visible in a taxonomy node without any ordering guarantee.
 *
 * <p>Scans hand a lazy stream to a reducer instead of returning it, so implementations
 * backed by a live datastore can keep every row of one scan inside one snapshot. The
 * stream must not escape the reducer.
 */
public interface CandidatePort {

    /**
     * Streams every build of the queried family visible in the queried scope.
     * Implementations may apply the root component predicate; callers must not rely on it.
     *
     * @param query the family, scope and stream-activity filter
     * @param reducer consumes the candidates and produces the scan result
     * @return whatever the reducer returned
     * @throws CandidateAccessException if the catalog cannot be read
     */
    <R> R scanCandidates(CandidateQuery query, Function<Stream<ComponentCandidate>, R> reducer);

    /**
     * Streams every root component build visible in a scope, across all families.
     *
     * @param scope the taxonomy node
     * @param includeInactiveStreams whether inactive product streams count as visible
     * @param reducer consumes the candidates and produces the scan result
     * @return whatever the reducer returned
     * @throws CandidateAccessException if the catalog cannot be read
     */
    <R> R scanRootComponents(TaxonomyScope scope, boolean includeInactiveStreams,
                             Function<Stream<ComponentCandidate>, R> reducer);

    /**
     * Materializes the candidates of a query. Convenient for small result sets and tests.
     */
    default List<ComponentCandidate> fetchCandidates(CandidateQuery query) {
        return scanCandidates(query, Stream::toList);
    }
}
