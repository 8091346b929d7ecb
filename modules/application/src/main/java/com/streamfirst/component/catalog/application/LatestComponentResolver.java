package com.streamfirst.component.catalog.application;

import com.streamfirst.component.catalog.domain.ComponentCandidate;
import com.streamfirst.component.catalog.domain.ComponentId;
import com.streamfirst.component.catalog.domain.ComponentIdentity;
import com.streamfirst.component.catalog.domain.ComponentNamespace;
import com.streamfirst.component.catalog.domain.RootComponentPredicate;
import com.streamfirst.component.catalog.domain.ScopeType;
import com.streamfirst.component.catalog.domain.TaxonomyScope;
import com.streamfirst.component.catalog.domain.version.VersionComparator;
import com.streamfirst.component.catalog.ports.CandidatePort;
import com.streamfirst.component.catalog.ports.CandidateQuery;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Resolves the latest build of a component family within a node of the product taxonomy.
 *
 * <p>Candidates are folded in whatever order the catalog yields them: the running best
 * starts at the first root candidate and is replaced whenever the {@link TieBreakPolicy}
 * says so. The resolver keeps no state between calls and never writes to the catalog.
 * Absence of a build is reported as an empty result; catalog failures propagate unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class LatestComponentResolver {

    private static final Comparator<ComponentCandidate> CANDIDATE_ORDER = Comparator
            .comparing(ComponentCandidate::getIdentity, ComponentIdentity.ORDER)
            .thenComparing(ComponentCandidate::getEvr, VersionComparator.EVR_ORDER)
            .thenComparing(ComponentCandidate::getId);

    @NonNull private final CandidatePort candidatePort;
    @NonNull private final TieBreakPolicy tieBreakPolicy;

    public LatestComponentResolver(CandidatePort candidatePort) {
        this(candidatePort, TieBreakPolicy.LAST_VISITED);
    }

    /**
     * Resolves the latest build using the taxonomy model name of the scope.
     *
     * @param scopeType "Product", "ProductVersion", "ProductStream" or "ProductVariant"
     * @throws com.streamfirst.component.catalog.domain.UnsupportedScopeTypeException for any other name
     */
    public Optional<ComponentId> resolveLatest(String scopeType, String scopeOfuri, String componentType,
                                               ComponentNamespace namespace, String name, String arch,
                                               boolean includeInactiveStreams) {
        return resolveLatest(ScopeType.fromModelName(scopeType), scopeOfuri, componentType,
                namespace, name, arch, includeInactiveStreams);
    }

    /**
     * Resolves the latest build of the family (namespace, name, type, arch) visible in the
     * taxonomy node identified by {@code scopeOfuri}.
     *
     * @return the winning build, or empty if the family has no root build in the scope
     * @throws IllegalArgumentException if any identity or scope field is missing or empty
     */
    public Optional<ComponentId> resolveLatest(ScopeType scopeType, String scopeOfuri, String componentType,
                                               ComponentNamespace namespace, String name, String arch,
                                               boolean includeInactiveStreams) {
        return resolveLatest(new CandidateQuery(
                TaxonomyScope.of(scopeType, scopeOfuri),
                ComponentIdentity.of(namespace, name, componentType, arch),
                includeInactiveStreams));
    }

    public Optional<ComponentId> resolveLatest(CandidateQuery query) {
        if (!RootComponentPredicate.test(query.identity())) {
            log.debug("{} is not a root component, no latest build to resolve", query.identity());
            return Optional.empty();
        }

        Optional<ComponentCandidate> latest = candidatePort.scanCandidates(query,
                candidates -> fold(query.identity(), candidates));

        if (latest.isPresent()) {
            log.debug("Latest build for {} is {}", query, latest.get());
        } else {
            log.debug("No build found for {}", query);
        }
        return latest.map(ComponentCandidate::getId);
    }

    /**
     * Resolves the latest build of one family separately in each of several nodes of the
     * same taxonomy level.
     *
     * @return winning build per scope ofuri; scopes without a build are left out
     */
    public Map<String, ComponentId> resolveLatestPerScope(ScopeType scopeType, Set<String> scopeOfuris,
                                                          ComponentIdentity identity,
                                                          boolean includeInactiveStreams) {
        Map<String, ComponentId> result = new TreeMap<>();
        for (String ofuri : scopeOfuris) {
            CandidateQuery query = new CandidateQuery(TaxonomyScope.of(scopeType, ofuri), identity, includeInactiveStreams);
            resolveLatest(query).ifPresent(id -> result.put(ofuri, id));
        }
        log.debug("Resolved {} of {} {} scopes for {}", result.size(), scopeOfuris.size(),
                scopeType.modelName(), identity);
        return result;
    }

    /**
     * Returns the latest build of every root component family visible in the scope,
     * ordered by family.
     */
    public List<ComponentId> latestComponents(TaxonomyScope scope, boolean includeInactiveStreams) {
        Map<ComponentIdentity, ComponentCandidate> latest = candidatePort.scanRootComponents(
                scope, includeInactiveStreams, this::foldByIdentity);
        log.debug("Found {} latest root components in {}", latest.size(), scope);
        return latest.values().stream().map(ComponentCandidate::getId).toList();
    }

    /**
     * Returns every root build visible in the scope that is not the latest of its family,
     * ordered by family and then by ascending epoch/version/release.
     */
    public List<ComponentId> nonLatestComponents(TaxonomyScope scope, boolean includeInactiveStreams) {
        List<ComponentCandidate> older = candidatePort.scanRootComponents(scope, includeInactiveStreams, candidates -> {
            List<ComponentCandidate> all = candidates.toList();
            Map<ComponentIdentity, ComponentCandidate> latest = foldByIdentity(all.stream());
            List<ComponentCandidate> rest = new ArrayList<>();
            for (ComponentCandidate candidate : all) {
                if (RootComponentPredicate.test(candidate)
                        && !candidate.getId().equals(latest.get(candidate.getIdentity()).getId())) {
                    rest.add(candidate);
                }
            }
            return rest;
        });
        log.debug("Found {} non-latest root components in {}", older.size(), scope);
        return older.stream().sorted(CANDIDATE_ORDER).map(ComponentCandidate::getId).toList();
    }

    private Optional<ComponentCandidate> fold(ComponentIdentity identity, Stream<ComponentCandidate> candidates) {
        ComponentCandidate best = null;
        Iterator<ComponentCandidate> iterator = candidates.iterator();
        while (iterator.hasNext()) {
            ComponentCandidate candidate = iterator.next();
            if (!candidate.getIdentity().equals(identity)) {
                log.warn("Ignoring candidate {} yielded for a different family {}", candidate, identity);
                continue;
            }
            if (best == null || tieBreakPolicy.replaces(candidate, best)) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private Map<ComponentIdentity, ComponentCandidate> foldByIdentity(Stream<ComponentCandidate> candidates) {
        Map<ComponentIdentity, ComponentCandidate> latest = new TreeMap<>(ComponentIdentity.ORDER);
        Iterator<ComponentCandidate> iterator = candidates.iterator();
        while (iterator.hasNext()) {
            ComponentCandidate candidate = iterator.next();
            if (!RootComponentPredicate.test(candidate)) {
                continue;
            }
            latest.merge(candidate.getIdentity(), candidate,
                    (best, next) -> tieBreakPolicy.replaces(next, best) ? next : best);
        }
        return latest;
    }
}
