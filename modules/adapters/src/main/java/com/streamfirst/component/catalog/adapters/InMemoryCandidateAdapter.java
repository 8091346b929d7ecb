package com.streamfirst.component.catalog.adapters;

import com.streamfirst.component.catalog.domain.ComponentCandidate;
import com.streamfirst.component.catalog.domain.ComponentId;
import com.streamfirst.component.catalog.domain.RootComponentPredicate;
import com.streamfirst.component.catalog.domain.ScopeType;
import com.streamfirst.component.catalog.domain.TaxonomyScope;
import com.streamfirst.component.catalog.ports.CandidatePort;
import com.streamfirst.component.catalog.ports.CandidateQuery;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * In-memory implementation of CandidatePort for testing and development.
 * Keeps component builds, their taxonomy memberships and the product stream activity
 * flags in maps guarded by a read/write lock, so every scan sees one consistent snapshot.
 * Candidates are yielded in registration order.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryCandidateAdapter implements CandidatePort {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Builds by id, in registration order
    private final Map<ComponentId, ComponentCandidate> components = new LinkedHashMap<>();

    // Taxonomy node -> member builds
    private final Map<TaxonomyScope, Set<ComponentId>> memberships = new HashMap<>();

    // Product stream ofuris flagged inactive; unknown streams are active
    private final Set<String> inactiveStreams = new HashSet<>();

    /**
     * Adds a build to the catalog, or replaces the build with the same id.
     */
    public void registerComponent(ComponentCandidate candidate) {
        lock.writeLock().lock();
        try {
            ComponentCandidate previous = components.put(candidate.getId(), candidate);
            if (previous != null) {
                log.info("Replaced component {}: {} -> {}", candidate.getId(), previous.getEvr(), candidate.getEvr());
            } else {
                log.debug("Registered component {}", candidate);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Adds a build to the catalog and links it to the given taxonomy nodes.
     */
    public void registerComponent(ComponentCandidate candidate, TaxonomyScope... scopes) {
        lock.writeLock().lock();
        try {
            registerComponent(candidate);
            for (TaxonomyScope scope : scopes) {
                addToScope(candidate.getId(), scope);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Links an already registered build to a taxonomy node.
     *
     * @throws IllegalArgumentException if the build is unknown
     */
    public void addToScope(ComponentId id, TaxonomyScope scope) {
        lock.writeLock().lock();
        try {
            if (!components.containsKey(id)) {
                throw new IllegalArgumentException("Component " + id + " is not registered");
            }
            memberships.computeIfAbsent(scope, k -> new LinkedHashSet<>()).add(id);
            log.debug("Linked component {} to {}", id, scope);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a build and all of its taxonomy links.
     *
     * @return true if the build was registered
     */
    public boolean removeComponent(ComponentId id) {
        lock.writeLock().lock();
        try {
            ComponentCandidate removed = components.remove(id);
            if (removed == null) {
                log.warn("Component {} not found, nothing removed", id);
                return false;
            }
            memberships.values().forEach(members -> members.remove(id));
            memberships.values().removeIf(Set::isEmpty);
            log.info("Removed component {}", removed);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Updates the activity flag of a product stream.
     * Inactive streams are hidden from stream-scoped scans unless the caller opts in.
     */
    public void updateStreamStatus(String streamOfuri, boolean active) {
        lock.writeLock().lock();
        try {
            if (active) {
                inactiveStreams.remove(streamOfuri);
            } else {
                inactiveStreams.add(streamOfuri);
            }
            log.info("Updated product stream {} status to {}", streamOfuri, active ? "active" : "inactive");
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isStreamActive(String streamOfuri) {
        lock.readLock().lock();
        try {
            return !inactiveStreams.contains(streamOfuri);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <R> R scanCandidates(CandidateQuery query, Function<Stream<ComponentCandidate>, R> reducer) {
        List<ComponentCandidate> snapshot = snapshot(query.scope(), query.includeInactiveStreams(),
                candidate -> candidate.getIdentity().equals(query.identity()));
        log.debug("Scanning {} candidates for {}", snapshot.size(), query);
        return reducer.apply(snapshot.stream());
    }

    @Override
    public <R> R scanRootComponents(TaxonomyScope scope, boolean includeInactiveStreams,
                                    Function<Stream<ComponentCandidate>, R> reducer) {
        List<ComponentCandidate> snapshot = snapshot(scope, includeInactiveStreams, RootComponentPredicate::test);
        log.debug("Scanning {} root components in {}", snapshot.size(), scope);
        return reducer.apply(snapshot.stream());
    }

    private List<ComponentCandidate> snapshot(TaxonomyScope scope, boolean includeInactiveStreams,
                                              Predicate<ComponentCandidate> filter) {
        lock.readLock().lock();
        try {
            if (scope.type() == ScopeType.PRODUCT_STREAM && !includeInactiveStreams
                    && inactiveStreams.contains(scope.ofuri())) {
                log.debug("Product stream {} is inactive, skipping", scope.ofuri());
                return List.of();
            }
            Set<ComponentId> members = memberships.getOrDefault(scope, Set.of());
            List<ComponentCandidate> result = new ArrayList<>();
            for (ComponentCandidate candidate : components.values()) {
                if (members.contains(candidate.getId()) && filter.test(candidate)) {
                    result.add(candidate);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Clears all catalog data. Useful for testing.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            log.info("Clearing all catalog data");
            components.clear();
            memberships.clear();
            inactiveStreams.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Gets catalog statistics for monitoring.
     */
    public Map<String, Integer> getCatalogStats() {
        lock.readLock().lock();
        try {
            Map<String, Integer> stats = new HashMap<>();
            stats.put("components", components.size());
            stats.put("root_components", (int) components.values().stream().filter(RootComponentPredicate::test).count());
            stats.put("scopes", memberships.size());
            stats.put("memberships", memberships.values().stream().mapToInt(Set::size).sum());
            stats.put("inactive_streams", inactiveStreams.size());
            return stats;
        } finally {
            lock.readLock().unlock();
        }
    }
}
