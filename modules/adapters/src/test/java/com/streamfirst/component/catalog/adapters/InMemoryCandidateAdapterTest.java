package com.streamfirst.component.catalog.adapters;

import com.streamfirst.component.catalog.domain.ComponentCandidate;
import com.streamfirst.component.catalog.domain.ComponentId;
import com.streamfirst.component.catalog.domain.ComponentIdentity;
import com.streamfirst.component.catalog.domain.ComponentNamespace;
import com.streamfirst.component.catalog.domain.TaxonomyScope;
import com.streamfirst.component.catalog.ports.CandidateQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCandidateAdapterTest {

    private static final ComponentIdentity CURL = ComponentIdentity.of(ComponentNamespace.REDHAT, "curl", "RPM", "src");
    private static final ComponentIdentity CURL_BINARY =
            ComponentIdentity.of(ComponentNamespace.REDHAT, "curl", "RPM", "x86_64");

    private static final TaxonomyScope RHEL_8_6 = TaxonomyScope.productStream("o:redhat:rhel:8.6.0.z");
    private static final TaxonomyScope RHEL_8_8 = TaxonomyScope.productStream("o:redhat:rhel:8.8.0.z");
    private static final TaxonomyScope RHEL = TaxonomyScope.product("o:redhat:rhel");

    private InMemoryCandidateAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new InMemoryCandidateAdapter();
        adapter.registerComponent(ComponentCandidate.of("curl-22", CURL, 0, "7.61.1", "22.el8"), RHEL_8_6, RHEL);
        adapter.registerComponent(ComponentCandidate.of("curl-30", CURL, 0, "7.61.1", "30.el8"), RHEL_8_8, RHEL);
        adapter.registerComponent(ComponentCandidate.of("curl-bin", CURL_BINARY, 0, "7.61.1", "30.el8"), RHEL_8_8, RHEL);
    }

    @Test
    void yieldsOnlyMembersOfTheScope() {
        assertThat(ids(adapter.fetchCandidates(new CandidateQuery(RHEL_8_6, CURL, false)))).containsExactly("curl-22");
        assertThat(ids(adapter.fetchCandidates(new CandidateQuery(RHEL, CURL, false)))).containsExactly("curl-22", "curl-30");
        assertThat(adapter.fetchCandidates(new CandidateQuery(TaxonomyScope.productStream("o:redhat:rhel:9.2.0.z"), CURL, false)))
                .isEmpty();
    }

    @Test
    void yieldsOnlyTheQueriedFamily() {
        assertThat(ids(adapter.fetchCandidates(new CandidateQuery(RHEL_8_8, CURL_BINARY, false)))).containsExactly("curl-bin");
    }

    @Test
    void hidesInactiveStreamsUnlessRequested() {
        adapter.updateStreamStatus(RHEL_8_6.ofuri(), false);

        assertThat(adapter.isStreamActive(RHEL_8_6.ofuri())).isFalse();
        assertThat(adapter.fetchCandidates(new CandidateQuery(RHEL_8_6, CURL, false))).isEmpty();
        assertThat(ids(adapter.fetchCandidates(new CandidateQuery(RHEL_8_6, CURL, true)))).containsExactly("curl-22");
        // the flag only concerns product streams
        assertThat(ids(adapter.fetchCandidates(new CandidateQuery(RHEL, CURL, false)))).containsExactly("curl-22", "curl-30");

        adapter.updateStreamStatus(RHEL_8_6.ofuri(), true);
        assertThat(ids(adapter.fetchCandidates(new CandidateQuery(RHEL_8_6, CURL, false)))).containsExactly("curl-22");
    }

    @Test
    void rootScanSkipsNonRootComponents() {
        List<String> roots = adapter.scanRootComponents(RHEL, false, InMemoryCandidateAdapterTest::idStream);

        assertThat(roots).containsExactly("curl-22", "curl-30");
    }

    @Test
    void removesComponentsAndTheirMemberships() {
        assertThat(adapter.removeComponent(ComponentId.of("curl-30"))).isTrue();
        assertThat(adapter.removeComponent(ComponentId.of("curl-30"))).isFalse();

        assertThat(ids(adapter.fetchCandidates(new CandidateQuery(RHEL, CURL, false)))).containsExactly("curl-22");
        assertThat(adapter.fetchCandidates(new CandidateQuery(RHEL_8_8, CURL, false))).isEmpty();
    }

    @Test
    void replacesComponentWithSameId() {
        adapter.registerComponent(ComponentCandidate.of("curl-22", CURL, 0, "7.61.1", "23.el8"));

        List<ComponentCandidate> candidates = adapter.fetchCandidates(new CandidateQuery(RHEL_8_6, CURL, false));
        assertThat(candidates).singleElement()
                .satisfies(candidate -> assertThat(candidate.getEvr().release()).isEqualTo("23.el8"));
    }

    @Test
    void rejectsMembershipOfUnknownComponent() {
        assertThatThrownBy(() -> adapter.addToScope(ComponentId.of("missing"), RHEL))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void reportsCatalogStats() {
        adapter.updateStreamStatus(RHEL_8_6.ofuri(), false);

        assertThat(adapter.getCatalogStats())
                .containsEntry("components", 3)
                .containsEntry("root_components", 2)
                .containsEntry("scopes", 3)
                .containsEntry("memberships", 6)
                .containsEntry("inactive_streams", 1);

        adapter.clear();
        assertThat(adapter.getCatalogStats()).containsEntry("components", 0).containsEntry("memberships", 0);
    }

    private static List<String> ids(List<ComponentCandidate> candidates) {
        return idStream(candidates.stream());
    }

    private static List<String> idStream(Stream<ComponentCandidate> candidates) {
        return candidates.map(candidate -> candidate.getId().value()).toList();
    }
}
