package com.streamfirst.component.catalog.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeTypeTest {

    @Test
    void resolvesTaxonomyModelNames() {
        assertThat(ScopeType.fromModelName("Product")).isEqualTo(ScopeType.PRODUCT);
        assertThat(ScopeType.fromModelName("ProductVersion")).isEqualTo(ScopeType.PRODUCT_VERSION);
        assertThat(ScopeType.fromModelName("ProductStream")).isEqualTo(ScopeType.PRODUCT_STREAM);
        assertThat(ScopeType.fromModelName("ProductVariant")).isEqualTo(ScopeType.PRODUCT_VARIANT);
    }

    @Test
    void rejectsUnknownModelNames() {
        assertThatThrownBy(() -> ScopeType.fromModelName("Channel"))
                .isInstanceOf(UnsupportedScopeTypeException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported scope type: Channel");
        assertThatThrownBy(() -> ScopeType.fromModelName("productstream"))
                .isInstanceOf(UnsupportedScopeTypeException.class);
        assertThatThrownBy(() -> ScopeType.fromModelName(null))
                .isInstanceOf(UnsupportedScopeTypeException.class);
    }

    @Test
    void onlyProductStreamsAreActiveFlagged() {
        assertThat(ScopeType.PRODUCT_STREAM.isActiveFlagged()).isTrue();
        assertThat(ScopeType.PRODUCT.isActiveFlagged()).isFalse();
        assertThat(ScopeType.PRODUCT_VERSION.isActiveFlagged()).isFalse();
        assertThat(ScopeType.PRODUCT_VARIANT.isActiveFlagged()).isFalse();
    }
}
