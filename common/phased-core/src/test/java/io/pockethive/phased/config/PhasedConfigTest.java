package io.pockethive.phased.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class PhasedConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        PhasedConfig config = PhasedConfig.defaults();

        assertThat(config.keepContext()).isFalse();
        assertThat(config.refetchNames()).containsExactly(PhasedConfig.DEFAULT_CSRF_TOKEN_NAME);
        assertThat(config.maxDepth()).isEqualTo(16);
        assertThat(config.cacheKeyPrefix()).isEqualTo("phased.cache");
        assertThat(config.delimiter()).matches("<!--phased:[0-9a-f]{32}-->");
    }

    @Test
    void delimiterDerivedFromSecretIsStable() {
        PhasedConfig first = PhasedConfig.builder().secret("s3cr3t").build();
        PhasedConfig second = PhasedConfig.builder().secret("s3cr3t").build();

        assertThat(first.delimiter()).isEqualTo(second.delimiter());
        assertThat(first.delimiter()).isNotEqualTo(PhasedConfig.builder().secret("other").build().delimiter());
    }

    @Test
    void explicitDelimiterWinsOverSecret() {
        PhasedConfig config = PhasedConfig.builder().delimiter("<<d>>").secret("s3cr3t").build();

        assertThat(config.delimiter()).isEqualTo("<<d>>");
    }

    @Test
    void rejectsDelimitersThatCouldAppearInSnapshots() {
        assertThatThrownBy(() -> PhasedConfig.builder().delimiter("ctx_marker").build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PhasedConfig.builder().delimiter("").build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonPositiveDepth() {
        assertThatThrownBy(() -> PhasedConfig.builder().maxDepth(0).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalisesBlankPrefixAndNullRefetchList() {
        PhasedConfig config = PhasedConfig.builder().cacheKeyPrefix("  ").refetchNames(null).build();

        assertThat(config.cacheKeyPrefix()).isEqualTo(PhasedConfig.DEFAULT_CACHE_KEY_PREFIX);
        assertThat(config.refetchNames()).isEqualTo(List.of());
    }
}
