package com.axonops.hashid.cache;

import com.axonops.hashid.api.HasherConfig;
import com.axonops.hashid.api.HasherType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for canonical cache keys.
 */
class CacheKeyTest {

    private static final HasherConfig CONFIG = new HasherConfig("salt", 10, HasherConfig.DEFAULT_ALPHABET);

    @Test
    void testEqualConfigs_EqualKeys() {
        CacheKey a = CacheKey.of(HasherType.DEFAULT, CONFIG);
        CacheKey b = CacheKey.of(HasherType.DEFAULT, new HasherConfig("salt", 10, HasherConfig.DEFAULT_ALPHABET));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.value()).isEqualTo(b.value());
    }

    @Test
    void testTypeIsPartOfKey() {
        assertThat(CacheKey.of(HasherType.DEFAULT, CONFIG))
            .isNotEqualTo(CacheKey.of(HasherType.CUSTOM, CONFIG));
    }

    @Test
    void testEveryFieldIsPartOfKey() {
        CacheKey base = CacheKey.of(HasherType.DEFAULT, CONFIG);

        assertThat(CacheKey.of(HasherType.DEFAULT, CONFIG.withSalt("other"))).isNotEqualTo(base);
        assertThat(CacheKey.of(HasherType.DEFAULT, new HasherConfig("salt", 11, HasherConfig.DEFAULT_ALPHABET)))
            .isNotEqualTo(base);
        assertThat(CacheKey.of(HasherType.DEFAULT, new HasherConfig("salt", 10, HasherConfig.SECURE_ALPHABET)))
            .isNotEqualTo(base);
    }

    @Test
    void testCanonicalForm_SortedAndLengthPrefixed() {
        assertThat(CacheKey.canonicalForm(CONFIG))
            .isEqualTo("alphabet=62:" + HasherConfig.DEFAULT_ALPHABET + ";min_length=2:10;salt=4:salt;");
    }

    @Test
    void testCanonicalForm_NoDelimiterAmbiguity() {
        // Salt that mimics a following field must not collide with a different config
        HasherConfig tricky = new HasherConfig("a;salt=1:b", 10, HasherConfig.DEFAULT_ALPHABET);
        HasherConfig plain = new HasherConfig("a", 10, HasherConfig.DEFAULT_ALPHABET);

        assertThat(CacheKey.of(HasherType.DEFAULT, tricky)).isNotEqualTo(CacheKey.of(HasherType.DEFAULT, plain));
    }

    @Test
    void testValueAndToString_DoNotExposeSalt() {
        CacheKey key = CacheKey.of(HasherType.SECURE, CONFIG.withSalt("very-secret"));

        assertThat(key.value()).startsWith("secure:").hasSize("secure:".length() + 64);
        assertThat(key.value()).doesNotContain("very-secret");
        assertThat(key.toString()).isEqualTo("secure:" + key.digest().substring(0, 8));
    }
}
