package com.axonops.hashid.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the closed set of hasher types.
 */
class HasherTypeTest {

    @Test
    void testFromName_ExactNames() {
        assertThat(HasherType.fromName("default")).isEqualTo(HasherType.DEFAULT);
        assertThat(HasherType.fromName("secure")).isEqualTo(HasherType.SECURE);
        assertThat(HasherType.fromName("custom")).isEqualTo(HasherType.CUSTOM);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
        "DEFAULT", "Secure", " default", "default ", "unknown",
        "../../../etc/passwd", "default; rm -rf /", "$(whoami)", "`id`",
        "' OR '1'='1", "%s%s%s%n", "${jndi:ldap://x}", "default\u0000", "secure\n"
    })
    void testFromName_RejectsEverythingElse(String name) {
        assertThatThrownBy(() -> HasherType.fromName(name))
            .isInstanceOf(UnknownHasherTypeException.class)
            .hasMessage("HashId: Unknown hasher type. Available types: default, secure, custom");
    }

    @Test
    void testUnknownTypeMessage_DoesNotEchoInput() {
        String payload = "<script>alert(1)</script>";

        assertThatThrownBy(() -> HasherType.fromName(payload))
            .isInstanceOf(HashIdException.class)
            .satisfies(e -> assertThat(e.getMessage()).doesNotContain(payload).doesNotContain("script"));
    }

    @Test
    void testNames_StableOrderAndImmutable() {
        assertThat(HasherType.names()).containsExactly("default", "secure", "custom");
        assertThatThrownBy(() -> HasherType.names().add("other"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testTypeDefaults() {
        assertThat(HasherType.DEFAULT.defaultMinLength()).isEmpty();
        assertThat(HasherType.DEFAULT.defaultAlphabet()).isEmpty();

        assertThat(HasherType.SECURE.defaultMinLength()).hasValue(20);
        assertThat(HasherType.SECURE.defaultAlphabet()).contains(HasherConfig.SECURE_ALPHABET);

        assertThat(HasherType.CUSTOM.defaultMinLength()).hasValue(15);
        assertThat(HasherType.CUSTOM.defaultAlphabet()).isEmpty();
    }

    @Test
    void testToString_IsTypeName() {
        assertThat(HasherType.SECURE.toString()).isEqualTo("secure");
    }
}
