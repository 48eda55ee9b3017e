package com.axonops.hashid.registry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EnvPlaceholderTest {

    @Test
    void testPlainVariable() {
        EnvPlaceholder placeholder = EnvPlaceholder.parse("%env(HASHID_SALT)%").orElseThrow();

        assertThat(placeholder.variable()).isEqualTo("HASHID_SALT");
        assertThat(placeholder.processor()).isNull();
        assertThat(placeholder.isStringValued()).isTrue();
    }

    @Test
    void testProcessor() {
        EnvPlaceholder typed = EnvPlaceholder.parse("%env(string:SALT)%").orElseThrow();
        EnvPlaceholder numeric = EnvPlaceholder.parse("%env(int:SALT)%").orElseThrow();

        assertThat(typed.variable()).isEqualTo("SALT");
        assertThat(typed.isStringValued()).isTrue();
        assertThat(numeric.isStringValued()).isFalse();
    }

    @Test
    void testNotPlaceholders() {
        assertThat(EnvPlaceholder.parse(null)).isEmpty();
        assertThat(EnvPlaceholder.parse("")).isEmpty();
        assertThat(EnvPlaceholder.parse("plain-salt")).isEmpty();
        assertThat(EnvPlaceholder.parse("%env()%")).isEmpty();
        assertThat(EnvPlaceholder.parse("prefix %env(SALT)%")).isEmpty();
        assertThat(EnvPlaceholder.parse("%env(SALT)% suffix")).isEmpty();
    }
}
