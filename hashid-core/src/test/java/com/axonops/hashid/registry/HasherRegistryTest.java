package com.axonops.hashid.registry;

import com.axonops.hashid.api.ConfigurationValidationException;
import com.axonops.hashid.api.Converter;
import com.axonops.hashid.api.HasherConfig;
import com.axonops.hashid.api.HasherNotFoundException;
import com.axonops.hashid.factory.HasherFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for named registration and lazy converter lookup.
 */
class HasherRegistryTest {

    private Map<String, String> environment;
    private HasherFactory factory;
    private HasherRegistry registry;

    @BeforeEach
    void setUp() {
        environment = new HashMap<>();
        factory = new HasherFactory("registry-salt", 8, HasherConfig.DEFAULT_ALPHABET);
        registry = new HasherRegistry(factory, name -> Optional.ofNullable(environment.get(name)));
    }

    @Test
    void testDefaultAlwaysRegistered() {
        assertThat(registry.hasHasher("default")).isTrue();
        assertThat(registry.getHasherNames()).containsExactly("default");
        assertThat(registry.getHasherConfiguration("default")).contains(factory.getDefaults());
        assertThat(registry.getState("default")).isEqualTo(HasherState.REGISTERED);
    }

    @Test
    void testDefaultConverter_UsesFactoryDefaults() {
        Converter converter = registry.getConverter();

        String hash = converter.encode(123);

        assertThat(hash).isEqualTo(factory.createConverter("default", null).encode(123));
        assertThat(converter.decode(hash)).isEqualTo(123L);
    }

    @Test
    void testNoArgConstructor() {
        HasherRegistry plain = new HasherRegistry();

        assertThat(plain.getHasherNames()).containsExactly("default");
        assertThat(plain.getConverter().decode(plain.getConverter().encode(5))).isEqualTo(5L);
    }

    @Test
    void testGetConverter_Memoized() {
        registry.registerHasher("api", Map.of("salt", "api-salt"));

        Converter first = registry.getConverter("api");
        Converter second = registry.getConverter("api");

        assertThat(second).isSameAs(first);
        assertThat(registry.getState("api")).isEqualTo(HasherState.MATERIALIZED);
    }

    @Test
    void testRegisterHasher_MissingFieldsFromFactoryDefaults() {
        registry.registerHasher("short", Map.of("min_length", 4));

        assertThat(registry.getHasherConfiguration("short"))
            .contains(new HasherConfig("registry-salt", 4, HasherConfig.DEFAULT_ALPHABET));
    }

    @Test
    void testReRegistration_InvalidatesConverter() {
        registry.registerHasher("api", Map.of("salt", "one"));
        Converter before = registry.getConverter("api");
        String hash = before.encode(10);

        registry.registerHasher("api", Map.of("salt", "two"));

        assertThat(registry.getState("api")).isEqualTo(HasherState.REGISTERED);
        Converter after = registry.getConverter("api");
        assertThat(after).isNotSameAs(before);
        assertThat(after.encode(10)).isNotEqualTo(hash);
        assertThat(after.decode(hash)).isEqualTo(hash);
    }

    @Test
    void testOverwriteDefault() {
        Converter before = registry.getConverter();

        registry.registerHasher("default", Map.of("salt", "replaced"));

        assertThat(registry.getConverter()).isNotSameAs(before);
        assertThat(registry.getHasherNames()).containsExactly("default");
    }

    @Test
    void testGetConverter_NotFound() {
        registry.registerHasher("api", Map.of());

        assertThatThrownBy(() -> registry.getConverter("missing"))
            .isInstanceOf(HasherNotFoundException.class)
            .hasMessageContaining("'missing'")
            .hasMessageContaining("api, default")
            .satisfies(e -> {
                HasherNotFoundException nf = (HasherNotFoundException) e;
                assertThat(nf.getHasherName()).isEqualTo("missing");
                assertThat(nf.getAvailableHashers()).containsExactly("api", "default");
            });

        assertThatThrownBy(() -> registry.getConverter(null))
            .isInstanceOf(HasherNotFoundException.class);
        assertThat(registry.getState("missing")).isEqualTo(HasherState.UNREGISTERED);
    }

    @Test
    void testHasHasher() {
        registry.registerHasher("api", Map.of());

        assertThat(registry.hasHasher("api")).isTrue();
        assertThat(registry.hasHasher("API")).isFalse();
        assertThat(registry.hasHasher(null)).isFalse();
    }

    @Test
    void testGetHasherNames_SortedAndImmutable() {
        registry.registerHasher("zeta", Map.of());
        registry.registerHasher("alpha", Map.of());

        assertThat(registry.getHasherNames()).containsExactly("alpha", "default", "zeta");
        assertThatThrownBy(() -> registry.getHasherNames().add("x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testRegisterHasher_InvalidConfigRejected() {
        assertThatThrownBy(() -> registry.registerHasher("bad", Map.of("alphabet", "abcdefgh")))
            .isInstanceOf(ConfigurationValidationException.class);
        assertThatThrownBy(() -> registry.registerHasher("bad", Map.of("min_length", -1)))
            .isInstanceOf(ConfigurationValidationException.class);

        assertThat(registry.hasHasher("bad")).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "has space", "semi;colon", "slash/name", "emoji☃"})
    void testRegisterHasher_InvalidNameRejected(String name) {
        assertThatThrownBy(() -> registry.registerHasher(name, Map.of()))
            .isInstanceOf(ConfigurationValidationException.class)
            .extracting("field").isEqualTo("hasher_name");
    }

    @Test
    void testRegisterHasher_NameLengthLimit() {
        registry.registerHasher("a".repeat(50), Map.of());

        assertThatThrownBy(() -> registry.registerHasher("a".repeat(51), Map.of()))
            .isInstanceOf(ConfigurationValidationException.class)
            .hasMessageContaining("too long");
        assertThatThrownBy(() -> registry.registerHasher(null, Map.of()))
            .isInstanceOf(ConfigurationValidationException.class);
    }

    @Test
    void testRegisterHasher_ValidNameCharacters() {
        registry.registerHasher("api_v2.public-ids", Map.of());

        assertThat(registry.hasHasher("api_v2.public-ids")).isTrue();
    }

    @Test
    void testRegisterHashers_AllOrNothing() {
        Map<String, Map<String, Object>> batch = new LinkedHashMap<>();
        batch.put("one", Map.of("salt", "1"));
        batch.put("two", Map.of("alphabet", "tooshort"));
        batch.put("three", Map.of("salt", "3"));

        assertThatThrownBy(() -> registry.registerHashers(batch))
            .isInstanceOf(ConfigurationValidationException.class);

        assertThat(registry.getHasherNames()).containsExactly("default");
    }

    @Test
    void testRegisterHashers_AllRegistered() {
        registry.registerHasher("one", Map.of("salt", "old"));
        Converter old = registry.getConverter("one");

        Map<String, Map<String, Object>> batch = new LinkedHashMap<>();
        batch.put("one", Map.of("salt", "1"));
        batch.put("two", Map.of("salt", "2", "min_hash_length", 20));

        registry.registerHashers(batch);

        assertThat(registry.getHasherNames()).containsExactly("default", "one", "two");
        assertThat(registry.getConverter("one")).isNotSameAs(old);
        assertThat(registry.getConverter("two").encode(1)).hasSizeGreaterThanOrEqualTo(20);
    }

    @Test
    void testEnvPlaceholder_ResolvedLazily() {
        registry.registerHasher("env", Map.of("salt", "%env(HASHID_SALT)%"));

        // Not needed at registration
        assertThat(registry.getHasherConfiguration("env").map(HasherConfig::salt)).contains("%env(HASHID_SALT)%");

        environment.put("HASHID_SALT", "from-env");
        Converter converter = registry.getConverter("env");

        Converter expected = factory.createConverter("default", Map.of("salt", "from-env"));
        assertThat(converter.encode(31)).isEqualTo(expected.encode(31));
    }

    @Test
    void testEnvPlaceholder_StringProcessor() {
        environment.put("APP_SALT", "typed");
        registry.registerHasher("typed", Map.of("salt", "%env(string:APP_SALT)%"));

        Converter expected = factory.createConverter("default", Map.of("salt", "typed"));
        assertThat(registry.getConverter("typed").encode(31)).isEqualTo(expected.encode(31));
    }

    @Test
    void testEnvPlaceholder_NonStringProcessorRejected() {
        assertThatThrownBy(() -> registry.registerHasher("n", Map.of("salt", "%env(int:APP_SALT)%")))
            .isInstanceOf(ConfigurationValidationException.class)
            .extracting("field").isEqualTo("salt");
    }

    @Test
    void testEnvPlaceholder_UnsetVariableFailsAtLookup() {
        registry.registerHasher("env", Map.of("salt", "%env(MISSING_SALT)%"));

        assertThatThrownBy(() -> registry.getConverter("env"))
            .isInstanceOf(ConfigurationValidationException.class)
            .hasMessageContaining("MISSING_SALT")
            .hasMessageContaining("'env'");
        assertThat(registry.getState("env")).isEqualTo(HasherState.REGISTERED);

        environment.put("MISSING_SALT", "now-set");
        assertThat(registry.getConverter("env")).isNotNull();
        assertThat(registry.getState("env")).isEqualTo(HasherState.MATERIALIZED);
    }

    @Test
    void testPlainSaltLookingLikePlaceholderPrefixIsLiteral() {
        registry.registerHasher("literal", Map.of("salt", "%env(X"));

        Converter expected = factory.createConverter("default", Map.of("salt", "%env(X"));
        assertThat(registry.getConverter("literal").encode(1)).isEqualTo(expected.encode(1));
    }

    @Test
    void testClearCaches_DemotesMaterialized() {
        registry.registerHasher("api", Map.of());
        Converter api = registry.getConverter("api");

        registry.clearCaches();

        assertThat(registry.getState("api")).isEqualTo(HasherState.REGISTERED);
        assertThat(registry.getState("default")).isEqualTo(HasherState.REGISTERED);
        assertThat(registry.getConverter("api")).isNotSameAs(api);
        assertThat(registry.getHasherNames()).containsExactly("api", "default");
    }

    @Test
    void testRegistryDoesNotTouchFactoryCache() {
        registry.registerHasher("api", Map.of());
        registry.getConverter("api");

        assertThat(factory.getCacheStatistics().totalRequests()).isZero();
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void testConcurrentFirstLookup_SingleConverter() throws InterruptedException {
        AtomicInteger lookups = new AtomicInteger();
        HasherRegistry counting = new HasherRegistry(factory, name -> {
            lookups.incrementAndGet();
            return Optional.of("resolved");
        });
        counting.registerHasher("hot", Map.of("salt", "%env(HOT_SALT)%"));

        int threadCount = 50;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);
        Set<Converter> instances = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    instances.add(counting.getConverter("hot"));
                } catch (Throwable e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);
        assertThat(instances).hasSize(1);
        assertThat(lookups.get()).isEqualTo(1);
    }
}
