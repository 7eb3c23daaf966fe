package org.javai.casebook.rules;

import org.javai.casebook.Fault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class RuleRegistryTest {

    private static final Fault DISK = Fault.of("storage", "disk", "disk failure");
    private static final Fault NETWORK = Fault.of("net", "down", "network down");
    private static final Fault UPSTREAM = Fault.of("app", "upstream", "upstream unavailable");

    private RuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RuleRegistry();
    }

    @Test
    void registerExact_usesIdentity() {
        registry.registerExact(DISK);

        assertThat(registry.isExact(DISK)).isTrue();
        assertThat(registry.isExact(Fault.of("storage", "disk", "disk failure"))).isFalse();
    }

    @Test
    void registerMapping_lastWriteWins() {
        registry.registerMapping(NETWORK, DISK);
        registry.registerMapping(NETWORK, UPSTREAM);

        assertThat(registry.mappingFor(NETWORK)).containsSame(UPSTREAM);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void registerPattern_defaultsToPrefix() {
        registry.registerPattern("disk:", DISK);

        assertThat(registry.matchPattern("disk: no space")).containsSame(DISK);
        assertThat(registry.matchPattern("the disk: no space")).isEmpty();
    }

    @Test
    void registerPattern_withRegexSyntax_searchesMessage() {
        RuleRegistry regexRegistry = new RuleRegistry(PatternSyntax.REGEX);
        regexRegistry.registerPattern("timed? ?out", NETWORK);

        assertThat(regexRegistry.matchPattern("connect timeout after 3s")).containsSame(NETWORK);
        assertThat(regexRegistry.matchPattern("refused")).isEmpty();
    }

    @Test
    void registerRegex_invalidExpression_isRejected() {
        assertThatThrownBy(() -> registry.registerRegex("(unclosed", DISK))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("(unclosed");
    }

    @Test
    void overlappingPatterns_firstRegisteredWins() {
        registry.registerPrefix("disk", UPSTREAM);
        registry.registerPrefix("disk:", DISK);

        assertThat(registry.matchPattern("disk: no space")).containsSame(UPSTREAM);
    }

    @Test
    void reRegisteredPattern_keepsItsPosition() {
        registry.registerPrefix("disk", UPSTREAM);
        registry.registerPrefix("disk:", DISK);
        registry.registerPrefix("disk", NETWORK);

        assertThat(registry.matchPattern("disk: no space")).containsSame(NETWORK);
    }

    @Test
    void fallback_canBeSetAndCleared() {
        assertThat(registry.fallback()).isEmpty();

        registry.setFallback(UPSTREAM);
        assertThat(registry.fallback()).containsSame(UPSTREAM);

        registry.clearFallback();
        assertThat(registry.fallback()).isEmpty();
    }

    @Test
    void nullArguments_areRejected() {
        assertThatThrownBy(() -> registry.registerExact(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.registerMapping(DISK, null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.registerPattern(null, DISK)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.setFallback(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void concurrentRegistrationAndLookup_doNotInterfere() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int writer = 0; writer < 2; writer++) {
                int offset = writer * 500;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        registry.registerPrefix("p" + (offset + i) + ":", DISK);
                    }
                    return null;
                }));
            }
            for (int reader = 0; reader < 2; reader++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        registry.matchPattern("p" + i + ": message");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(registry.size()).isEqualTo(1000);
        assertThat(registry.matchPattern("p999: late")).containsSame(DISK);
    }
}
