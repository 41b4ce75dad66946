package com.security.anomaly.engine.detectors;

import com.security.anomaly.config.AnomalyDetectionConfig;
import com.security.anomaly.model.AccessEvent;
import com.security.anomaly.model.AnomalyEvent;
import com.security.anomaly.model.AnomalySeverity;
import com.security.anomaly.model.AnomalyType;
import com.security.anomaly.model.ResponseAction;
import com.security.anomaly.repository.DetectorModelRepository;
import com.security.anomaly.testutil.MutableClock;
import com.security.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

import static com.security.anomaly.testutil.TestDataFactory.accessEvent;
import static com.security.anomaly.testutil.TestDataFactory.failedLogin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthenticationFailureDetectorTest {

    private static final String TS = "2026-03-14T12:00:00Z";

    private MutableClock clock;
    private AuthenticationFailureDetector detector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestDataFactory.NOW);
        detector = new AuthenticationFailureDetector(new AnomalyDetectionConfig(), new DetectorModelRepository(), clock);
    }

    private Optional<AnomalyEvent> fail(String userId, String ip) {
        return detector.detect(failedLogin(userId, ip, TS));
    }

    @Test
    void baseline_isEstablishedWithoutTraining() {
        assertThat(detector.isBaselineEstablished()).isTrue();
        assertThat(detector.train(List.of())).isTrue();
    }

    @Test
    void detect_bruteForceOnOneAccount_returnsMediumAtThreshold() {
        for (int i = 0; i < 4; i++) {
            assertThat(fail("alice", "10.0.0.9")).isEmpty();
        }

        Optional<AnomalyEvent> result = fail("alice", "10.0.0.9");

        assertThat(result).isPresent();
        AnomalyEvent anomaly = result.get();
        assertThat(anomaly.getAnomalyType()).isEqualTo(AnomalyType.AUTHENTICATION_FAILURE);
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(anomaly.getDetails())
                .containsEntry("windowSeconds", 300L)
                .containsEntry("failureCount", 5)
                .containsEntry("threshold", 5)
                .containsEntry("uniqueIps", 1)
                .containsEntry("distributed", false)
                .containsEntry("endpointFailureCount", 5)
                .containsEntry("detectionMethod", "user_auth_failures");
        assertThat(anomaly.getResponseActions()).containsExactly(
                ResponseAction.LOG_ONLY, ResponseAction.NOTIFY_ADMIN, ResponseAction.REQUIRE_MFA);
    }

    @Test
    void detect_passwordSpray_escalatesIpAnomaly() {
        Optional<AnomalyEvent> result = Optional.empty();
        for (int round = 0; round < 2; round++) {
            for (String user : List.of("u1", "u2", "u3")) {
                result = fail(user, "10.0.0.66");
            }
        }

        assertThat(result).isPresent();
        AnomalyEvent anomaly = result.get();
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(anomaly.getDetails())
                .containsEntry("failureCount", 6)
                .containsEntry("uniqueUsers", 3)
                .containsEntry("passwordSpray", true)
                .containsEntry("detectionMethod", "ip_auth_failures");
        assertThat(anomaly.getResponseActions()).containsExactly(ResponseAction.LOG_ONLY,
                ResponseAction.NOTIFY_ADMIN, ResponseAction.RATE_LIMIT, ResponseAction.REQUIRE_MFA);
    }

    @Test
    void detect_distributedAttackOnOneAccount_escalatesUserAnomaly() {
        Optional<AnomalyEvent> result = Optional.empty();
        for (int i = 0; i < 5; i++) {
            result = fail("alice", "203.0.113." + i);
        }

        assertThat(result).isPresent();
        assertThat(result.get().getSeverity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(result.get().getDetails())
                .containsEntry("uniqueIps", 5)
                .containsEntry("distributed", true);
        assertThat(result.get().getResponseActions()).contains(ResponseAction.LOCK_ACCOUNT);
    }

    @Test
    void detect_overwhelmingFailures_returnsCriticalWithIpBlock() {
        Optional<AnomalyEvent> result = Optional.empty();
        for (int i = 0; i < 16; i++) {
            result = fail("alice", "10.0.0.9");
        }

        assertThat(result).isPresent();
        assertThat(result.get().getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(result.get().getResponseActions()).containsExactly(ResponseAction.LOG_ONLY,
                ResponseAction.NOTIFY_ADMIN, ResponseAction.REQUIRE_MFA, ResponseAction.LOCK_ACCOUNT,
                ResponseAction.BLOCK_IP);
    }

    @Test
    void detect_concurrentFailuresForOneUser_areAllCounted() throws Exception {
        runConcurrently(40, i -> fail("alice", "203.0.113." + i));

        Optional<AnomalyEvent> result = fail("alice", "198.51.100.1");

        assertThat(result).isPresent();
        assertThat(result.get().getDetails())
                .containsEntry("windowSeconds", 300L)
                .containsEntry("failureCount", 41)
                .containsEntry("uniqueIps", 41)
                .containsEntry("endpointFailureCount", 41)
                .containsEntry("detectionMethod", "user_auth_failures");
    }

    @Test
    void detect_failuresOutsideWindow_doNotCount() {
        for (int i = 0; i < 4; i++) {
            fail("alice", "10.0.0.9");
        }
        clock.advance(Duration.ofSeconds(301));

        assertThat(fail("alice", "10.0.0.9")).isEmpty();
    }

    @Test
    void detect_successfulOrNonAuthEvents_areIgnored() {
        for (int i = 0; i < 10; i++) {
            AccessEvent success = failedLogin("alice", "10.0.0.9", TS);
            success.setAuthenticationSuccess(true);
            assertThat(detector.detect(success)).isEmpty();
            assertThat(detector.detect(accessEvent("alice", "10.0.0.9", TS))).isEmpty();
        }

        assertThat(detector.getSettings()).containsEntry("trackedUsers", 0);
    }

    @Test
    void evictExpiredState_dropsKeysOlderThanLongestWindow() {
        for (int i = 0; i < 5000; i++) {
            fail("user-" + i, "198.51." + (i / 256) + "." + (i % 256));
        }
        assertThat(detector.getSettings()).containsEntry("trackedUsers", 5000).containsEntry("trackedIps", 5000);

        clock.advance(Duration.ofHours(1));
        fail("alice", "10.0.0.9");
        assertThat(detector.evictExpiredState()).isZero();

        clock.advance(Duration.ofDays(3));
        fail("bob", "10.0.0.10");

        assertThat(detector.evictExpiredState()).isEqualTo(2 * 5001);
        assertThat(detector.getSettings())
                .containsEntry("trackedUsers", 1)
                .containsEntry("trackedIps", 1)
                .containsEntry("trackedEndpoints", 1);
    }

    @Test
    void saveModel_doesNotPersistExpiredKeys(@TempDir Path storageRoot) {
        fail("alice", "10.0.0.9");
        clock.advance(Duration.ofDays(2));
        assertThat(detector.saveModel(storageRoot)).isTrue();

        AuthenticationFailureDetector restored = new AuthenticationFailureDetector(new AnomalyDetectionConfig(),
                new DetectorModelRepository(), clock);
        assertThat(restored.loadModel(storageRoot)).isTrue();

        assertThat(restored.getSettings()).containsEntry("trackedUsers", 0).containsEntry("trackedIps", 0);
    }

    @Test
    void severityFor_spreadEscalatesOneLevel() {
        assertThat(AuthenticationFailureDetector.severityFor(1.0, false)).isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(AuthenticationFailureDetector.severityFor(1.0, true)).isEqualTo(AnomalySeverity.HIGH);
        assertThat(AuthenticationFailureDetector.severityFor(2.0, false)).isEqualTo(AnomalySeverity.HIGH);
        assertThat(AuthenticationFailureDetector.severityFor(2.0, true)).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(AuthenticationFailureDetector.severityFor(3.5, true)).isEqualTo(AnomalySeverity.CRITICAL);
    }

    @Test
    void saveAndLoad_keepsFailureHistory(@TempDir Path storageRoot) {
        for (int i = 0; i < 4; i++) {
            fail("alice", "10.0.0.9");
        }
        assertThat(detector.saveModel(storageRoot)).isTrue();

        AuthenticationFailureDetector restored = new AuthenticationFailureDetector(new AnomalyDetectionConfig(),
                new DetectorModelRepository(), clock);
        assertThat(restored.loadModel(storageRoot)).isTrue();

        Optional<AnomalyEvent> result = restored.detect(failedLogin("alice", "10.0.0.9", TS));
        assertThat(result).isPresent();
        assertThat(result.get().getDetails()).containsEntry("failureCount", 5);
    }

    @Test
    void prepareSettings_lowerThreshold_triggersEarlier() {
        detector.prepareSettings(Map.of("thresholds", Map.of("60", 2))).run();

        assertThat(fail("alice", "10.0.0.9")).isEmpty();
        assertThat(fail("alice", "10.0.0.9")).isPresent();
    }

    @Test
    void prepareSettings_emptyThresholds_throws() {
        assertThatThrownBy(() -> detector.prepareSettings(Map.of("thresholds", Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("thresholds");
    }

    private static void runConcurrently(int threads, IntConsumer task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int index = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    task.accept(index);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
