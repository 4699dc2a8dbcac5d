package com.aiinpocket.totemboost.job;

import com.aiinpocket.totemboost.config.BoostProperties;
import com.aiinpocket.totemboost.model.entity.PendingPremiumRequest;
import com.aiinpocket.totemboost.service.DistributedLockService;
import com.aiinpocket.totemboost.service.RandomRewardResolver;
import com.aiinpocket.totemboost.service.SignatureVerifier;
import com.aiinpocket.totemboost.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.UnexpectedRollbackException;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Boost job Tests")
class BoostJobsTest {

    @Mock
    private RandomRewardResolver randomRewardResolver;

    @Mock
    private SignatureVerifier signatureVerifier;

    @Mock
    private DistributedLockService lockService;

    private MutableClock clock;
    private BoostProperties props;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-07-01T12:00:00Z"));
        props = new BoostProperties(Duration.ofHours(24), 30, Duration.ofMinutes(5), 100L, BigInteger.TEN,
                BigInteger.ONE, null, null, List.of(), null, Duration.ofHours(6));
        lenient().when(lockService.executeWithLock(anyLong(), anyString(), any())).thenAnswer(inv -> {
            inv.<Runnable>getArgument(2).run();
            return true;
        });
    }

    @Test
    @DisplayName("Should look up requests older than the stale threshold")
    void shouldQueryStaleRequests() {
        when(randomRewardResolver.findStale(Instant.parse("2026-07-01T06:00:00Z"))).thenReturn(List.of(
                PendingPremiumRequest.builder().requestId("req-1").userAddress("u").totemAddress("t")
                        .streakSnapshot(1).requestedAt(Instant.parse("2026-07-01T01:00:00Z")).build()));

        new PendingPremiumWatchJob(randomRewardResolver, lockService, props, clock).executeInternal(null);

        verify(randomRewardResolver).findStale(Instant.parse("2026-07-01T06:00:00Z"));
    }

    @Test
    @DisplayName("Should keep the scheduler alive when the purge fails")
    void shouldSwallowPurgeFailureIntoLog() {
        when(signatureVerifier.purgeExpired()).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> new ConsumedSignaturePurgeJob(signatureVerifier, lockService).executeInternal(null))
                .doesNotThrowAnyException();
        verify(signatureVerifier).purgeExpired();
    }

    @Test
    @DisplayName("Should let the purge failure roll back the lock transaction before logging it")
    void shouldPropagatePurgeFailureThroughLock() {
        // Given: the lock transaction sees the failure and rolls back
        doAnswer(inv -> {
            try {
                inv.<Runnable>getArgument(2).run();
            } catch (IllegalStateException e) {
                throw new UnexpectedRollbackException("purge rolled back", e);
            }
            return true;
        }).when(lockService).executeWithLock(anyLong(), anyString(), any());
        when(signatureVerifier.purgeExpired()).thenThrow(new IllegalStateException("db down"));

        // When / Then
        assertThatCode(() -> new ConsumedSignaturePurgeJob(signatureVerifier, lockService).executeInternal(null))
                .doesNotThrowAnyException();
        verify(signatureVerifier).purgeExpired();
    }

    @Test
    @DisplayName("Should keep the scheduler alive when the lock itself fails")
    void shouldSurviveLockFailure() {
        // Given
        doThrow(new UnexpectedRollbackException("transaction marked rollback-only"))
                .when(lockService).executeWithLock(anyLong(), anyString(), any());

        // When / Then
        assertThatCode(() -> new PendingPremiumWatchJob(randomRewardResolver, lockService, props, clock)
                .executeInternal(null))
                .doesNotThrowAnyException();
        verifyNoInteractions(randomRewardResolver);
    }
}
