package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.dto.PremiumBoostReceipt;
import com.aiinpocket.totemboost.model.dto.PremiumRewardResult;
import com.aiinpocket.totemboost.model.entity.PendingPremiumRequest;
import com.aiinpocket.totemboost.model.enums.BoostError;
import com.aiinpocket.totemboost.model.enums.PremiumRewardTier;
import com.aiinpocket.totemboost.repository.PendingPremiumRequestRepository;
import com.aiinpocket.totemboost.service.client.MeritManagerClient;
import com.aiinpocket.totemboost.service.client.PaymentGatewayClient;
import com.aiinpocket.totemboost.service.client.RandomnessOracleClient;
import com.aiinpocket.totemboost.service.client.TreasuryClient;
import com.aiinpocket.totemboost.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RandomRewardResolver Tests")
class RandomRewardResolverTest {

    private static final String USER = "0x1111111111111111111111111111111111111111";
    private static final String TOTEM = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final BigInteger PRICE = new BigInteger("10000000000000000");

    @Mock private PendingPremiumRequestRepository pendingRepo;
    @Mock private RandomnessOracleClient oracleClient;
    @Mock private TreasuryClient treasuryClient;
    @Mock private PaymentGatewayClient paymentGateway;
    @Mock private MeritManagerClient meritManager;

    @Captor
    private ArgumentCaptor<PendingPremiumRequest> pendingCaptor;

    private MutableClock clock;
    private RandomRewardResolver resolver;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-02-01T00:00:00Z"));
        resolver = new RandomRewardResolver(pendingRepo, oracleClient, treasuryClient, paymentGateway,
                meritManager, new RewardCalculator(meritManager), clock);
    }

    @Test
    @DisplayName("Should record the request before forwarding the price and refunding the excess")
    void shouldRefundExcess() {
        // Given
        BigInteger excess = BigInteger.valueOf(12_345);
        when(oracleClient.request(1)).thenReturn("req-42");

        // When
        PremiumBoostReceipt receipt = resolver.requestReward(USER, TOTEM, 5, true, PRICE.add(excess), PRICE);

        // Then
        InOrder order = inOrder(oracleClient, pendingRepo, treasuryClient, paymentGateway);
        order.verify(oracleClient).request(1);
        order.verify(pendingRepo).saveAndFlush(pendingCaptor.capture());
        order.verify(treasuryClient).receive(PRICE);
        order.verify(paymentGateway).refund(USER, excess);

        assertThat(receipt.requestId()).isEqualTo("req-42");
        assertThat(receipt.refunded()).isEqualTo(excess);
        assertThat(receipt.pricePaid()).isEqualTo(PRICE);

        assertThat(pendingCaptor.getValue().getRequestId()).isEqualTo("req-42");
        assertThat(pendingCaptor.getValue().getStreakSnapshot()).isEqualTo(5);
        assertThat(pendingCaptor.getValue().getRequestedAt()).isEqualTo(clock.instant());
        verify(meritManager, never()).creditMerit(anyString(), anyLong());
    }

    @Test
    @DisplayName("Should skip the refund on exact payment")
    void shouldNotRefundExactPayment() {
        when(oracleClient.request(1)).thenReturn("req-1");

        PremiumBoostReceipt receipt = resolver.requestReward(USER, TOTEM, 1, false, PRICE, PRICE);

        assertThat(receipt.refunded()).isEqualTo(BigInteger.ZERO);
        verifyNoInteractions(paymentGateway);
        verify(treasuryClient).receive(PRICE);
    }

    @Test
    @DisplayName("Should reject underpayment without moving funds")
    void shouldRejectUnderpayment() {
        assertThatThrownBy(() -> resolver.requestReward(USER, TOTEM, 1, false, PRICE.subtract(BigInteger.ONE), PRICE))
                .isInstanceOf(BoostException.class)
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.INSUFFICIENT_PAYMENT);

        verifyNoInteractions(paymentGateway, treasuryClient, oracleClient, pendingRepo);
    }

    @Test
    @DisplayName("Should move no funds when the oracle request fails")
    void shouldNotMoveFundsWhenOracleFails() {
        // Given
        when(oracleClient.request(1))
                .thenThrow(new BoostException(BoostError.EXTERNAL_SERVICE_UNAVAILABLE, "RandomnessOracle 無回應"));

        // When / Then
        assertThatThrownBy(() -> resolver.requestReward(USER, TOTEM, 2, false, PRICE.add(BigInteger.TEN), PRICE))
                .isInstanceOf(BoostException.class)
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.EXTERNAL_SERVICE_UNAVAILABLE);

        verifyNoInteractions(paymentGateway, treasuryClient, pendingRepo);
    }

    @Test
    @DisplayName("Should credit the tier reward using the request-time streak and delete the entry")
    void shouldFulfillPendingRequest() {
        // Given
        PendingPremiumRequest pending = PendingPremiumRequest.builder()
                .requestId("req-7")
                .userAddress(USER)
                .totemAddress(TOTEM)
                .streakSnapshot(3)
                .requestedAt(clock.instant())
                .build();
        when(pendingRepo.findById("req-7")).thenReturn(Optional.of(pending));
        when(meritManager.currentBoostPeriod()).thenReturn(MeritManagerClient.BoostPeriod.INACTIVE);

        // When: 175 mod 100 = 75 -> RARE
        PremiumRewardResult result = resolver.fulfill("req-7", List.of(BigInteger.valueOf(175)));

        // Then
        assertThat(result.tier()).isEqualTo(PremiumRewardTier.RARE);
        assertThat(result.rewardPoints()).isEqualTo(1_100L);
        assertThat(result.user()).isEqualTo(USER);
        verify(meritManager).creditMerit(TOTEM, 1_100L);
        verify(pendingRepo).delete(pending);
    }

    @Test
    @DisplayName("Should fail on unknown request ids")
    void shouldRejectUnknownRequest() {
        when(pendingRepo.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.fulfill("missing", List.of(BigInteger.ONE)))
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.PREMIUM_REQUEST_NOT_FOUND);
        verify(meritManager, never()).creditMerit(anyString(), anyLong());
    }

    @Test
    @DisplayName("Should fail on an empty word list")
    void shouldRejectEmptyWords() {
        assertThatThrownBy(() -> resolver.fulfill("req-1", List.of()))
                .extracting(e -> ((BoostException) e).getError())
                .isEqualTo(BoostError.INVALID_ARGUMENT);
        verifyNoInteractions(pendingRepo);
    }

    @Test
    @DisplayName("Should list pending requests oldest first")
    void shouldListPending() {
        when(pendingRepo.findByUserAddressOrderByRequestedAtAsc(USER)).thenReturn(List.of(
                PendingPremiumRequest.builder().requestId("a").userAddress(USER).totemAddress(TOTEM)
                        .streakSnapshot(2).requestedAt(Instant.parse("2026-01-31T00:00:00Z")).build()));

        assertThat(resolver.listPending(USER))
                .singleElement()
                .satisfies(p -> {
                    assertThat(p.requestId()).isEqualTo("a");
                    assertThat(p.requestedAt()).isEqualTo("2026-01-31T00:00:00Z");
                });
        verify(oracleClient, never()).request(anyInt());
        verify(pendingRepo, never()).saveAndFlush(any());
    }
}
