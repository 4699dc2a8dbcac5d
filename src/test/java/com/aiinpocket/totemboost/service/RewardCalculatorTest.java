package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.model.enums.PremiumRewardTier;
import com.aiinpocket.totemboost.service.client.MeritManagerClient;
import com.aiinpocket.totemboost.service.client.MeritManagerClient.BoostPeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RewardCalculator Tests")
class RewardCalculatorTest {

    @Mock
    private MeritManagerClient meritManager;

    @InjectMocks
    private RewardCalculator calculator;

    @ParameterizedTest(name = "streak {0} -> {1}%")
    @CsvSource({"0,100", "1,100", "2,105", "3,110", "29,240", "30,245", "31,245", "365,245"})
    @DisplayName("Should grow the multiplier by 5% per day and cap it at 245%")
    void shouldComputeMultiplier(int streak, int expectedPct) {
        assertThat(RewardCalculator.multiplierPct(streak)).isEqualTo(expectedPct);
    }

    @Test
    @DisplayName("Should floor the scaled free reward")
    void shouldFloorFreeReward() {
        when(meritManager.currentBoostPeriod()).thenReturn(BoostPeriod.INACTIVE);

        assertThat(calculator.freeReward(33, 2)).isEqualTo(34L);
    }

    @Test
    @DisplayName("Should scale the premium tier base by the streak multiplier")
    void shouldScalePremiumReward() {
        when(meritManager.currentBoostPeriod()).thenReturn(BoostPeriod.INACTIVE);

        assertThat(calculator.premiumReward(PremiumRewardTier.RARE, 3)).isEqualTo(1_100L);
        assertThat(calculator.premiumReward(PremiumRewardTier.LEGENDARY, 40)).isEqualTo(7_350L);
    }

    @Test
    @DisplayName("Should apply the boost period multiplier after the streak multiplier")
    void shouldApplyBoostPeriod() {
        when(meritManager.currentBoostPeriod()).thenReturn(new BoostPeriod(true, 125));

        // 100 * 105% = 105, then * 125% = 131.25 -> 131
        assertThat(calculator.freeReward(100, 2)).isEqualTo(131L);
    }

    @Test
    @DisplayName("Should read the boost period state once per reward")
    void shouldFetchBoostPeriodOnce() {
        when(meritManager.currentBoostPeriod()).thenReturn(new BoostPeriod(true, 200));

        assertThat(calculator.premiumReward(PremiumRewardTier.COMMON, 1)).isEqualTo(1_000L);

        verify(meritManager, times(1)).currentBoostPeriod();
        verifyNoMoreInteractions(meritManager);
    }
}
