package com.aiinpocket.totemboost.service.client;

/**
 * 功德點數帳本。實際點數累積不在本系統，只透過此介面入帳。
 */
public interface MeritManagerClient {

    /**
     * 為圖騰入帳功德點數。
     *
     * @throws com.aiinpocket.totemboost.exception.BoostException TOTEM_NOT_REGISTERED 若圖騰未註冊
     */
    void creditMerit(String totem, long amount);

    /**
     * 目前的 Mythum 加成期狀態。是否啟用與倍率來自同一次查詢。
     */
    BoostPeriod currentBoostPeriod();

    /**
     * @param active        是否處於 Mythum 加成期
     * @param multiplierPct 加成倍率（百分比，例如 150 代表 1.5 倍）
     */
    record BoostPeriod(boolean active, int multiplierPct) {

        public static final BoostPeriod INACTIVE = new BoostPeriod(false, 100);
    }
}
