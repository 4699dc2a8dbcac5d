package com.aiinpocket.totemboost.service.client;

import java.math.BigInteger;

/**
 * 圖騰持有量查詢（唯讀）。
 */
public interface TotemHoldingClient {

    TotemHolding holdingOf(String totem, String user);

    /**
     * @param tokenBalance 圖騰代幣餘額（最小單位）
     * @param nftBalance   持有的圖騰 NFT 數量
     */
    record TotemHolding(BigInteger tokenBalance, BigInteger nftBalance) {

        public static final TotemHolding NONE = new TotemHolding(BigInteger.ZERO, BigInteger.ZERO);
    }
}
