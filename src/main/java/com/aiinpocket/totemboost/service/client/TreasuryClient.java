package com.aiinpocket.totemboost.service.client;

import java.math.BigInteger;

/**
 * 金庫。高級加持的價格全額轉入此處。
 */
public interface TreasuryClient {

    void receive(BigInteger amount);
}
