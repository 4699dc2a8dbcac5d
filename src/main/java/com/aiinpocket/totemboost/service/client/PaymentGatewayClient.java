package com.aiinpocket.totemboost.service.client;

import java.math.BigInteger;

/**
 * 付款閘道。附帶金額超過價格時，將差額退回呼叫者。
 */
public interface PaymentGatewayClient {

    void refund(String user, BigInteger amount);
}
