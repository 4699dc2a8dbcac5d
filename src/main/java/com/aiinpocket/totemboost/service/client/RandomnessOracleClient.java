package com.aiinpocket.totemboost.service.client;

/**
 * 隨機數預言機。request 只送出請求並取得 requestId，
 * 隨機數稍後由預言機回呼 /api/v1/oracle/fulfill 送達。
 */
public interface RandomnessOracleClient {

    String request(int numWords);
}
