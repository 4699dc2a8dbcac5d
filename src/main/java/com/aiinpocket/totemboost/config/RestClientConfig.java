package com.aiinpocket.totemboost.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * REST 客戶端配置。
 * 每個外部協作服務一個 RestClient Bean，baseUrl 與預設 header 在此集中設定。
 *
 * <ul>
 *   <li>{@code meritManagerRestClient}：功德點數帳本（入帳、加成期查詢）</li>
 *   <li>{@code treasuryRestClient}：金庫收款</li>
 *   <li>{@code paymentGatewayRestClient}：超額付款退款</li>
 *   <li>{@code badgeNftRestClient}：里程碑徽章鑄造</li>
 *   <li>{@code totemRegistryRestClient}：圖騰代幣 / NFT 持有量查詢</li>
 *   <li>{@code randomnessOracleRestClient}：隨機數預言機</li>
 * </ul>
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClient meritManagerRestClient(ExternalServiceProperties props) {
        return jsonClient(props.meritManagerUrl());
    }

    @Bean
    public RestClient treasuryRestClient(ExternalServiceProperties props) {
        return jsonClient(props.treasuryUrl());
    }

    @Bean
    public RestClient paymentGatewayRestClient(ExternalServiceProperties props) {
        return jsonClient(props.paymentGatewayUrl());
    }

    @Bean
    public RestClient badgeNftRestClient(ExternalServiceProperties props) {
        return jsonClient(props.badgeNftUrl());
    }

    @Bean
    public RestClient totemRegistryRestClient(ExternalServiceProperties props) {
        return jsonClient(props.totemRegistryUrl());
    }

    @Bean
    public RestClient randomnessOracleRestClient(ExternalServiceProperties props) {
        return jsonClient(props.randomnessOracleUrl());
    }

    private static RestClient jsonClient(String baseUrl) {
        return RestClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Accept", "application/json")
                .build();
    }
}
