package com.aiinpocket.totemboost;

import com.aiinpocket.totemboost.config.BoostProperties;
import com.aiinpocket.totemboost.config.ExternalServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({BoostProperties.class, ExternalServiceProperties.class})
public class TotemBoostApplication {

    public static void main(String[] args) {
        SpringApplication.run(TotemBoostApplication.class, args);
    }

}
