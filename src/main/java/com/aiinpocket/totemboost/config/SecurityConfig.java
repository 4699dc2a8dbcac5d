package com.aiinpocket.totemboost.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Spring Security 安全配置。
 * 加持 API 由前端錢包登入後取得的 JWT 存取，JWT subject 即呼叫者的錢包地址。
 * 管理員與預言機權限不走 Spring 角色，而是由 BoostAuthorizationPolicy 逐一檢查地址。
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .authorizeHttpRequests(auth -> auth
                        // Actuator 只放行健康檢查端點（K8s liveness/readiness 檢查用）
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                        .requestMatchers("/api/v1/**").authenticated()
                        .anyRequest().denyAll()
                )
                .oauth2ResourceServer(oauth2 -> oauth2.jwt(jwt -> {}))
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                // 純 REST API，無瀏覽器 session，不需要 CSRF 保護
                .csrf(csrf -> csrf.disable());

        return http.build();
    }
}
