package com.aiinpocket.totemboost.security;

import com.aiinpocket.totemboost.config.BoostProperties;
import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.enums.BoostError;
import com.aiinpocket.totemboost.service.Addresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 加持系統的授權規則。
 * 只有兩種特權：管理員（調整設定、暫停）與預言機（回呼隨機數），
 * 都以設定檔中的地址比對，每個需要權限的入口各自呼叫對應的 require 方法。
 */
@Component
@Slf4j
public class BoostAuthorizationPolicy {

    private final Set<String> managers;
    private final String oracleAddress;

    public BoostAuthorizationPolicy(BoostProperties props) {
        List<String> configured = props.managers() != null ? props.managers() : List.of();
        this.managers = configured.stream()
                .filter(Addresses::isValid)
                .map(Addresses::normalize)
                .collect(Collectors.toUnmodifiableSet());
        this.oracleAddress = Addresses.isValid(props.oracleAddress())
                ? Addresses.normalize(props.oracleAddress())
                : null;
        if (managers.size() != configured.size()) {
            log.warn("[授權] 設定中有 {} 個無效的管理員地址已被忽略", configured.size() - managers.size());
        }
    }

    public boolean isManager(String caller) {
        return Addresses.isValid(caller) && managers.contains(Addresses.normalize(caller));
    }

    public void requireManager(String caller) {
        if (!isManager(caller)) {
            log.warn("[授權] 非管理員 {} 嘗試呼叫管理功能", caller);
            throw new BoostException(BoostError.NOT_MANAGER);
        }
    }

    public void requireOracle(String caller) {
        if (oracleAddress == null || !Addresses.isValid(caller)
                || !oracleAddress.equals(Addresses.normalize(caller))) {
            log.warn("[授權] 非預言機地址 {} 嘗試回呼隨機數", caller);
            throw new BoostException(BoostError.NOT_ORACLE);
        }
    }
}
