package com.aiinpocket.totemboost.service.client;

import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.enums.BoostError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;

import java.util.function.Supplier;

/**
 * 外部 HTTP 呼叫的共用錯誤轉換。
 * RestClient 的連線或回應錯誤一律轉成 EXTERNAL_SERVICE_UNAVAILABLE，
 * 讓外層交易回滾；已經是 BoostException 的（例如 404 轉成的 TOTEM_NOT_REGISTERED）原樣拋出。
 */
@Slf4j
final class ExternalCalls {

    private ExternalCalls() {}

    static <T> T call(String service, Supplier<T> action) {
        try {
            return action.get();
        } catch (BoostException e) {
            throw e;
        } catch (RestClientException e) {
            log.error("[外部服務] {} 呼叫失敗: {}", service, e.getMessage(), e);
            throw new BoostException(BoostError.EXTERNAL_SERVICE_UNAVAILABLE,
                    service + " 暫時無法使用", e);
        }
    }

    static void run(String service, Runnable action) {
        call(service, () -> {
            action.run();
            return null;
        });
    }
}
