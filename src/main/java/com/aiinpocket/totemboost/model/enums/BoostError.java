package com.aiinpocket.totemboost.model.enums;

import lombok.Getter;

/**
 * 加持系統的錯誤分類。
 * 每個錯誤碼歸屬一個類別，並對應一個 HTTP 狀態碼。
 */
@Getter
public enum BoostError {

    // 認證失敗
    INVALID_SIGNATURE(Category.AUTH, 401, "簽章無效"),
    SIGNATURE_EXPIRED(Category.AUTH, 401, "簽章已過期"),
    SIGNATURE_ALREADY_USED(Category.AUTH, 401, "簽章已被使用"),

    // 資格不符
    NOT_ENOUGH_TOKENS(Category.ELIGIBILITY, 403, "持有的圖騰代幣或 NFT 不足"),

    // 頻率限制
    NOT_ENOUGH_TIME_PASSED_FOR_FREE_BOOST(Category.RATE_LIMIT, 429, "距離上次免費加持未滿冷卻時間"),

    // 付款
    INSUFFICIENT_PAYMENT(Category.PAYMENT, 402, "付款金額不足"),

    // 里程碑
    MILESTONE_NOT_ACHIEVED(Category.MILESTONE, 409, "尚未達成此里程碑或已無可鑄造的徽章"),

    // 系統
    PAUSED(Category.SYSTEM, 503, "加持系統暫停中"),

    // 權限
    NOT_MANAGER(Category.ACCESS, 403, "需要管理員權限"),
    NOT_ORACLE(Category.ACCESS, 403, "僅限隨機數預言機呼叫"),

    // 請求內容
    INVALID_ARGUMENT(Category.REQUEST, 400, "參數不正確"),
    PREMIUM_REQUEST_NOT_FOUND(Category.REQUEST, 404, "找不到對應的高級加持請求"),

    // 外部服務
    TOTEM_NOT_REGISTERED(Category.EXTERNAL, 422, "圖騰尚未註冊"),
    EXTERNAL_SERVICE_UNAVAILABLE(Category.EXTERNAL, 502, "外部服務暫時無法使用");

    private final Category category;
    private final int httpStatus;
    private final String defaultMessage;

    BoostError(Category category, int httpStatus, String defaultMessage) {
        this.category = category;
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public enum Category {
        AUTH, ELIGIBILITY, RATE_LIMIT, PAYMENT, MILESTONE, SYSTEM, ACCESS, REQUEST, EXTERNAL
    }
}
