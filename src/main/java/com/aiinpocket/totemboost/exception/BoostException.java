package com.aiinpocket.totemboost.exception;

import com.aiinpocket.totemboost.model.enums.BoostError;
import lombok.Getter;

/**
 * 加持流程中的可預期失敗。丟出後整個交易回滾，不留下部分狀態。
 */
@Getter
public class BoostException extends RuntimeException {

    private final BoostError error;

    public BoostException(BoostError error) {
        super(error.getDefaultMessage());
        this.error = error;
    }

    public BoostException(BoostError error, String message) {
        super(message);
        this.error = error;
    }

    public BoostException(BoostError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
