package com.aiinpocket.totemboost.service;

import com.aiinpocket.totemboost.exception.BoostException;
import com.aiinpocket.totemboost.model.enums.BoostError;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 錢包 / 合約地址的格式檢查與正規化（0x + 40 位十六進位，統一轉小寫）。
 */
public final class Addresses {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final String ZERO = "0x0000000000000000000000000000000000000000";

    private Addresses() {}

    public static String normalize(String address) {
        if (address == null || !ADDRESS.matcher(address).matches()) {
            throw new BoostException(BoostError.INVALID_ARGUMENT, "地址格式不正確: " + address);
        }
        String lower = address.toLowerCase(Locale.ROOT);
        if (ZERO.equals(lower)) {
            throw new BoostException(BoostError.INVALID_ARGUMENT, "不可使用零地址");
        }
        return lower;
    }

    public static boolean isValid(String address) {
        return address != null && ADDRESS.matcher(address).matches()
                && !ZERO.equals(address.toLowerCase(Locale.ROOT));
    }
}
