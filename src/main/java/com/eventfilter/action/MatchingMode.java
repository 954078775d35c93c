package com.eventfilter.action;

import java.util.Locale;

/**
 * action step 中 href、text、url 的匹配方式。
 */
public enum MatchingMode {
    EXACT,
    REGEX,
    CONTAINS;

    /**
     * 解析 "exact"/"regex"/"contains"，为空时返回 null。
     */
    public static MatchingMode fromWireName(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            return null;
        }
        return valueOf(wireName.toUpperCase(Locale.ROOT));
    }
}
