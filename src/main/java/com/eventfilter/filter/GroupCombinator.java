package com.eventfilter.filter;

import java.util.Locale;

public enum GroupCombinator {
    AND,
    OR;

    /**
     * 解析 "AND"/"OR"（不区分大小写），其它取值返回 null。
     */
    public static GroupCombinator fromWireName(String wireName) {
        if (wireName == null) {
            return null;
        }
        switch (wireName.toUpperCase(Locale.ROOT)) {
            case "AND":
                return AND;
            case "OR":
                return OR;
            default:
                return null;
        }
    }
}
