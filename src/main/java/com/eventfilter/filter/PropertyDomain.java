package com.eventfilter.filter;

import java.util.Locale;

/**
 * 属性过滤的命名空间，wireName 为 JSON 中 type 字段的取值。
 */
public enum PropertyDomain {
    EVENT("event"),
    PERSON("person"),
    FEATURE("feature"),
    ELEMENT("element"),
    COHORT("cohort"),
    STATIC_COHORT("static-cohort"),
    PRECALCULATED_COHORT("precalculated-cohort"),
    HOGQL("hogql"),
    GROUP("group"),
    SESSION("session"),
    RECORDING("recording"),
    BEHAVIORAL("behavioral");

    private final String wireName;

    PropertyDomain(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isCohort() {
        return this == COHORT || this == STATIC_COHORT || this == PRECALCULATED_COHORT;
    }

    /**
     * 按 wireName 查找，未知取值返回 null。
     */
    public static PropertyDomain fromWireName(String wireName) {
        if (wireName == null) {
            return null;
        }
        String normalized = wireName.toLowerCase(Locale.ROOT);
        for (PropertyDomain domain : values()) {
            if (domain.wireName.equals(normalized)) {
                return domain;
            }
        }
        return null;
    }
}
