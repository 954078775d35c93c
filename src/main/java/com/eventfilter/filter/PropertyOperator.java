package com.eventfilter.filter;

public enum PropertyOperator {
    EXACT("exact"),
    IS_NOT("is_not"),
    IS_SET("is_set"),
    IS_NOT_SET("is_not_set"),
    ICONTAINS("icontains"),
    NOT_ICONTAINS("not_icontains"),
    REGEX("regex"),
    NOT_REGEX("not_regex"),
    LT("lt"),
    GT("gt"),
    LTE("lte"),
    GTE("gte"),
    IS_DATE_EXACT("is_date_exact"),
    IS_DATE_BEFORE("is_date_before"),
    IS_DATE_AFTER("is_date_after");

    private final String wireName;

    PropertyOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 未指定运算符时按 exact 处理。
     */
    public static PropertyOperator orDefault(PropertyOperator operator) {
        return operator == null ? EXACT : operator;
    }

    public static PropertyOperator fromWireName(String wireName) {
        for (PropertyOperator operator : values()) {
            if (operator.wireName.equals(wireName)) {
                return operator;
            }
        }
        return null;
    }
}
