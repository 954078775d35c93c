package com.eventfilter.ast;

/**
 * 比较运算符，symbol 为查询语言中的写法。
 */
public enum CompareOp {
    EQ("="),
    NOT_EQ("!="),
    LT("<"),
    GT(">"),
    LT_EQ("<="),
    GT_EQ(">="),
    LIKE("like"),
    NOT_LIKE("not like"),
    ILIKE("ilike"),
    NOT_ILIKE("not ilike"),
    REGEX("=~"),
    NOT_REGEX("!~"),
    IREGEX("=~*"),
    NOT_IREGEX("!~*"),
    IN_COHORT("in cohort");

    private final String symbol;

    CompareOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
