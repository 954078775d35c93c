package com.eventfilter.filter;

/**
 * 编译错误类别。均为输入或配置问题，重试无意义。
 */
public enum ErrorKind {
    UNSUPPORTED_SPEC,
    UNSUPPORTED_DOMAIN,
    UNSUPPORTED_OPERATOR,
    UNSUPPORTED_KEY,
    MISSING_TEAM_CONTEXT,
    NOT_FOUND,
    UNPARSABLE_DATE,
    SYNTAX_ERROR,
    NESTING_TOO_DEEP
}
