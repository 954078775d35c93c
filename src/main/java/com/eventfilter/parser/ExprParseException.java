package com.eventfilter.parser;

import com.eventfilter.filter.ErrorKind;
import com.eventfilter.filter.FilterException;

public class ExprParseException extends FilterException {
    private final int position;
    private final String queryString;
    private final String suggestion;

    public ExprParseException(String message, int position, String queryString) {
        super(ErrorKind.SYNTAX_ERROR, buildMessage(message, position, queryString));
        this.position = position;
        this.queryString = queryString;
        this.suggestion = suggestFix(position, queryString);
    }

    public int getPosition() {
        return position;
    }

    public String getQueryString() {
        return queryString;
    }

    public String getSuggestion() {
        return suggestion;
    }

    private static String buildMessage(String message, int pos, String query) {
        int caretPos = Math.max(0, Math.min(pos, query.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return "Syntax error at position " + pos + ": " + message + System.lineSeparator()
                + query + System.lineSeparator() + pointer;
    }

    private static String suggestFix(int pos, String query) {
        if (query == null || query.isBlank()) {
            return "请输入非空表达式";
        }
        if (pos >= query.length() && query.chars().filter(ch -> ch == '\'').count() % 2 != 0) {
            return "检测到未闭合的字符串引号，请补全右引号";
        }
        long open = query.chars().filter(ch -> ch == '(').count();
        long close = query.chars().filter(ch -> ch == ')').count();
        if (open != close) {
            return "括号数量不匹配";
        }
        return "请检查该位置附近的语法，例如比较运算符、逗号或占位符";
    }
}
