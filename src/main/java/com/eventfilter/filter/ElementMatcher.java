package com.eventfilter.filter;

import com.eventfilter.ast.Expr;
import com.eventfilter.config.Constants;
import com.eventfilter.parser.ExprParser;
import com.eventfilter.selector.SelectorRegexCompiler;

import java.util.Map;

/**
 * DOM 元素过滤：在序列化的元素链（以 ; 分隔、属性带引号）上做正则匹配。
 */
public class ElementMatcher {
    private static final String CHAIN_MATCH = Constants.ELEMENTS_CHAIN_FIELD + " =~ {regex}";
    private static final String CHAIN_MATCH_IGNORE_CASE = Constants.ELEMENTS_CHAIN_FIELD + " =~* {regex}";
    private static final String NON_EMPTY_VALUE = "[^\"]+";
    private static final String ANY_CHARS = "[^\"]*";

    private final ExprParser parser;
    private final SelectorRegexCompiler selectorCompiler;

    public ElementMatcher(ExprParser parser, SelectorRegexCompiler selectorCompiler) {
        this.parser = parser;
        this.selectorCompiler = selectorCompiler;
    }

    /**
     * 编译单值的元素过滤。
     *
     * @param key selector、tag_name、href 或 text
     * @param operator 运算符，null 视为 exact
     * @param value 过滤取值
     */
    public Expr compile(String key, PropertyOperator operator, Object value) {
        PropertyOperator effective = PropertyOperator.orDefault(operator);
        String text = String.valueOf(value);
        if ("selector".equals(key) || "tag_name".equals(key)) {
            if (effective != PropertyOperator.EXACT && effective != PropertyOperator.IS_NOT) {
                throw FilterException.unsupportedOperator(
                    "元素 " + key + " 只支持 exact 与 is_not，不支持 " + effective.wireName());
            }
            Expr expr = "selector".equals(key) ? selector(text) : tagName(text);
            return effective == PropertyOperator.IS_NOT ? Expr.Call.not(expr) : expr;
        }
        if ("href".equals(key) || "text".equals(key)) {
            return chainKeyFilter(key, text, effective);
        }
        throw FilterException.unsupportedKey("元素过滤不支持 key: " + key);
    }

    /**
     * 在元素链上匹配 key="..." 属性。
     */
    public Expr chainKeyFilter(String key, String text, PropertyOperator operator) {
        String escaped = text.replace("\"", "\\\"");
        String valuePattern;
        switch (operator) {
            case IS_SET:
            case IS_NOT_SET:
                valuePattern = NON_EMPTY_VALUE;
                break;
            case ICONTAINS:
            case NOT_ICONTAINS:
                valuePattern = ANY_CHARS + RegexEscaper.escape(escaped) + ANY_CHARS;
                break;
            case REGEX:
            case NOT_REGEX:
                valuePattern = escaped;
                break;
            case EXACT:
            case IS_NOT:
                valuePattern = RegexEscaper.escape(escaped);
                break;
            default:
                throw FilterException.unsupportedOperator(
                    "元素 " + key + " 不支持运算符 " + operator.wireName());
        }

        String regex = "(" + key + "=\"" + valuePattern + "\")";
        boolean ignoreCase = operator == PropertyOperator.ICONTAINS || operator == PropertyOperator.NOT_ICONTAINS;
        Expr expr = chainMatch(ignoreCase ? CHAIN_MATCH_IGNORE_CASE : CHAIN_MATCH, regex);
        return OperatorSemantics.negatesChainMatch(operator) ? Expr.Call.not(expr) : expr;
    }

    public Expr tagName(String tagName) {
        return chainMatch(CHAIN_MATCH, "(^|;)" + tagName + "(\\.|$|;|:)");
    }

    public Expr selector(String selector) {
        if (selector == null || selector.isBlank()) {
            throw FilterException.unsupportedSpec("选择器不能为空");
        }
        return chainMatch(CHAIN_MATCH, selectorCompiler.compile(selector));
    }

    private Expr chainMatch(String template, String regex) {
        return parser.parseExpr(template, Map.of("regex", new Expr.Constant(regex)));
    }
}
