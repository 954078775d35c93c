package com.eventfilter.filter;

import com.eventfilter.ast.CompareOp;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 属性运算符语义表：每个运算符对应的表达式形态、比较运算符与是否取反。
 */
public final class OperatorSemantics {

    /** 运算符生成的表达式形态 */
    public enum Shape {
        /** 与 null 比较 */
        NULL_CHECK,
        /** 以 %value% 做 ilike */
        CONTAINS,
        /** match(field, pattern) 调用 */
        REGEX,
        /** 与字面量直接比较，可能触发布尔化 */
        COMPARE
    }

    public record Rule(Shape shape, CompareOp op, boolean negated) {
    }

    private static final Map<PropertyOperator, Rule> PROPERTY_RULES = new EnumMap<>(PropertyOperator.class);

    /** 多值时以 AND 组合的否定类运算符 */
    private static final Set<PropertyOperator> CONJUNCTIVE = EnumSet.of(
        PropertyOperator.IS_NOT, PropertyOperator.NOT_ICONTAINS, PropertyOperator.NOT_REGEX);

    /** 元素链匹配时需要整体取反的运算符 */
    private static final Set<PropertyOperator> NEGATED_CHAIN_MATCH = EnumSet.of(
        PropertyOperator.IS_NOT_SET, PropertyOperator.NOT_ICONTAINS, PropertyOperator.IS_NOT, PropertyOperator.NOT_REGEX);

    static {
        PROPERTY_RULES.put(PropertyOperator.IS_SET, new Rule(Shape.NULL_CHECK, CompareOp.NOT_EQ, false));
        PROPERTY_RULES.put(PropertyOperator.IS_NOT_SET, new Rule(Shape.NULL_CHECK, CompareOp.EQ, false));
        PROPERTY_RULES.put(PropertyOperator.ICONTAINS, new Rule(Shape.CONTAINS, CompareOp.ILIKE, false));
        PROPERTY_RULES.put(PropertyOperator.NOT_ICONTAINS, new Rule(Shape.CONTAINS, CompareOp.NOT_ILIKE, false));
        PROPERTY_RULES.put(PropertyOperator.REGEX, new Rule(Shape.REGEX, null, false));
        PROPERTY_RULES.put(PropertyOperator.NOT_REGEX, new Rule(Shape.REGEX, null, true));
        PROPERTY_RULES.put(PropertyOperator.EXACT, new Rule(Shape.COMPARE, CompareOp.EQ, false));
        PROPERTY_RULES.put(PropertyOperator.IS_DATE_EXACT, new Rule(Shape.COMPARE, CompareOp.EQ, false));
        PROPERTY_RULES.put(PropertyOperator.IS_NOT, new Rule(Shape.COMPARE, CompareOp.NOT_EQ, false));
        PROPERTY_RULES.put(PropertyOperator.LT, new Rule(Shape.COMPARE, CompareOp.LT, false));
        PROPERTY_RULES.put(PropertyOperator.IS_DATE_BEFORE, new Rule(Shape.COMPARE, CompareOp.LT, false));
        PROPERTY_RULES.put(PropertyOperator.GT, new Rule(Shape.COMPARE, CompareOp.GT, false));
        PROPERTY_RULES.put(PropertyOperator.IS_DATE_AFTER, new Rule(Shape.COMPARE, CompareOp.GT, false));
        PROPERTY_RULES.put(PropertyOperator.LTE, new Rule(Shape.COMPARE, CompareOp.LT_EQ, false));
        PROPERTY_RULES.put(PropertyOperator.GTE, new Rule(Shape.COMPARE, CompareOp.GT_EQ, false));
    }

    private OperatorSemantics() {
    }

    /**
     * 事件、用户、特性属性上的运算符语义。
     *
     * @throws FilterException 类别为 UNSUPPORTED_OPERATOR，运算符无定义时抛出
     */
    public static Rule forProperty(PropertyOperator operator) {
        Rule rule = PROPERTY_RULES.get(PropertyOperator.orDefault(operator));
        if (rule == null) {
            throw FilterException.unsupportedOperator("PropertyOperator " + operator + " 未实现");
        }
        return rule;
    }

    /**
     * 多值展开后是否以 AND 组合（"都不是"），否则以 OR 组合（"任一是"）。
     */
    public static boolean combinesWithAnd(PropertyOperator operator) {
        return CONJUNCTIVE.contains(PropertyOperator.orDefault(operator));
    }

    public static boolean negatesChainMatch(PropertyOperator operator) {
        return NEGATED_CHAIN_MATCH.contains(operator);
    }

    /**
     * 只有等值与不等比较会把 "true"/"false" 视为布尔字面量候选。
     */
    public static boolean isEquality(CompareOp op) {
        return op == CompareOp.EQ || op == CompareOp.NOT_EQ;
    }
}
