package com.eventfilter.filter;

import com.eventfilter.action.ActionStep;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 调用方提供的过滤描述，编译期间只读。
 */
public sealed interface FilterSpec permits FilterSpec.Property, FilterSpec.Group, FilterSpec.ActionRef {

    /**
     * 单个属性比较。value 为标量（String、Number、Boolean、null）或标量列表；
     * operator 为 null 时按 exact 处理。
     */
    record Property(PropertyDomain domain, String key, PropertyOperator operator, Object value) implements FilterSpec {
        public Property {
            if (value instanceof List<?> list) {
                value = Collections.unmodifiableList(new ArrayList<>(list));
            }
        }

        public static Property event(String key, PropertyOperator operator, Object value) {
            return new Property(PropertyDomain.EVENT, key, operator, value);
        }

        public static Property person(String key, PropertyOperator operator, Object value) {
            return new Property(PropertyDomain.PERSON, key, operator, value);
        }

        public static Property element(String key, PropertyOperator operator, Object value) {
            return new Property(PropertyDomain.ELEMENT, key, operator, value);
        }

        public static Property cohort(Object cohortId) {
            return new Property(PropertyDomain.COHORT, "id", null, cohortId);
        }

        public static Property hogql(String expression) {
            return new Property(PropertyDomain.HOGQL, expression, null, null);
        }

        /**
         * 以同样的 domain/key/operator 替换取值。
         */
        public Property withValue(Object newValue) {
            return new Property(domain, key, operator, newValue);
        }
    }

    /**
     * 布尔组合。combinator 为 null 表示无法识别的组合方式，编译时报错。
     */
    record Group(GroupCombinator combinator, List<FilterSpec> members) implements FilterSpec {
        public Group {
            members = List.copyOf(members);
        }
    }

    record ActionRef(List<ActionStep> steps) implements FilterSpec {
        public ActionRef {
            steps = List.copyOf(steps);
        }
    }

    /**
     * 顶层列表等价于 AND 组合。
     */
    static Group allOf(List<? extends FilterSpec> members) {
        return new Group(GroupCombinator.AND, List.copyOf(members));
    }

    static Group allOf(FilterSpec... members) {
        return allOf(Arrays.asList(members));
    }

    static Group anyOf(FilterSpec... members) {
        return new Group(GroupCombinator.OR, List.of(members));
    }
}
