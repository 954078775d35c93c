package com.eventfilter.registry;

/**
 * 属性定义中声明的取值类型。
 */
public enum PropertyType {
    STRING,
    NUMERIC,
    BOOLEAN,
    DATETIME,
    DURATION
}
