package com.eventfilter.selector;

/**
 * 将 CSS 选择器编译为匹配序列化元素链的正则。
 */
public interface SelectorRegexCompiler {

    String compile(String cssSelector);
}
