package com.eventfilter.config;

/**
 * 全局常量定义
 *
 * 包含字段名、事件名、日期默认值与递归深度上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 字段与事件 ====================
    /** 自动采集事件名，只有该事件的 action step 才匹配 DOM 元素 */
    public static final String AUTOCAPTURE_EVENT = "$autocapture";
    /** 序列化元素链字段 */
    public static final String ELEMENTS_CHAIN_FIELD = "elements_chain";
    /** 当前页面 URL 属性 */
    public static final String CURRENT_URL_PROPERTY = "$current_url";
    /** 事件时间字段 */
    public static final String TIMESTAMP_FIELD = "timestamp";
    /** 用户标识字段，cohort 判断的左侧 */
    public static final String PERSON_ID_FIELD = "person_id";
    /** 模板中待替换的过滤占位符名 */
    public static final String FILTERS_PLACEHOLDER = "filters";
    /** 过滤条件默认作用的表 */
    public static final String EVENTS_TABLE = "events";

    // ==================== 日期参数 ====================
    /** 未指定 dateFrom 时的默认起点 */
    public static final String DEFAULT_DATE_FROM = "-7d";
    /** dateFrom 取该值时不加下界 */
    public static final String ALL_TIME = "all";
    /** 未指定 dateTo 时在当前时间基础上的偏移秒数 */
    public static final long DATE_TO_SKEW_SECONDS = 5;
    /** 未指定团队时使用的时区 */
    public static final String DEFAULT_TIMEZONE = "UTC";

    // ==================== 递归参数 ====================
    /** 过滤描述与表达式的最大嵌套深度 */
    public static final int MAX_NESTING_DEPTH = 64;
}
