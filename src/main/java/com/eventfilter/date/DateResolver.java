package com.eventfilter.date;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 将过滤条件中的日期字符串解析为绝对时间。
 */
public interface DateResolver {

    /**
     * 先按 ISO-8601 绝对时间解析，失败后按相对表达式（如 "-7d"、"-24h"、"mStart"）解析。
     *
     * @param text 日期字符串
     * @param zone 团队时区，用于无偏移的时间与相对表达式
     * @return 解析后的绝对时间
     * @throws com.eventfilter.filter.FilterException 类别为 UNPARSABLE_DATE，两种解析均失败时抛出
     */
    ZonedDateTime resolve(String text, ZoneId zone);
}
