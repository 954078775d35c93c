package com.eventfilter.filter;

import java.time.ZoneId;
import java.util.Objects;

/**
 * 编译所属团队：决定属性类型与 cohort 的查找范围，以及相对日期的时区。
 */
public record TeamContext(long id, ZoneId timezone) {
    public TeamContext {
        Objects.requireNonNull(timezone, "timezone");
    }

    public static TeamContext of(long id, String timezone) {
        return new TeamContext(id, ZoneId.of(timezone));
    }
}
