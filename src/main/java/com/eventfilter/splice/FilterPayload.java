package com.eventfilter.splice;

import com.eventfilter.filter.FilterSpec;

/**
 * 替换 {filters} 占位符所用的过滤内容，三个字段均可为空。
 *
 * @param properties 属性过滤
 * @param dateFrom 下界，绝对时间或相对表达式；"all" 表示不设下界
 * @param dateTo 上界，绝对时间或相对表达式
 */
public record FilterPayload(FilterSpec properties, String dateFrom, String dateTo) {

    public static FilterPayload ofProperties(FilterSpec properties) {
        return new FilterPayload(properties, null, null);
    }

    public static FilterPayload ofDates(String dateFrom, String dateTo) {
        return new FilterPayload(null, dateFrom, dateTo);
    }

    /**
     * 既没有属性过滤也没有显式日期边界。
     */
    public boolean isEmpty() {
        return properties == null && dateFrom == null && dateTo == null;
    }
}
