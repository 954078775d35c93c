package com.eventfilter.registry;

/**
 * 只读的 cohort 存储。
 */
public interface CohortStore {

    /**
     * 将团队内的 cohort 标识解析为查询使用的 cohort 键。
     *
     * @throws com.eventfilter.filter.FilterException 类别为 NOT_FOUND，团队内不存在该 cohort 时抛出
     */
    long resolve(long teamId, long cohortId);
}
