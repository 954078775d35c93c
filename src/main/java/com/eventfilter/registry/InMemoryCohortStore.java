package com.eventfilter.registry;

import com.eventfilter.filter.ErrorKind;
import com.eventfilter.filter.FilterException;

import java.util.HashMap;
import java.util.Map;

/**
 * 基于内存映射的 cohort 存储，构造后不可变。
 */
public final class InMemoryCohortStore implements CohortStore {
    private record Key(long teamId, long cohortId) {
    }

    private final Map<Key, Long> cohorts;

    private InMemoryCohortStore(Map<Key, Long> cohorts) {
        this.cohorts = Map.copyOf(cohorts);
    }

    @Override
    public long resolve(long teamId, long cohortId) {
        Long cohortKey = cohorts.get(new Key(teamId, cohortId));
        if (cohortKey == null) {
            throw new FilterException(ErrorKind.NOT_FOUND,
                "cohort 不存在: teamId=" + teamId + ", cohortId=" + cohortId);
        }
        return cohortKey;
    }

    public int size() {
        return cohorts.size();
    }

    public static InMemoryCohortStore empty() {
        return new InMemoryCohortStore(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Key, Long> cohorts = new HashMap<>();

        private Builder() {
        }

        /**
         * 登记 cohort，其查询键与 ID 相同。
         */
        public Builder cohort(long teamId, long cohortId) {
            return cohort(teamId, cohortId, cohortId);
        }

        public Builder cohort(long teamId, long cohortId, long cohortKey) {
            cohorts.put(new Key(teamId, cohortId), cohortKey);
            return this;
        }

        public InMemoryCohortStore build() {
            return new InMemoryCohortStore(cohorts);
        }
    }
}
