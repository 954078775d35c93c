package com.eventfilter.registry;

import com.eventfilter.filter.PropertyDomain;

import java.util.Optional;

/**
 * 只读的属性类型登记表，编译时用于 "true"/"false" 字面量的布尔化判断。
 */
public interface PropertyTypeRegistry {

    /**
     * 查找团队内某属性的声明类型。
     *
     * @param teamId 团队 ID
     * @param propertyKey 属性名
     * @param domain 属性所属命名空间，person 之外的命名空间均按事件属性查找
     * @return 声明类型，未登记时为空
     */
    Optional<PropertyType> lookup(long teamId, String propertyKey, PropertyDomain domain);

    /**
     * 不含任何登记的空实现。
     */
    static PropertyTypeRegistry empty() {
        return (teamId, propertyKey, domain) -> Optional.empty();
    }
}
