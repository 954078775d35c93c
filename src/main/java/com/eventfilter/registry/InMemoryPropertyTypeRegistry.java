package com.eventfilter.registry;

import com.eventfilter.filter.PropertyDomain;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 基于内存映射的属性类型登记表，构造后不可变。
 */
public final class InMemoryPropertyTypeRegistry implements PropertyTypeRegistry {

    /** 属性定义分为事件属性与用户属性两类 */
    public enum DefinitionType {
        EVENT,
        PERSON;

        public static DefinitionType of(PropertyDomain domain) {
            return domain == PropertyDomain.PERSON ? PERSON : EVENT;
        }
    }

    private record Key(long teamId, String propertyKey, DefinitionType type) {
    }

    private final Map<Key, PropertyType> types;

    private InMemoryPropertyTypeRegistry(Map<Key, PropertyType> types) {
        this.types = Map.copyOf(types);
    }

    @Override
    public Optional<PropertyType> lookup(long teamId, String propertyKey, PropertyDomain domain) {
        return Optional.ofNullable(types.get(new Key(teamId, propertyKey, DefinitionType.of(domain))));
    }

    public int size() {
        return types.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Key, PropertyType> types = new HashMap<>();

        private Builder() {
        }

        public Builder eventProperty(long teamId, String propertyKey, PropertyType type) {
            return define(teamId, propertyKey, DefinitionType.EVENT, type);
        }

        public Builder personProperty(long teamId, String propertyKey, PropertyType type) {
            return define(teamId, propertyKey, DefinitionType.PERSON, type);
        }

        public Builder define(long teamId, String propertyKey, DefinitionType definitionType, PropertyType type) {
            types.put(new Key(teamId, propertyKey, definitionType), type);
            return this;
        }

        public InMemoryPropertyTypeRegistry build() {
            return new InMemoryPropertyTypeRegistry(types);
        }
    }
}
