package com.eventfilter.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * 表达式树节点。节点一经构造即不可变，列表字段均为不可变副本。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Expr.Constant.class, name = "constant"),
    @JsonSubTypes.Type(value = Expr.Field.class, name = "field"),
    @JsonSubTypes.Type(value = Expr.Compare.class, name = "compare"),
    @JsonSubTypes.Type(value = Expr.And.class, name = "and"),
    @JsonSubTypes.Type(value = Expr.Or.class, name = "or"),
    @JsonSubTypes.Type(value = Expr.Call.class, name = "call"),
    @JsonSubTypes.Type(value = Expr.Placeholder.class, name = "placeholder"),
    @JsonSubTypes.Type(value = Expr.Alias.class, name = "alias"),
    @JsonSubTypes.Type(value = Expr.OrderExpr.class, name = "order"),
    @JsonSubTypes.Type(value = Expr.SelectQuery.class, name = "select")
})
public sealed interface Expr permits Expr.Constant, Expr.Field, Expr.Compare, Expr.And, Expr.Or,
        Expr.Call, Expr.Placeholder, Expr.Alias, Expr.OrderExpr, Expr.SelectQuery {

    Constant TRUE = new Constant(Boolean.TRUE);

    /** 常量：Boolean、String、Number、ZonedDateTime 或 null */
    record Constant(Object value) implements Expr {
    }

    record Field(List<String> chain) implements Expr {
        public Field {
            chain = List.copyOf(chain);
        }

        public static Field of(String... chain) {
            return new Field(List.of(chain));
        }
    }

    record Compare(CompareOp op, Expr left, Expr right) implements Expr {
        public Compare {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record And(List<Expr> exprs) implements Expr {
        public And {
            exprs = List.copyOf(exprs);
        }
    }

    record Or(List<Expr> exprs) implements Expr {
        public Or {
            exprs = List.copyOf(exprs);
        }
    }

    record Call(String name, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }

        public static Call not(Expr expr) {
            return new Call("not", List.of(expr));
        }
    }

    /** 模板中的未解析占位符，编译结果中不应出现 */
    record Placeholder(String field) implements Expr {
    }

    record Alias(Expr expr, String alias) implements Expr {
    }

    record OrderExpr(Expr expr, boolean descending) implements Expr {
    }

    /**
     * 查询模板。from 为表名 Field、子查询或其 Alias；可选部分为 null 或空列表。
     */
    record SelectQuery(
        List<Expr> select,
        Expr from,
        Expr where,
        List<Expr> groupBy,
        Expr having,
        List<OrderExpr> orderBy,
        Long limit
    ) implements Expr {
        public SelectQuery {
            select = List.copyOf(select);
            groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
            orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        }
    }
}
