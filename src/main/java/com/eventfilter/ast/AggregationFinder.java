package com.eventfilter.ast;

import java.util.Locale;
import java.util.Set;

/**
 * 判断表达式中是否调用了聚合函数。子查询内部的聚合不计入。
 */
public final class AggregationFinder {
    private static final Set<String> AGGREGATIONS = Set.of(
        "count", "countif", "countdistinct",
        "sum", "sumif", "avg", "avgif", "min", "minif", "max", "maxif",
        "any", "anylast", "argmin", "argmax",
        "uniq", "uniqif", "uniqexact",
        "grouparray", "groupuniqarray",
        "median", "quantile", "quantiles"
    );

    private AggregationFinder() {
    }

    public static boolean hasAggregation(Expr expr) {
        if (expr == null || expr instanceof Expr.SelectQuery) {
            return false;
        }
        if (expr instanceof Expr.Call call) {
            if (isAggregation(call.name())) {
                return true;
            }
            return call.args().stream().anyMatch(AggregationFinder::hasAggregation);
        }
        if (expr instanceof Expr.Compare compare) {
            return hasAggregation(compare.left()) || hasAggregation(compare.right());
        }
        if (expr instanceof Expr.And and) {
            return and.exprs().stream().anyMatch(AggregationFinder::hasAggregation);
        }
        if (expr instanceof Expr.Or or) {
            return or.exprs().stream().anyMatch(AggregationFinder::hasAggregation);
        }
        if (expr instanceof Expr.Alias alias) {
            return hasAggregation(alias.expr());
        }
        if (expr instanceof Expr.OrderExpr orderExpr) {
            return hasAggregation(orderExpr.expr());
        }
        return false;
    }

    public static boolean isAggregation(String functionName) {
        return functionName != null && AGGREGATIONS.contains(functionName.toLowerCase(Locale.ROOT));
    }
}
