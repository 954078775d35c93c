package com.eventfilter.splice;

import com.eventfilter.ast.Expr;

/**
 * 替换过程中的查询作用域，进入子查询时派生新值，不修改外层。
 *
 * @param depth 当前所在的 SELECT 嵌套层数，模板顶层为 0
 * @param table 当前 SELECT 直接读取的表名，子查询或未知来源时为 null
 */
public record SpliceScope(int depth, String table) {

    public static SpliceScope root() {
        return new SpliceScope(0, null);
    }

    public SpliceScope enter(Expr.SelectQuery selectQuery) {
        return new SpliceScope(depth + 1, tableOf(selectQuery.from()));
    }

    private static String tableOf(Expr from) {
        if (from instanceof Expr.Alias alias) {
            return tableOf(alias.expr());
        }
        if (from instanceof Expr.Field field) {
            return String.join(".", field.chain());
        }
        return null;
    }
}
