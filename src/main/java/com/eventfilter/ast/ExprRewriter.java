package com.eventfilter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 表达式树的结构化复制。
 *
 * <p>上下文 C 按值向下传递：进入子查询时由 {@link #enterSelect} 返回新的上下文，
 * 不在实例上保存可变的作用域栈，同一个 rewriter 可被并发复用。</p>
 *
 * @param <C> 递归过程中向下传递的上下文类型
 */
public abstract class ExprRewriter<C> {

    public Expr rewrite(Expr node, C context) {
        if (node == null) {
            return null;
        }
        if (node instanceof Expr.Placeholder placeholder) {
            return rewritePlaceholder(placeholder, context);
        }
        if (node instanceof Expr.Constant) {
            return node;
        }
        if (node instanceof Expr.Field field) {
            return new Expr.Field(field.chain());
        }
        if (node instanceof Expr.Compare compare) {
            return new Expr.Compare(compare.op(), rewrite(compare.left(), context), rewrite(compare.right(), context));
        }
        if (node instanceof Expr.And and) {
            return new Expr.And(rewriteAll(and.exprs(), context));
        }
        if (node instanceof Expr.Or or) {
            return new Expr.Or(rewriteAll(or.exprs(), context));
        }
        if (node instanceof Expr.Call call) {
            return new Expr.Call(call.name(), rewriteAll(call.args(), context));
        }
        if (node instanceof Expr.Alias alias) {
            return new Expr.Alias(rewrite(alias.expr(), context), alias.alias());
        }
        if (node instanceof Expr.OrderExpr orderExpr) {
            return rewriteOrder(orderExpr, context);
        }
        if (node instanceof Expr.SelectQuery selectQuery) {
            return rewriteSelect(selectQuery, enterSelect(selectQuery, context));
        }
        throw new IllegalStateException("未知表达式节点: " + node.getClass().getName());
    }

    /**
     * 默认保留占位符本身。
     */
    protected Expr rewritePlaceholder(Expr.Placeholder placeholder, C context) {
        return placeholder;
    }

    /**
     * 进入子查询时派生新的上下文，默认沿用外层上下文。
     */
    protected C enterSelect(Expr.SelectQuery selectQuery, C outer) {
        return outer;
    }

    protected Expr.SelectQuery rewriteSelect(Expr.SelectQuery node, C scope) {
        List<Expr.OrderExpr> orderBy = new ArrayList<>(node.orderBy().size());
        for (Expr.OrderExpr orderExpr : node.orderBy()) {
            orderBy.add(rewriteOrder(orderExpr, scope));
        }
        return new Expr.SelectQuery(
            rewriteAll(node.select(), scope),
            rewrite(node.from(), scope),
            rewrite(node.where(), scope),
            rewriteAll(node.groupBy(), scope),
            rewrite(node.having(), scope),
            orderBy,
            node.limit()
        );
    }

    private Expr.OrderExpr rewriteOrder(Expr.OrderExpr node, C context) {
        return new Expr.OrderExpr(rewrite(node.expr(), context), node.descending());
    }

    private List<Expr> rewriteAll(List<Expr> nodes, C context) {
        List<Expr> rewritten = new ArrayList<>(nodes.size());
        for (Expr node : nodes) {
            rewritten.add(rewrite(node, context));
        }
        return rewritten;
    }
}
