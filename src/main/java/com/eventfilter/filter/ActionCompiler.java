package com.eventfilter.filter;

import com.eventfilter.action.Action;
import com.eventfilter.action.ActionStep;
import com.eventfilter.action.MatchingMode;
import com.eventfilter.ast.Expr;
import com.eventfilter.config.Constants;
import com.eventfilter.parser.ExprParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 将 action 的 step 列表编译为"任一 step 命中"的 OR 表达式，每个 step 内部为 AND。
 */
public class ActionCompiler {
    private static final Logger logger = LoggerFactory.getLogger(ActionCompiler.class);

    private static final String EVENT_EQUALS = "event = {event}";
    private static final String URL_FIELD = "properties." + Constants.CURRENT_URL_PROPERTY;

    private final FilterCompiler filterCompiler;
    private final ElementMatcher elementMatcher;
    private final ExprParser parser;

    ActionCompiler(FilterCompiler filterCompiler, ElementMatcher elementMatcher, ExprParser parser) {
        this.filterCompiler = filterCompiler;
        this.elementMatcher = elementMatcher;
        this.parser = parser;
    }

    public Expr compile(Action action, TeamContext team) {
        logger.debug("编译 action id={} name={} steps={}", action.id(), action.name(), action.steps().size());
        return compileSteps(action.steps(), team, 0);
    }

    Expr compileSteps(List<ActionStep> steps, TeamContext team, int depth) {
        if (steps.isEmpty()) {
            return Expr.TRUE;
        }
        List<Expr> alternatives = new ArrayList<>(steps.size());
        for (ActionStep step : steps) {
            alternatives.add(compileStep(step, team, depth));
        }
        return alternatives.size() == 1 ? alternatives.get(0) : new Expr.Or(alternatives);
    }

    private Expr compileStep(ActionStep step, TeamContext team, int depth) {
        List<Expr> exprs = new ArrayList<>();
        if (isPresent(step.event())) {
            exprs.add(parser.parseExpr(EVENT_EQUALS, Map.of("event", new Expr.Constant(step.event()))));
        }

        if (Constants.AUTOCAPTURE_EVENT.equals(step.event())) {
            if (isPresent(step.selector())) {
                exprs.add(elementMatcher.selector(step.selector()));
            }
            if (step.tagName() != null) {
                exprs.add(elementMatcher.tagName(step.tagName()));
            }
            if (step.href() != null) {
                exprs.add(elementMatcher.chainKeyFilter("href", step.href(), operatorFor(step.hrefMatching())));
            }
            if (step.text() != null) {
                exprs.add(elementMatcher.chainKeyFilter("text", step.text(), operatorFor(step.textMatching())));
            }
        }

        if (isPresent(step.url())) {
            exprs.add(urlMatch(step.url(), step.urlMatching()));
        }

        if (step.properties() != null && !isEmptyGroup(step.properties())) {
            exprs.add(filterCompiler.compile(step.properties(), team, depth + 1));
        }

        if (exprs.isEmpty()) {
            return Expr.TRUE;
        }
        return exprs.size() == 1 ? exprs.get(0) : new Expr.And(exprs);
    }

    /**
     * 未指定匹配方式的 URL 按包含处理。
     */
    private Expr urlMatch(String url, MatchingMode mode) {
        if (mode == MatchingMode.EXACT) {
            return parser.parseExpr(URL_FIELD + " = {url}", Map.of("url", new Expr.Constant(url)));
        }
        if (mode == MatchingMode.REGEX) {
            return parser.parseExpr(URL_FIELD + " =~ {url}", Map.of("url", new Expr.Constant(url)));
        }
        return parser.parseExpr(URL_FIELD + " ilike {url}", Map.of("url", new Expr.Constant("%" + url + "%")));
    }

    private PropertyOperator operatorFor(MatchingMode mode) {
        if (mode == MatchingMode.REGEX) {
            return PropertyOperator.REGEX;
        }
        if (mode == MatchingMode.CONTAINS) {
            return PropertyOperator.ICONTAINS;
        }
        return PropertyOperator.EXACT;
    }

    private boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }

    private boolean isEmptyGroup(FilterSpec spec) {
        return spec instanceof FilterSpec.Group group && group.members().isEmpty();
    }
}
