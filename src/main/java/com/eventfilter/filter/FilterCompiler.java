package com.eventfilter.filter;

import com.eventfilter.ast.CompareOp;
import com.eventfilter.ast.Expr;
import com.eventfilter.ast.ExprRewriter;
import com.eventfilter.config.CompilerConfig;
import com.eventfilter.config.Constants;
import com.eventfilter.parser.ExprParser;
import com.eventfilter.registry.CohortStore;
import com.eventfilter.registry.PropertyType;
import com.eventfilter.registry.PropertyTypeRegistry;
import com.eventfilter.selector.CssSelectorRegexCompiler;
import com.eventfilter.selector.SelectorRegexCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 将过滤描述递归编译为表达式树。
 *
 * <p>编译是纯函数：除了对属性类型登记表与 cohort 存储的只读查找外没有副作用，
 * 实例构造后不可变，可被多个线程同时使用。产出的树中不包含占位符。</p>
 */
public class FilterCompiler {
    private static final Logger logger = LoggerFactory.getLogger(FilterCompiler.class);
    private static final ExprRewriter<String> PLACEHOLDER_CHECK = new UnresolvedPlaceholderCheck();

    private final PropertyTypeRegistry propertyTypes;
    private final CohortStore cohortStore;
    private final ExprParser parser;
    private final ElementMatcher elementMatcher;
    private final ActionCompiler actionCompiler;
    private final int maxDepth;

    public FilterCompiler(PropertyTypeRegistry propertyTypes, CohortStore cohortStore) {
        this(propertyTypes, cohortStore, new CssSelectorRegexCompiler(), CompilerConfig.defaults());
    }

    public FilterCompiler(
            PropertyTypeRegistry propertyTypes,
            CohortStore cohortStore,
            SelectorRegexCompiler selectorCompiler,
            CompilerConfig config) {
        this.propertyTypes = propertyTypes;
        this.cohortStore = cohortStore;
        this.maxDepth = config.getMaxNestingDepth();
        this.parser = new ExprParser(maxDepth);
        this.elementMatcher = new ElementMatcher(parser, selectorCompiler);
        this.actionCompiler = new ActionCompiler(this, elementMatcher, parser);
    }

    /**
     * 编译过滤描述。
     *
     * @param spec 过滤描述
     * @param team 所属团队，可为 null；cohort 过滤与布尔化判断需要团队
     * @return 不含占位符的表达式树
     * @throws FilterException 描述无法编译时抛出，类别见 {@link ErrorKind}
     */
    public Expr compile(FilterSpec spec, TeamContext team) {
        return compile(spec, team, 0);
    }

    /**
     * 顶层列表按 AND 组合。
     */
    public Expr compileAll(List<? extends FilterSpec> specs, TeamContext team) {
        return compile(FilterSpec.allOf(specs), team, 0);
    }

    public ActionCompiler actions() {
        return actionCompiler;
    }

    public ExprParser parser() {
        return parser;
    }

    Expr compile(FilterSpec spec, TeamContext team, int depth) {
        if (depth > maxDepth) {
            throw new FilterException(ErrorKind.NESTING_TOO_DEEP, "过滤描述嵌套超过上限 " + maxDepth);
        }
        if (spec == null) {
            throw FilterException.unsupportedSpec("过滤描述不能为空");
        }
        if (spec instanceof FilterSpec.Group group) {
            return compileGroup(group, team, depth);
        }
        if (spec instanceof FilterSpec.ActionRef actionRef) {
            return actionCompiler.compileSteps(actionRef.steps(), team, depth + 1);
        }
        if (spec instanceof FilterSpec.Property property) {
            return compileProperty(property, team, depth);
        }
        throw FilterException.unsupportedSpec("不支持的过滤描述: " + spec.getClass().getName());
    }

    private Expr compileGroup(FilterSpec.Group group, TeamContext team, int depth) {
        if (group.combinator() == null) {
            throw FilterException.unsupportedSpec("无法识别的属性组合方式");
        }
        List<FilterSpec> members = group.members();
        if (members.isEmpty()) {
            return Expr.TRUE;
        }
        if (members.size() == 1) {
            return compile(members.get(0), team, depth + 1);
        }
        List<Expr> exprs = new ArrayList<>(members.size());
        for (FilterSpec member : members) {
            exprs.add(compile(member, team, depth + 1));
        }
        return group.combinator() == GroupCombinator.AND ? new Expr.And(exprs) : new Expr.Or(exprs);
    }

    private Expr compileProperty(FilterSpec.Property property, TeamContext team, int depth) {
        PropertyDomain domain = property.domain();
        if (domain == null) {
            throw FilterException.unsupportedDomain("属性过滤缺少 type");
        }
        logger.debug("编译属性过滤 type={} key={} operator={}", domain.wireName(), property.key(), property.operator());

        if (domain == PropertyDomain.HOGQL) {
            if (property.key() == null || property.key().isBlank()) {
                throw FilterException.unsupportedSpec("hogql 过滤缺少表达式");
            }
            return PLACEHOLDER_CHECK.rewrite(parser.parseExpr(property.key()), property.key());
        }
        if (!isSupported(domain)) {
            throw FilterException.unsupportedDomain("过滤类型 " + domain.wireName() + " 未实现");
        }

        if (property.value() instanceof List<?> values) {
            if (values.isEmpty()) {
                return Expr.TRUE;
            }
            if (values.size() == 1) {
                return compileProperty(property.withValue(values.get(0)), team, depth);
            }
            List<Expr> exprs = new ArrayList<>(values.size());
            for (Object value : values) {
                exprs.add(compile(property.withValue(value), team, depth + 1));
            }
            return OperatorSemantics.combinesWithAnd(property.operator()) ? new Expr.And(exprs) : new Expr.Or(exprs);
        }

        if (domain == PropertyDomain.ELEMENT) {
            return elementMatcher.compile(property.key(), property.operator(), property.value());
        }
        if (domain.isCohort()) {
            return compileCohort(property, team);
        }
        return compileScalar(property, team);
    }

    private boolean isSupported(PropertyDomain domain) {
        switch (domain) {
            case EVENT:
            case PERSON:
            case FEATURE:
            case ELEMENT:
            case COHORT:
            case STATIC_COHORT:
            case PRECALCULATED_COHORT:
                return true;
            default:
                return false;
        }
    }

    /**
     * 事件、用户、特性属性与单个字面量的比较。
     */
    private Expr compileScalar(FilterSpec.Property property, TeamContext team) {
        if (property.key() == null) {
            throw FilterException.unsupportedSpec("属性过滤缺少 key");
        }
        OperatorSemantics.Rule rule = OperatorSemantics.forProperty(property.operator());
        Expr.Field field = property.domain() == PropertyDomain.PERSON
            ? Expr.Field.of("person", "properties", property.key())
            : Expr.Field.of("properties", property.key());
        Object value = property.value();

        switch (rule.shape()) {
            case NULL_CHECK:
                return new Expr.Compare(rule.op(), field, new Expr.Constant(null));
            case CONTAINS:
                return new Expr.Compare(rule.op(), field, new Expr.Constant("%" + value + "%"));
            case REGEX: {
                Expr match = new Expr.Call("match", List.of(field, new Expr.Constant(value)));
                return rule.negated() ? Expr.Call.not(match) : match;
            }
            case COMPARE:
                return new Expr.Compare(rule.op(), field, new Expr.Constant(coerceLiteral(property, rule, value, team)));
            default:
                throw FilterException.unsupportedOperator("PropertyOperator " + property.operator() + " 未实现");
        }
    }

    /**
     * 布尔属性或未登记类型的属性上，把 "true"/"false" 视为布尔值；声明为其它类型时保留字符串。
     */
    private Object coerceLiteral(FilterSpec.Property property, OperatorSemantics.Rule rule, Object value, TeamContext team) {
        if (!OperatorSemantics.isEquality(rule.op()) || team == null) {
            return value;
        }
        if (!"true".equals(value) && !"false".equals(value)) {
            return value;
        }
        Optional<PropertyType> declared = propertyTypes.lookup(team.id(), property.key(), property.domain());
        if (declared.isEmpty() || declared.get() == PropertyType.BOOLEAN) {
            return Boolean.valueOf((String) value);
        }
        return value;
    }

    private Expr compileCohort(FilterSpec.Property property, TeamContext team) {
        if (team == null) {
            throw new FilterException(ErrorKind.MISSING_TEAM_CONTEXT, "没有团队信息时无法编译 cohort 过滤");
        }
        long cohortKey = cohortStore.resolve(team.id(), toCohortId(property.value()));
        return new Expr.Compare(
            CompareOp.IN_COHORT,
            Expr.Field.of(Constants.PERSON_ID_FIELD),
            new Expr.Constant(cohortKey)
        );
    }

    private long toCohortId(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double id = ((Number) value).doubleValue();
            if (Double.isInfinite(id) || id != Math.rint(id)) {
                throw new FilterException(ErrorKind.NOT_FOUND, "cohort 标识必须是整数: " + value);
            }
            return (long) id;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException exception) {
                throw new FilterException(ErrorKind.NOT_FOUND, "cohort 标识无效: " + text, exception);
            }
        }
        throw new FilterException(ErrorKind.NOT_FOUND, "cohort 标识无效: " + value);
    }

    /**
     * hogql 片段中没有可替换的内容，残留的 {name} 直接拒绝。
     */
    private static final class UnresolvedPlaceholderCheck extends ExprRewriter<String> {
        @Override
        protected Expr rewritePlaceholder(Expr.Placeholder placeholder, String source) {
            throw FilterException.unsupportedSpec(
                "hogql 表达式中存在未替换的占位符 {" + placeholder.field() + "}: " + source);
        }
    }
}
