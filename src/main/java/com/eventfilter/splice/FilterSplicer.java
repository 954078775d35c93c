package com.eventfilter.splice;

import com.eventfilter.ast.Expr;
import com.eventfilter.ast.ExprRewriter;
import com.eventfilter.config.CompilerConfig;
import com.eventfilter.config.Constants;
import com.eventfilter.date.DateResolver;
import com.eventfilter.date.DefaultDateResolver;
import com.eventfilter.filter.FilterCompiler;
import com.eventfilter.filter.TeamContext;
import com.eventfilter.parser.ExprParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把查询模板中的 {filters} 占位符替换为属性过滤与时间范围的 AND。
 *
 * <p>模板其余部分按结构复制，其它占位符保持原样。</p>
 */
public class FilterSplicer {
    private static final Logger logger = LoggerFactory.getLogger(FilterSplicer.class);

    private static final String UPPER_BOUND = Constants.TIMESTAMP_FIELD + " < {timestamp}";
    private static final String LOWER_BOUND = Constants.TIMESTAMP_FIELD + " >= {timestamp}";

    private final FilterCompiler compiler;
    private final DateResolver dateResolver;
    private final Clock clock;
    private final CompilerConfig config;

    public FilterSplicer(FilterCompiler compiler) {
        this(compiler, Clock.systemUTC(), CompilerConfig.defaults());
    }

    public FilterSplicer(FilterCompiler compiler, Clock clock, CompilerConfig config) {
        this(compiler, new DefaultDateResolver(clock), clock, config);
    }

    public FilterSplicer(FilterCompiler compiler, DateResolver dateResolver, Clock clock, CompilerConfig config) {
        this.compiler = compiler;
        this.dateResolver = dateResolver;
        this.clock = clock;
        this.config = config;
    }

    /**
     * 替换模板中的 {filters} 占位符。
     *
     * @param template 查询模板
     * @param payload 过滤内容，为 null 时占位符替换为 true
     * @param team 所属团队，可为 null（此时按配置的默认时区解析日期）
     * @return 替换后的新模板，原模板不变
     */
    public Expr splice(Expr template, FilterPayload payload, TeamContext team) {
        return new PlaceholderRewriter(payload, team).rewrite(template, SpliceScope.root());
    }

    /**
     * 先解析文本模板，再替换占位符。
     */
    public Expr splice(String template, FilterPayload payload, TeamContext team) {
        return splice(parser().parse(template, Map.of()), payload, team);
    }

    /**
     * 构造替换 {filters} 的表达式。
     */
    public Expr buildFilters(FilterPayload payload, TeamContext team) {
        if (payload == null || payload.isEmpty()) {
            return Expr.TRUE;
        }
        List<Expr> exprs = new ArrayList<>();
        if (payload.properties() != null) {
            exprs.add(compiler.compile(payload.properties(), team));
        }

        ZoneId zone = team != null ? team.timezone() : config.defaultZone();
        ZonedDateTime dateTo = payload.dateTo() != null
            ? dateResolver.resolve(payload.dateTo(), zone)
            : ZonedDateTime.now(clock).plusSeconds(config.getDateToSkewSeconds()).withZoneSameInstant(zone);
        exprs.add(bound(UPPER_BOUND, dateTo));

        String dateFrom = payload.dateFrom() != null ? payload.dateFrom() : config.getDefaultDateFrom();
        if (!Constants.ALL_TIME.equals(dateFrom)) {
            exprs.add(bound(LOWER_BOUND, dateResolver.resolve(dateFrom, zone)));
        }

        if (exprs.isEmpty()) {
            return Expr.TRUE;
        }
        return exprs.size() == 1 ? exprs.get(0) : new Expr.And(exprs);
    }

    private Expr bound(String template, ZonedDateTime timestamp) {
        return parser().parseExpr(template, Map.of("timestamp", new Expr.Constant(timestamp)));
    }

    private ExprParser parser() {
        return compiler.parser();
    }

    /**
     * 单次替换使用的 rewriter，字段均为不可变输入。
     */
    private final class PlaceholderRewriter extends ExprRewriter<SpliceScope> {
        private final FilterPayload payload;
        private final TeamContext team;

        private PlaceholderRewriter(FilterPayload payload, TeamContext team) {
            this.payload = payload;
            this.team = team;
        }

        @Override
        protected SpliceScope enterSelect(Expr.SelectQuery selectQuery, SpliceScope outer) {
            return outer.enter(selectQuery);
        }

        @Override
        protected Expr rewritePlaceholder(Expr.Placeholder placeholder, SpliceScope scope) {
            if (!Constants.FILTERS_PLACEHOLDER.equals(placeholder.field())) {
                return placeholder;
            }
            if (scope.table() != null && !Constants.EVENTS_TABLE.equals(scope.table())) {
                logger.warn("{filters} 出现在读取表 {} 的查询中（第 {} 层），时间与属性过滤按 events 字段生成",
                    scope.table(), scope.depth());
            }
            return buildFilters(payload, team);
        }
    }
}
