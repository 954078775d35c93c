package com.eventfilter.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eventfilter.action.ActionStep;
import com.eventfilter.ast.CompareOp;
import com.eventfilter.ast.Expr;
import com.eventfilter.config.CompilerConfig;
import com.eventfilter.registry.InMemoryCohortStore;
import com.eventfilter.registry.InMemoryPropertyTypeRegistry;
import com.eventfilter.registry.PropertyType;
import com.eventfilter.selector.CssSelectorRegexCompiler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class FilterCompilerTest {
    private static final TeamContext TEAM = TeamContext.of(1L, "UTC");
    private static final Expr.Field BROWSER = Expr.Field.of("properties", "$browser");

    private FilterCompiler compiler;

    @BeforeEach
    void setUp() {
        InMemoryPropertyTypeRegistry registry = InMemoryPropertyTypeRegistry.builder()
            .eventProperty(1L, "is_paid", PropertyType.BOOLEAN)
            .eventProperty(1L, "label", PropertyType.STRING)
            .personProperty(1L, "verified", PropertyType.BOOLEAN)
            .build();
        InMemoryCohortStore cohorts = InMemoryCohortStore.builder()
            .cohort(1L, 5L)
            .cohort(1L, 6L, 600L)
            .build();
        compiler = new FilterCompiler(registry, cohorts);
    }

    @Test
    @DisplayName("事件属性 exact 生成字段等值比较")
    void testEventExact() {
        Expr expr = compile(FilterSpec.Property.event("$browser", PropertyOperator.EXACT, "Chrome"));
        assertEquals(new Expr.Compare(CompareOp.EQ, BROWSER, new Expr.Constant("Chrome")), expr);
    }

    @Test
    void testMissingOperatorDefaultsToExact() {
        Expr expr = compile(FilterSpec.Property.event("$browser", null, "Chrome"));
        assertEquals(new Expr.Compare(CompareOp.EQ, BROWSER, new Expr.Constant("Chrome")), expr);
    }

    @Test
    @DisplayName("用户属性多值 exact 以 OR 组合")
    void testPersonMultiValueIsOr() {
        Expr expr = compile(FilterSpec.Property.person("country", PropertyOperator.EXACT, List.of("US", "CA")));
        Expr.Field country = Expr.Field.of("person", "properties", "country");
        assertEquals(new Expr.Or(List.of(
            new Expr.Compare(CompareOp.EQ, country, new Expr.Constant("US")),
            new Expr.Compare(CompareOp.EQ, country, new Expr.Constant("CA"))
        )), expr);
    }

    @Test
    @DisplayName("is_not 多值以 AND 组合")
    void testIsNotMultiValueIsAnd() {
        Expr expr = compile(FilterSpec.Property.event("plan", PropertyOperator.IS_NOT, List.of("free", "trial")));
        Expr.Field plan = Expr.Field.of("properties", "plan");
        assertEquals(new Expr.And(List.of(
            new Expr.Compare(CompareOp.NOT_EQ, plan, new Expr.Constant("free")),
            new Expr.Compare(CompareOp.NOT_EQ, plan, new Expr.Constant("trial"))
        )), expr);
    }

    @ParameterizedTest
    @EnumSource(value = PropertyOperator.class, names = {"IS_NOT", "NOT_ICONTAINS", "NOT_REGEX"})
    void testNegativeOperatorsCombineWithAnd(PropertyOperator operator) {
        Expr expr = compile(FilterSpec.Property.event("plan", operator, List.of("a", "b")));
        assertInstanceOf(Expr.And.class, expr);
    }

    @ParameterizedTest
    @EnumSource(value = PropertyOperator.class, names = {"EXACT", "ICONTAINS", "REGEX", "GT", "LT"})
    void testPositiveOperatorsCombineWithOr(PropertyOperator operator) {
        Expr expr = compile(FilterSpec.Property.event("plan", operator, List.of("a", "b")));
        assertInstanceOf(Expr.Or.class, expr);
    }

    @ParameterizedTest
    @EnumSource(value = PropertyDomain.class, names = {"EVENT", "PERSON", "FEATURE", "ELEMENT", "COHORT"})
    @DisplayName("空列表取值在任何支持的类型下都编译为 true")
    void testEmptyValueListIsTrue(PropertyDomain domain) {
        Expr expr = compile(new FilterSpec.Property(domain, "href", PropertyOperator.EXACT, List.of()));
        assertEquals(Expr.TRUE, expr);
    }

    @Test
    void testSingleElementListUnwraps() {
        Expr listed = compile(FilterSpec.Property.event("$browser", PropertyOperator.EXACT, List.of("Chrome")));
        Expr scalar = compile(FilterSpec.Property.event("$browser", PropertyOperator.EXACT, "Chrome"));
        assertEquals(scalar, listed);
    }

    @Test
    void testIsSetAndIsNotSet() {
        assertEquals(new Expr.Compare(CompareOp.NOT_EQ, BROWSER, new Expr.Constant(null)),
            compile(FilterSpec.Property.event("$browser", PropertyOperator.IS_SET, "is_set")));
        assertEquals(new Expr.Compare(CompareOp.EQ, BROWSER, new Expr.Constant(null)),
            compile(FilterSpec.Property.event("$browser", PropertyOperator.IS_NOT_SET, null)));
    }

    @Test
    void testContainsWrapsWithWildcards() {
        assertEquals(new Expr.Compare(CompareOp.ILIKE, BROWSER, new Expr.Constant("%chr%")),
            compile(FilterSpec.Property.event("$browser", PropertyOperator.ICONTAINS, "chr")));
        assertEquals(new Expr.Compare(CompareOp.NOT_ILIKE, BROWSER, new Expr.Constant("%chr%")),
            compile(FilterSpec.Property.event("$browser", PropertyOperator.NOT_ICONTAINS, "chr")));
    }

    @Test
    @DisplayName("regex 生成 match 调用，not_regex 外包 not")
    void testRegexUsesMatchCall() {
        Expr match = new Expr.Call("match", List.of(BROWSER, new Expr.Constant("^Chr")));
        assertEquals(match, compile(FilterSpec.Property.event("$browser", PropertyOperator.REGEX, "^Chr")));
        assertEquals(Expr.Call.not(match), compile(FilterSpec.Property.event("$browser", PropertyOperator.NOT_REGEX, "^Chr")));
    }

    @Test
    void testOrderingOperators() {
        Expr.Field amount = Expr.Field.of("properties", "amount");
        assertEquals(new Expr.Compare(CompareOp.GT, amount, new Expr.Constant(10L)),
            compile(FilterSpec.Property.event("amount", PropertyOperator.GT, 10L)));
        assertEquals(new Expr.Compare(CompareOp.LT_EQ, amount, new Expr.Constant(10L)),
            compile(FilterSpec.Property.event("amount", PropertyOperator.LTE, 10L)));
        assertEquals(new Expr.Compare(CompareOp.GT_EQ, amount, new Expr.Constant(10L)),
            compile(FilterSpec.Property.event("amount", PropertyOperator.GTE, 10L)));
        assertEquals(new Expr.Compare(CompareOp.LT, amount, new Expr.Constant("2024-01-01")),
            compile(FilterSpec.Property.event("amount", PropertyOperator.IS_DATE_BEFORE, "2024-01-01")));
    }

    @Test
    @DisplayName("布尔属性上的 \"true\" 转换为布尔值")
    void testBooleanCoercionForDeclaredBoolean() {
        Expr expr = compile(FilterSpec.Property.event("is_paid", PropertyOperator.EXACT, "true"));
        assertEquals(new Expr.Compare(CompareOp.EQ, Expr.Field.of("properties", "is_paid"), new Expr.Constant(Boolean.TRUE)), expr);

        Expr personExpr = compile(FilterSpec.Property.person("verified", PropertyOperator.IS_NOT, "false"));
        assertEquals(new Expr.Compare(CompareOp.NOT_EQ, Expr.Field.of("person", "properties", "verified"),
            new Expr.Constant(Boolean.FALSE)), personExpr);
    }

    @Test
    void testBooleanCoercionForUndeclaredProperty() {
        Expr expr = compile(FilterSpec.Property.event("unknown_flag", PropertyOperator.EXACT, "false"));
        assertEquals(new Expr.Constant(Boolean.FALSE), ((Expr.Compare) expr).right());
    }

    @Test
    @DisplayName("声明为字符串的属性保留 \"true\" 字面量")
    void testNoCoercionForDeclaredString() {
        Expr expr = compile(FilterSpec.Property.event("label", PropertyOperator.EXACT, "true"));
        assertEquals(new Expr.Constant("true"), ((Expr.Compare) expr).right());
    }

    @Test
    void testNoCoercionWithoutTeam() {
        Expr expr = compiler.compile(FilterSpec.Property.event("is_paid", PropertyOperator.EXACT, "true"), null);
        assertEquals(new Expr.Constant("true"), ((Expr.Compare) expr).right());
    }

    @Test
    void testNoCoercionForOtherOperatorsOrValues() {
        Expr gt = compile(FilterSpec.Property.event("is_paid", PropertyOperator.GT, "true"));
        assertEquals(new Expr.Constant("true"), ((Expr.Compare) gt).right());

        Expr upper = compile(FilterSpec.Property.event("is_paid", PropertyOperator.EXACT, "TRUE"));
        assertEquals(new Expr.Constant("TRUE"), ((Expr.Compare) upper).right());
    }

    @Test
    @DisplayName("空组为 true，单成员组等价于直接编译成员")
    void testGroupCollapsing() {
        assertEquals(Expr.TRUE, compile(FilterSpec.allOf(List.of())));
        assertEquals(Expr.TRUE, compile(new FilterSpec.Group(GroupCombinator.OR, List.of())));

        FilterSpec member = FilterSpec.Property.event("$browser", PropertyOperator.EXACT, "Chrome");
        assertEquals(compile(member), compile(FilterSpec.anyOf(member)));
    }

    @Test
    void testNestedGroups() {
        FilterSpec spec = FilterSpec.allOf(
            FilterSpec.Property.event("$browser", PropertyOperator.EXACT, "Chrome"),
            FilterSpec.anyOf(
                FilterSpec.Property.event("plan", PropertyOperator.EXACT, "pro"),
                FilterSpec.Property.person("country", PropertyOperator.EXACT, "US")
            )
        );
        Expr.And and = assertInstanceOf(Expr.And.class, compile(spec));
        assertEquals(2, and.exprs().size());
        Expr.Or or = assertInstanceOf(Expr.Or.class, and.exprs().get(1));
        assertEquals(2, or.exprs().size());
    }

    @Test
    void testCompileAllIsConjunction() {
        Expr expr = compiler.compileAll(List.of(
            FilterSpec.Property.event("a", PropertyOperator.EXACT, "1"),
            FilterSpec.Property.event("b", PropertyOperator.EXACT, "2")
        ), TEAM);
        assertInstanceOf(Expr.And.class, expr);
    }

    @Test
    void testGroupWithUnknownCombinatorFails() {
        FilterSpec spec = new FilterSpec.Group(null, List.of(FilterSpec.Property.event("a", null, "1")));
        FilterException exception = assertThrows(FilterException.class, () -> compile(spec));
        assertEquals(ErrorKind.UNSUPPORTED_SPEC, exception.getKind());
    }

    @Test
    @DisplayName("cohort 过滤解析为 person_id in cohort")
    void testCohort() {
        assertEquals(new Expr.Compare(CompareOp.IN_COHORT, Expr.Field.of("person_id"), new Expr.Constant(5L)),
            compile(FilterSpec.Property.cohort(5)));
        assertEquals(new Expr.Compare(CompareOp.IN_COHORT, Expr.Field.of("person_id"), new Expr.Constant(600L)),
            compile(new FilterSpec.Property(PropertyDomain.STATIC_COHORT, "id", null, "6")));
    }

    @Test
    void testCohortErrors() {
        FilterException missing = assertThrows(FilterException.class, () -> compile(FilterSpec.Property.cohort(99)));
        assertEquals(ErrorKind.NOT_FOUND, missing.getKind());

        FilterException invalid = assertThrows(FilterException.class, () -> compile(FilterSpec.Property.cohort("abc")));
        assertEquals(ErrorKind.NOT_FOUND, invalid.getKind());

        FilterException fractional = assertThrows(FilterException.class, () -> compile(FilterSpec.Property.cohort(5.7)));
        assertEquals(ErrorKind.NOT_FOUND, fractional.getKind());

        FilterException noTeam = assertThrows(FilterException.class,
            () -> compiler.compile(FilterSpec.Property.cohort(5), null));
        assertEquals(ErrorKind.MISSING_TEAM_CONTEXT, noTeam.getKind());
    }

    @Test
    void testHogqlFragmentIsParsed() {
        Expr expr = compile(FilterSpec.Property.hogql("properties.plan = 'pro' and person.properties.age > 18"));
        Expr.And and = assertInstanceOf(Expr.And.class, expr);
        assertEquals(new Expr.Compare(CompareOp.EQ, Expr.Field.of("properties", "plan"), new Expr.Constant("pro")),
            and.exprs().get(0));
        assertEquals(new Expr.Compare(CompareOp.GT, Expr.Field.of("person", "properties", "age"), new Expr.Constant(18L)),
            and.exprs().get(1));
    }

    @Test
    @DisplayName("hogql 片段中未替换的占位符被拒绝")
    void testHogqlUnresolvedPlaceholderRejected() {
        FilterException exception = assertThrows(FilterException.class,
            () -> compiler.compile(FilterSpec.Property.hogql("properties.plan = {filters}"), null));
        assertEquals(ErrorKind.UNSUPPORTED_SPEC, exception.getKind());
        assertTrue(exception.getMessage().contains("{filters}"));

        FilterException nested = assertThrows(FilterException.class,
            () -> compile(FilterSpec.allOf(List.of(
                FilterSpec.Property.event("plan", PropertyOperator.EXACT, "pro"),
                FilterSpec.Property.hogql("count() > {threshold}")
            ))));
        assertEquals(ErrorKind.UNSUPPORTED_SPEC, nested.getKind());
    }

    @Test
    void testHogqlSyntaxError() {
        FilterException exception = assertThrows(FilterException.class,
            () -> compile(FilterSpec.Property.hogql("properties.plan = ")));
        assertEquals(ErrorKind.SYNTAX_ERROR, exception.getKind());
    }

    @ParameterizedTest
    @EnumSource(value = PropertyDomain.class, names = {"GROUP", "SESSION", "RECORDING", "BEHAVIORAL"})
    void testUnsupportedDomains(PropertyDomain domain) {
        FilterException exception = assertThrows(FilterException.class,
            () -> compile(new FilterSpec.Property(domain, "key", PropertyOperator.EXACT, "v")));
        assertEquals(ErrorKind.UNSUPPORTED_DOMAIN, exception.getKind());
    }

    @Test
    void testNullSpecAndMissingDomain() {
        assertEquals(ErrorKind.UNSUPPORTED_SPEC,
            assertThrows(FilterException.class, () -> compile(null)).getKind());
        assertEquals(ErrorKind.UNSUPPORTED_DOMAIN,
            assertThrows(FilterException.class, () -> compile(new FilterSpec.Property(null, "k", null, "v"))).getKind());
    }

    @Test
    void testActionRef() {
        assertEquals(Expr.TRUE, compile(new FilterSpec.ActionRef(List.of())));

        Expr expr = compile(new FilterSpec.ActionRef(List.of(ActionStep.ofEvent("signup"), ActionStep.ofEvent("login"))));
        assertEquals(new Expr.Or(List.of(
            new Expr.Compare(CompareOp.EQ, Expr.Field.of("event"), new Expr.Constant("signup")),
            new Expr.Compare(CompareOp.EQ, Expr.Field.of("event"), new Expr.Constant("login"))
        )), expr);
    }

    @Test
    @DisplayName("编译结果确定，重复编译得到相同的树")
    void testIdempotence() {
        FilterSpec spec = FilterSpec.allOf(
            FilterSpec.Property.person("country", PropertyOperator.EXACT, List.of("US", "CA", "DE")),
            FilterSpec.Property.element("text", PropertyOperator.ICONTAINS, "Buy"),
            FilterSpec.Property.cohort(5)
        );
        assertEquals(compile(spec), compile(spec));
    }

    @Test
    void testNestingLimit() {
        CompilerConfig config = CompilerConfig.defaults();
        config.setMaxNestingDepth(4);
        FilterCompiler shallow = new FilterCompiler(
            InMemoryPropertyTypeRegistry.builder().build(), InMemoryCohortStore.empty(),
            new CssSelectorRegexCompiler(), config);

        FilterSpec spec = FilterSpec.Property.event("a", null, "1");
        for (int i = 0; i < 6; i++) {
            spec = FilterSpec.allOf(spec, FilterSpec.Property.event("b" + i, null, "1"));
        }
        FilterSpec deep = spec;
        FilterException exception = assertThrows(FilterException.class, () -> shallow.compile(deep, TEAM));
        assertEquals(ErrorKind.NESTING_TOO_DEEP, exception.getKind());
    }

    @Test
    void testListValueWithNullMember() {
        List<Object> values = new ArrayList<>(Arrays.asList("a", null));
        Expr.Or or = assertInstanceOf(Expr.Or.class,
            compile(FilterSpec.Property.event("plan", PropertyOperator.EXACT, values)));
        assertEquals(new Expr.Constant(null), ((Expr.Compare) or.exprs().get(1)).right());
        assertFalse(or.exprs().isEmpty());
    }

    private Expr compile(FilterSpec spec) {
        return compiler.compile(spec, TEAM);
    }
}
