package com.eventfilter.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eventfilter.ast.CompareOp;
import com.eventfilter.ast.Expr;
import com.eventfilter.parser.ExprParser;
import com.eventfilter.selector.CssSelectorRegexCompiler;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class ElementMatcherTest {
    private static final Expr.Field CHAIN = Expr.Field.of("elements_chain");

    private final ElementMatcher matcher = new ElementMatcher(new ExprParser(), new CssSelectorRegexCompiler());

    @Test
    void testHrefIcontainsIsCaseInsensitiveWildcardMatch() {
        Expr expr = matcher.compile("href", PropertyOperator.ICONTAINS, "checkout");
        assertEquals(chain(CompareOp.IREGEX, "(href=\"[^\"]*checkout[^\"]*\")"), expr);
    }

    @Test
    void testExactIsEscapedCaseSensitiveMatch() {
        Expr expr = matcher.compile("text", PropertyOperator.EXACT, "Buy now!");
        assertEquals(chain(CompareOp.REGEX, "(text=\"Buy\\ now!\")"), expr);
        Expr dotted = matcher.compile("href", null, "/a.b");
        assertEquals(chain(CompareOp.REGEX, "(href=\"/a\\.b\")"), dotted);
    }

    @Test
    void testNegatedOperatorsWrapInNot() {
        assertEquals(Expr.Call.not(chain(CompareOp.REGEX, "(href=\"x\")")),
            matcher.compile("href", PropertyOperator.IS_NOT, "x"));
        assertEquals(Expr.Call.not(chain(CompareOp.IREGEX, "(text=\"[^\"]*x[^\"]*\")")),
            matcher.compile("text", PropertyOperator.NOT_ICONTAINS, "x"));
        assertEquals(Expr.Call.not(chain(CompareOp.REGEX, "(href=\"[^\"]+\")")),
            matcher.compile("href", PropertyOperator.IS_NOT_SET, "is_not_set"));
    }

    @Test
    void testIsSetAndRegex() {
        assertEquals(chain(CompareOp.REGEX, "(href=\"[^\"]+\")"), matcher.compile("href", PropertyOperator.IS_SET, "is_set"));
        assertEquals(chain(CompareOp.REGEX, "(href=\"^/docs/.*\")"), matcher.compile("href", PropertyOperator.REGEX, "^/docs/.*"));
        assertEquals(Expr.Call.not(chain(CompareOp.REGEX, "(href=\"^/docs\")")),
            matcher.compile("href", PropertyOperator.NOT_REGEX, "^/docs"));
    }

    @Test
    void testDoubleQuotesAreEscapedBeforeRegexEscaping() {
        Expr expr = matcher.compile("text", PropertyOperator.REGEX, "say\"hi");
        assertEquals(chain(CompareOp.REGEX, "(text=\"say\\\"hi\")"), expr);
    }

    @Test
    void testTagName() {
        Expr expr = matcher.compile("tag_name", PropertyOperator.EXACT, "button");
        assertEquals(chain(CompareOp.REGEX, "(^|;)button(\\.|$|;|:)"), expr);
        Pattern pattern = Pattern.compile("(^|;)button(\\.|$|;|:)");
        assertTrue(pattern.matcher("button.btn:attr__class=\"btn\";div").find());
        assertEquals(Expr.Call.not(expr), matcher.compile("tag_name", PropertyOperator.IS_NOT, "button"));
    }

    @Test
    void testSelectorUsesSelectorCompiler() {
        String regex = new CssSelectorRegexCompiler().compile("div > a.nav");
        assertEquals(chain(CompareOp.REGEX, regex), matcher.compile("selector", null, "div > a.nav"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    void testBlankSelectorRejected(String selector) {
        FilterException direct = assertThrows(FilterException.class, () -> matcher.selector(selector));
        assertEquals(ErrorKind.UNSUPPORTED_SPEC, direct.getKind());
        FilterException viaCompile = assertThrows(FilterException.class,
            () -> matcher.compile("selector", PropertyOperator.EXACT, selector));
        assertEquals(ErrorKind.UNSUPPORTED_SPEC, viaCompile.getKind());
    }

    @ParameterizedTest
    @EnumSource(value = PropertyOperator.class, names = {"ICONTAINS", "REGEX", "IS_SET", "GT"})
    void testSelectorAndTagNameRejectOtherOperators(PropertyOperator operator) {
        FilterException selector = assertThrows(FilterException.class, () -> matcher.compile("selector", operator, "a"));
        assertEquals(ErrorKind.UNSUPPORTED_OPERATOR, selector.getKind());
        FilterException tag = assertThrows(FilterException.class, () -> matcher.compile("tag_name", operator, "a"));
        assertEquals(ErrorKind.UNSUPPORTED_OPERATOR, tag.getKind());
    }

    @Test
    void testHrefRejectsOrderingOperators() {
        FilterException exception = assertThrows(FilterException.class, () -> matcher.compile("href", PropertyOperator.GT, "a"));
        assertEquals(ErrorKind.UNSUPPORTED_OPERATOR, exception.getKind());
    }

    @Test
    void testUnknownKey() {
        FilterException exception = assertThrows(FilterException.class, () -> matcher.compile("attr_id", PropertyOperator.EXACT, "a"));
        assertEquals(ErrorKind.UNSUPPORTED_KEY, exception.getKind());
    }

    private static Expr chain(CompareOp op, String regex) {
        return new Expr.Compare(op, CHAIN, new Expr.Constant(regex));
    }
}
