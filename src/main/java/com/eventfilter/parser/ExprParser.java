package com.eventfilter.parser;

import com.eventfilter.ast.CompareOp;
import com.eventfilter.ast.Expr;
import com.eventfilter.config.Constants;
import com.eventfilter.filter.ErrorKind;
import com.eventfilter.filter.FilterException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 表达式与查询模板解析器。
 *
 * <p>实例不保存解析状态，可被多个线程共享。{name} 形式的占位符若在 substitutions 中
 * 存在则被替换为对应表达式，否则保留为 {@link Expr.Placeholder}。</p>
 */
public class ExprParser {
    private final int maxDepth;

    public ExprParser() {
        this(Constants.MAX_NESTING_DEPTH);
    }

    public ExprParser(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * 按首个关键字选择解析为 SELECT 模板或普通表达式。
     */
    public Expr parse(String text, Map<String, Expr> substitutions) {
        Run run = new Run(text, substitutions);
        Expr result = run.current().type() == TokenType.SELECT ? run.parseSelectQuery() : run.parseExpression();
        run.expectEnd();
        return result;
    }

    public Expr parseExpr(String text) {
        return parseExpr(text, Map.of());
    }

    public Expr parseExpr(String text, Map<String, Expr> substitutions) {
        Run run = new Run(text, substitutions);
        Expr result = run.parseExpression();
        run.expectEnd();
        return result;
    }

    public Expr.SelectQuery parseSelect(String text, Map<String, Expr> substitutions) {
        Run run = new Run(text, substitutions);
        Expr.SelectQuery result = run.parseSelectQuery();
        run.expectEnd();
        return result;
    }

    /**
     * 单次解析的游标状态。
     */
    private final class Run {
        private final List<LexToken> tokens;
        private final String text;
        private final Map<String, Expr> substitutions;
        private int pos;
        private int depth;

        private Run(String text, Map<String, Expr> substitutions) {
            this.tokens = new ExprLexer().tokenize(text);
            this.text = text;
            this.substitutions = substitutions == null ? Map.of() : substitutions;
        }

        private Expr parseExpression() {
            enter();
            Expr expr = parseOr();
            depth--;
            return expr;
        }

        /**
         * 解析 OR 层级，优先级最低，连续的 OR 合并为一个节点。
         */
        private Expr parseOr() {
            Expr left = parseAnd();
            if (current().type() != TokenType.OR) {
                return left;
            }
            List<Expr> operands = new ArrayList<>();
            operands.add(left);
            while (match(TokenType.OR)) {
                operands.add(parseAnd());
            }
            return new Expr.Or(operands);
        }

        private Expr parseAnd() {
            Expr left = parseNot();
            if (current().type() != TokenType.AND) {
                return left;
            }
            List<Expr> operands = new ArrayList<>();
            operands.add(left);
            while (match(TokenType.AND)) {
                operands.add(parseNot());
            }
            return new Expr.And(operands);
        }

        private Expr parseNot() {
            if (match(TokenType.NOT)) {
                enter();
                Expr negated = Expr.Call.not(parseNot());
                depth--;
                return negated;
            }
            return parseComparison();
        }

        /**
         * 解析可选的二元比较，比较不可链式出现。
         */
        private Expr parseComparison() {
            Expr left = parsePrimary();
            CompareOp op = readCompareOp();
            if (op == null) {
                return left;
            }
            Expr right = parsePrimary();
            return new Expr.Compare(op, left, right);
        }

        private CompareOp readCompareOp() {
            LexToken token = current();
            switch (token.type()) {
                case EQ:
                    advance();
                    return CompareOp.EQ;
                case NOT_EQ:
                    advance();
                    return CompareOp.NOT_EQ;
                case LT:
                    advance();
                    return CompareOp.LT;
                case GT:
                    advance();
                    return CompareOp.GT;
                case LT_EQ:
                    advance();
                    return CompareOp.LT_EQ;
                case GT_EQ:
                    advance();
                    return CompareOp.GT_EQ;
                case REGEX:
                    advance();
                    return CompareOp.REGEX;
                case IREGEX:
                    advance();
                    return CompareOp.IREGEX;
                case NOT_REGEX:
                    advance();
                    return CompareOp.NOT_REGEX;
                case NOT_IREGEX:
                    advance();
                    return CompareOp.NOT_IREGEX;
                case LIKE:
                    advance();
                    return CompareOp.LIKE;
                case ILIKE:
                    advance();
                    return CompareOp.ILIKE;
                case NOT:
                    if (peek(1).type() == TokenType.LIKE) {
                        pos += 2;
                        return CompareOp.NOT_LIKE;
                    }
                    if (peek(1).type() == TokenType.ILIKE) {
                        pos += 2;
                        return CompareOp.NOT_ILIKE;
                    }
                    return null;
                case IN:
                    advance();
                    expect(TokenType.COHORT, "in 之后只支持 cohort");
                    return CompareOp.IN_COHORT;
                default:
                    return null;
            }
        }

        /**
         * 解析基础表达式：常量、占位符、字段、函数调用、分组与子查询。
         */
        private Expr parsePrimary() {
            LexToken token = current();
            switch (token.type()) {
                case MINUS:
                    advance();
                    if (current().type() != TokenType.NUMBER) {
                        throw error("负号后缺少数字");
                    }
                    return new Expr.Constant(parseNumber("-" + advance().value()));
                case NUMBER:
                    return new Expr.Constant(parseNumber(advance().value()));
                case STRING:
                    return new Expr.Constant(advance().value());
                case TRUE:
                    advance();
                    return new Expr.Constant(Boolean.TRUE);
                case FALSE:
                    advance();
                    return new Expr.Constant(Boolean.FALSE);
                case NULL:
                    advance();
                    return new Expr.Constant(null);
                case STAR:
                    advance();
                    return Expr.Field.of("*");
                case LBRACE:
                    return parsePlaceholder();
                case LPAREN:
                    return parseGroup();
                case IDENT:
                case QUOTED_IDENT:
                    if (token.type() == TokenType.IDENT && peek(1).type() == TokenType.LPAREN) {
                        return parseCall();
                    }
                    return parseField();
                default:
                    throw error("无法解析表达式: " + describe(token));
            }
        }

        private Expr parsePlaceholder() {
            expect(TokenType.LBRACE, "缺少左花括号");
            LexToken nameToken = current();
            if (!ExprLexer.isWord(nameToken)) {
                throw error("占位符缺少名称");
            }
            advance();
            expect(TokenType.RBRACE, "占位符缺少右花括号");
            Expr substitution = substitutions.get(nameToken.value());
            return substitution != null ? substitution : new Expr.Placeholder(nameToken.value());
        }

        private Expr parseGroup() {
            expect(TokenType.LPAREN, "缺少左括号");
            Expr grouped = current().type() == TokenType.SELECT ? parseSelectQuery() : parseExpression();
            expect(TokenType.RPAREN, "缺少右括号");
            return grouped;
        }

        private Expr parseCall() {
            String name = advance().value();
            expect(TokenType.LPAREN, "函数调用缺少左括号");
            List<Expr> args = new ArrayList<>();
            if (!match(TokenType.RPAREN)) {
                args.add(parseExpression());
                while (match(TokenType.COMMA)) {
                    args.add(parseExpression());
                }
                expect(TokenType.RPAREN, "函数调用缺少右括号");
            }
            return new Expr.Call(name, args);
        }

        private Expr.Field parseField() {
            List<String> chain = new ArrayList<>();
            chain.add(advance().value());
            while (match(TokenType.DOT)) {
                LexToken segment = current();
                if (segment.type() == TokenType.QUOTED_IDENT || ExprLexer.isWord(segment)) {
                    chain.add(advance().value());
                } else if (segment.type() == TokenType.NUMBER) {
                    chain.add(advance().value());
                } else {
                    throw error("字段链中 . 之后缺少名称");
                }
            }
            return new Expr.Field(chain);
        }

        /**
         * 解析 SELECT 模板，子句顺序固定。
         */
        private Expr.SelectQuery parseSelectQuery() {
            enter();
            expect(TokenType.SELECT, "缺少 SELECT");
            List<Expr> select = new ArrayList<>();
            select.add(parseSelectItem());
            while (match(TokenType.COMMA)) {
                select.add(parseSelectItem());
            }

            Expr from = null;
            if (match(TokenType.FROM)) {
                from = parseFromItem();
            }
            Expr where = match(TokenType.WHERE) ? parseExpression() : null;

            List<Expr> groupBy = new ArrayList<>();
            if (match(TokenType.GROUP)) {
                expect(TokenType.BY, "GROUP 之后缺少 BY");
                groupBy.add(parseExpression());
                while (match(TokenType.COMMA)) {
                    groupBy.add(parseExpression());
                }
            }
            Expr having = match(TokenType.HAVING) ? parseExpression() : null;

            List<Expr.OrderExpr> orderBy = new ArrayList<>();
            if (match(TokenType.ORDER)) {
                expect(TokenType.BY, "ORDER 之后缺少 BY");
                orderBy.add(parseOrderItem());
                while (match(TokenType.COMMA)) {
                    orderBy.add(parseOrderItem());
                }
            }

            Long limit = null;
            if (match(TokenType.LIMIT)) {
                LexToken limitToken = current();
                if (limitToken.type() != TokenType.NUMBER || limitToken.value().contains(".")) {
                    throw error("LIMIT 需要整数");
                }
                try {
                    limit = Long.parseLong(limitToken.value());
                } catch (NumberFormatException exception) {
                    throw error("整数超出范围: " + limitToken.value());
                }
                advance();
            }
            depth--;
            return new Expr.SelectQuery(select, from, where, groupBy, having, orderBy, limit);
        }

        private Expr parseSelectItem() {
            Expr expr = parseExpression();
            return parseOptionalAlias(expr);
        }

        private Expr parseFromItem() {
            Expr source;
            if (current().type() == TokenType.LPAREN) {
                source = parseGroup();
                if (!(source instanceof Expr.SelectQuery)) {
                    throw error("FROM 子句中的括号只能包含子查询");
                }
            } else if (current().type() == TokenType.IDENT || current().type() == TokenType.QUOTED_IDENT) {
                source = parseField();
            } else if (current().type() == TokenType.LBRACE) {
                source = parsePlaceholder();
            } else {
                throw error("FROM 之后缺少表名或子查询");
            }
            return parseOptionalAlias(source);
        }

        private Expr parseOptionalAlias(Expr expr) {
            if (!match(TokenType.AS)) {
                return expr;
            }
            LexToken aliasToken = current();
            if (aliasToken.type() != TokenType.IDENT && aliasToken.type() != TokenType.QUOTED_IDENT) {
                throw error("AS 之后缺少别名");
            }
            advance();
            return new Expr.Alias(expr, aliasToken.value());
        }

        private Expr.OrderExpr parseOrderItem() {
            Expr expr = parseExpression();
            if (match(TokenType.DESC)) {
                return new Expr.OrderExpr(expr, true);
            }
            match(TokenType.ASC);
            return new Expr.OrderExpr(expr, false);
        }

        private Object parseNumber(String literal) {
            if (literal.contains(".")) {
                return Double.parseDouble(literal);
            }
            try {
                return Long.parseLong(literal);
            } catch (NumberFormatException exception) {
                throw error("整数超出范围: " + literal);
            }
        }

        private void enter() {
            if (++depth > maxDepth) {
                throw new FilterException(ErrorKind.NESTING_TOO_DEEP, "表达式嵌套超过上限 " + maxDepth);
            }
        }

        private void expectEnd() {
            if (current().type() != TokenType.EOF) {
                throw error("意外token: " + describe(current()));
            }
        }

        private void expect(TokenType type, String message) {
            if (!match(type)) {
                throw error(message);
            }
        }

        private ExprParseException error(String message) {
            return new ExprParseException(message, current().position(), text);
        }

        private String describe(LexToken token) {
            return token.type() == TokenType.EOF ? "<EOF>" : token.value();
        }

        private LexToken current() {
            return tokens.get(pos);
        }

        private LexToken peek(int offset) {
            return tokens.get(Math.min(pos + offset, tokens.size() - 1));
        }

        private LexToken advance() {
            return tokens.get(pos++);
        }

        private boolean match(TokenType type) {
            if (current().type() == type) {
                pos++;
                return true;
            }
            return false;
        }
    }
}
