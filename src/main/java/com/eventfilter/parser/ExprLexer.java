package com.eventfilter.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class ExprLexer {
    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("AND", TokenType.AND),
        Map.entry("OR", TokenType.OR),
        Map.entry("NOT", TokenType.NOT),
        Map.entry("LIKE", TokenType.LIKE),
        Map.entry("ILIKE", TokenType.ILIKE),
        Map.entry("IN", TokenType.IN),
        Map.entry("COHORT", TokenType.COHORT),
        Map.entry("SELECT", TokenType.SELECT),
        Map.entry("FROM", TokenType.FROM),
        Map.entry("WHERE", TokenType.WHERE),
        Map.entry("GROUP", TokenType.GROUP),
        Map.entry("BY", TokenType.BY),
        Map.entry("HAVING", TokenType.HAVING),
        Map.entry("ORDER", TokenType.ORDER),
        Map.entry("ASC", TokenType.ASC),
        Map.entry("DESC", TokenType.DESC),
        Map.entry("LIMIT", TokenType.LIMIT),
        Map.entry("AS", TokenType.AS),
        Map.entry("TRUE", TokenType.TRUE),
        Map.entry("FALSE", TokenType.FALSE),
        Map.entry("NULL", TokenType.NULL)
    );

    /**
     * 将表达式文本切分为 token 序列，末尾总是 EOF。
     */
    public List<LexToken> tokenize(String text) {
        if (text == null) {
            throw new ExprParseException("表达式不能为空", 0, "");
        }

        List<LexToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (Character.isWhitespace(currentChar)) {
                index++;
                continue;
            }

            if (currentChar == '\'') {
                index = readQuoted(text, index, '\'', TokenType.STRING, tokens);
                continue;
            }
            if (currentChar == '"' || currentChar == '`') {
                index = readQuoted(text, index, currentChar, TokenType.QUOTED_IDENT, tokens);
                continue;
            }
            if (Character.isDigit(currentChar)) {
                index = readNumber(text, index, tokens);
                continue;
            }
            if (isIdentifierStart(currentChar)) {
                index = readWord(text, index, tokens);
                continue;
            }

            int operatorLength = readOperator(text, index, tokens);
            if (operatorLength == 0) {
                throw new ExprParseException("无法识别字符: " + currentChar, index, text);
            }
            index += operatorLength;
        }

        tokens.add(new LexToken(TokenType.EOF, "", text.length()));
        return tokens;
    }

    /**
     * 读取符号类 token，返回消费的字符数，无法识别时返回 0。
     */
    private int readOperator(String text, int index, List<LexToken> tokens) {
        char currentChar = text.charAt(index);
        char next = index + 1 < text.length() ? text.charAt(index + 1) : '\0';
        char afterNext = index + 2 < text.length() ? text.charAt(index + 2) : '\0';
        switch (currentChar) {
            case '(':
                return emit(tokens, TokenType.LPAREN, "(", index);
            case ')':
                return emit(tokens, TokenType.RPAREN, ")", index);
            case '{':
                return emit(tokens, TokenType.LBRACE, "{", index);
            case '}':
                return emit(tokens, TokenType.RBRACE, "}", index);
            case ',':
                return emit(tokens, TokenType.COMMA, ",", index);
            case '.':
                return emit(tokens, TokenType.DOT, ".", index);
            case '*':
                return emit(tokens, TokenType.STAR, "*", index);
            case '-':
                return emit(tokens, TokenType.MINUS, "-", index);
            case '=':
                if (next == '~') {
                    return afterNext == '*'
                        ? emit(tokens, TokenType.IREGEX, "=~*", index)
                        : emit(tokens, TokenType.REGEX, "=~", index);
                }
                if (next == '=') {
                    return emit(tokens, TokenType.EQ, "==", index);
                }
                return emit(tokens, TokenType.EQ, "=", index);
            case '!':
                if (next == '=') {
                    return emit(tokens, TokenType.NOT_EQ, "!=", index);
                }
                if (next == '~') {
                    return afterNext == '*'
                        ? emit(tokens, TokenType.NOT_IREGEX, "!~*", index)
                        : emit(tokens, TokenType.NOT_REGEX, "!~", index);
                }
                return 0;
            case '<':
                if (next == '=') {
                    return emit(tokens, TokenType.LT_EQ, "<=", index);
                }
                if (next == '>') {
                    return emit(tokens, TokenType.NOT_EQ, "<>", index);
                }
                return emit(tokens, TokenType.LT, "<", index);
            case '>':
                if (next == '=') {
                    return emit(tokens, TokenType.GT_EQ, ">=", index);
                }
                return emit(tokens, TokenType.GT, ">", index);
            default:
                return 0;
        }
    }

    private int emit(List<LexToken> tokens, TokenType type, String value, int position) {
        tokens.add(new LexToken(type, value, position));
        return value.length();
    }

    /**
     * 读取引号包围的字符串或标识符，支持反斜杠转义与双写引号。
     */
    private int readQuoted(String text, int quoteIndex, char quote, TokenType type, List<LexToken> tokens) {
        int index = quoteIndex + 1;
        StringBuilder valueBuilder = new StringBuilder();
        boolean closed = false;
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (currentChar == '\\' && index + 1 < text.length()) {
                valueBuilder.append(unescape(text.charAt(index + 1)));
                index += 2;
                continue;
            }
            if (currentChar == quote) {
                if (index + 1 < text.length() && text.charAt(index + 1) == quote) {
                    valueBuilder.append(quote);
                    index += 2;
                    continue;
                }
                closed = true;
                index++;
                break;
            }
            valueBuilder.append(currentChar);
            index++;
        }
        if (!closed) {
            throw new ExprParseException("未闭合引号", quoteIndex, text);
        }
        tokens.add(new LexToken(type, valueBuilder.toString(), quoteIndex));
        return index;
    }

    private char unescape(char escaped) {
        switch (escaped) {
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            case '0':
                return '\0';
            default:
                return escaped;
        }
    }

    private int readNumber(String text, int start, List<LexToken> tokens) {
        int index = start;
        boolean seenDot = false;
        while (index < text.length()) {
            char currentChar = text.charAt(index);
            if (Character.isDigit(currentChar)) {
                index++;
                continue;
            }
            if (currentChar == '.' && !seenDot && index + 1 < text.length() && Character.isDigit(text.charAt(index + 1))) {
                seenDot = true;
                index++;
                continue;
            }
            break;
        }
        tokens.add(new LexToken(TokenType.NUMBER, text.substring(start, index), start));
        return index;
    }

    private int readWord(String text, int start, List<LexToken> tokens) {
        int index = start;
        while (index < text.length() && isIdentifierPart(text.charAt(index))) {
            index++;
        }
        String value = text.substring(start, index);
        TokenType keyword = KEYWORDS.get(value.toUpperCase(Locale.ROOT));
        tokens.add(new LexToken(keyword == null ? TokenType.IDENT : keyword, value, start));
        return index;
    }

    private boolean isIdentifierStart(char ch) {
        return Character.isLetter(ch) || ch == '_' || ch == '$';
    }

    private boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }

    /**
     * 判断 token 是否来自一个单词（标识符或关键字），字段链中关键字也可作为段名。
     */
    static boolean isWord(LexToken token) {
        return token.type() == TokenType.IDENT || KEYWORDS.containsValue(token.type());
    }
}
