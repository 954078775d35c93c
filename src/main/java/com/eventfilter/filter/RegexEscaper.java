package com.eventfilter.filter;

/**
 * 转义正则元字符，使文本在元素链正则中按字面匹配。
 */
public final class RegexEscaper {
    private static final String SPECIAL_CHARS = "()[]{}?*+-|^$\\.&~# \t\n\r\u000B\f";

    private RegexEscaper() {
    }

    public static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length() + 8);
        for (int index = 0; index < text.length(); index++) {
            char ch = text.charAt(index);
            if (SPECIAL_CHARS.indexOf(ch) >= 0) {
                escaped.append('\\');
            }
            escaped.append(ch);
        }
        return escaped.toString();
    }
}
