package com.eventfilter.selector;

import com.eventfilter.filter.RegexEscaper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CSS 选择器到元素链正则的默认实现。
 *
 * <p>元素链中最内层元素在前，因此选择器各部分按逆序生成正则。支持标签名、.class、#id、
 * [attr='value'] 与 :nth-child(n)，以及后代与直接子代（&gt;）两种组合方式。</p>
 */
public class CssSelectorRegexCompiler implements SelectorRegexCompiler {
    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile("(.*?)\\[(.*)=['|\"](.*)['|\"]\\]");
    private static final String ELEMENT_TERMINATOR = "([-_a-zA-Z0-9\\.:]*?)?($|;|:([^;^\\s]*(;|$|\\s)))";

    /**
     * 选择器中的单个元素描述。
     */
    record SelectorPart(String tagName, List<String> classes, Map<String, String> attributes, boolean directDescendant) {
    }

    @Override
    public String compile(String cssSelector) {
        StringBuilder regex = new StringBuilder();
        for (SelectorPart part : parse(cssSelector)) {
            if (part.tagName() != null && !part.tagName().isEmpty() && !"*".equals(part.tagName())) {
                regex.append(RegexEscaper.escape(part.tagName()));
            }
            if (!part.classes().isEmpty()) {
                List<String> escapedClasses = new ArrayList<>();
                for (String className : part.classes()) {
                    escapedClasses.add(RegexEscaper.escape(className));
                }
                regex.append(".*?\\.").append(String.join("\\..*?", escapedClasses));
            }
            if (!part.attributes().isEmpty()) {
                regex.append(".*?");
                for (Map.Entry<String, String> attribute : part.attributes().entrySet()) {
                    regex.append(RegexEscaper.escape(attribute.getKey()))
                        .append("=\"")
                        .append(RegexEscaper.escape(attribute.getValue()))
                        .append("\".*?");
                }
            }
            regex.append(ELEMENT_TERMINATOR);
            if (part.directDescendant()) {
                regex.append(".*");
            }
        }
        return regex.toString();
    }

    /**
     * 将选择器拆分为元素描述，顺序为最内层在前。
     */
    List<SelectorPart> parse(String cssSelector) {
        String normalized = cssSelector.replace("> * > ", "").replace("> *", "").trim();
        List<String> tags = split(normalized);
        Collections.reverse(tags);

        List<SelectorPart> parts = new ArrayList<>();
        for (int index = 0; index < tags.size(); index++) {
            String tag = tags.get(index);
            if (">".equals(tag) || tag.isEmpty()) {
                continue;
            }
            boolean directDescendant = index > 0 && ">".equals(tags.get(index - 1));
            parts.add(parsePart(tag, directDescendant));
        }
        return parts;
    }

    private SelectorPart parsePart(String rawTag, boolean directDescendant) {
        String tag = rawTag;
        Map<String, String> attributes = new TreeMap<>();

        Matcher matcher = ATTRIBUTE_PATTERN.matcher(tag);
        if (matcher.find()) {
            String attributeName = "id".equals(matcher.group(2)) ? "attr_id" : matcher.group(2);
            attributes.put(attributeName, matcher.group(3));
            tag = matcher.group(1);
        }

        if (tag.contains(":nth-child(")) {
            String[] pieces = tag.split(":nth-child\\(", 2);
            attributes.put("nth-child", pieces[1].replace(")", ""));
            tag = pieces[0];
        }

        List<String> classes = new ArrayList<>();
        if (tag.contains(".")) {
            String[] pieces = tag.split("\\.");
            for (int index = 1; index < pieces.length; index++) {
                if (!pieces[index].isEmpty()) {
                    classes.add(pieces[index]);
                }
            }
            Collections.sort(classes);
            tag = pieces.length == 0 ? "" : pieces[0];
        }

        if (tag.contains("#")) {
            String[] pieces = tag.split("#", 2);
            attributes.put("attr_id", pieces[1]);
            tag = pieces[0];
        }

        return new SelectorPart(tag.isEmpty() ? null : tag, List.copyOf(classes), attributes, directDescendant);
    }

    /**
     * 按空格切分，属性选择器与引号内的空格不切分。
     */
    private List<String> split(String selector) {
        List<String> tags = new ArrayList<>();
        boolean inAttributeSelector = false;
        char inQuotes = 0;
        StringBuilder current = new StringBuilder();
        for (int index = 0; index < selector.length(); index++) {
            char ch = selector.charAt(index);
            if (ch == '[' && inQuotes == 0) {
                inAttributeSelector = true;
            }
            if (ch == ']' && inQuotes == 0) {
                inAttributeSelector = false;
            }
            if (ch == '"' || ch == '\'') {
                if (inQuotes != 0) {
                    if (inQuotes == ch) {
                        inQuotes = 0;
                    }
                } else {
                    inQuotes = ch;
                }
            }
            if (ch == ' ' && !inAttributeSelector) {
                tags.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        tags.add(current.toString());
        return tags;
    }
}
