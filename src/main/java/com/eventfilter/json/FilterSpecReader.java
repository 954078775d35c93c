package com.eventfilter.json;

import com.eventfilter.action.Action;
import com.eventfilter.action.ActionStep;
import com.eventfilter.action.MatchingMode;
import com.eventfilter.filter.ErrorKind;
import com.eventfilter.filter.FilterException;
import com.eventfilter.filter.FilterSpec;
import com.eventfilter.filter.GroupCombinator;
import com.eventfilter.filter.PropertyDomain;
import com.eventfilter.filter.PropertyOperator;
import com.eventfilter.splice.FilterPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 从 JSON 读取过滤描述、action 与替换内容。
 *
 * <p>字段名沿用线上格式：属性过滤为 {@code {"type", "key", "operator", "value"}}，
 * 属性组为 {@code {"type": "AND"|"OR", "values": [...]}}，顶层数组等价于 AND 组，
 * 含 {@code steps} 的对象视为 action 引用。</p>
 */
public final class FilterSpecReader {

    private FilterSpecReader() {
    }

    /**
     * 解析过滤描述文本。
     *
     * @throws FilterException JSON 结构无法识别（UNSUPPORTED_SPEC）、未知 type（UNSUPPORTED_DOMAIN）
     *                         或未知运算符（UNSUPPORTED_OPERATOR）时抛出
     */
    public static FilterSpec read(String json) {
        return readSpec(parse(json));
    }

    public static FilterSpec read(Path file) throws IOException {
        return read(readFile(file));
    }

    public static FilterSpec readSpec(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw FilterException.unsupportedSpec("过滤描述不能为空");
        }
        if (node.isArray()) {
            return FilterSpec.allOf(readMembers(node));
        }
        if (!node.isObject()) {
            throw FilterException.unsupportedSpec("无法识别的过滤描述: " + node);
        }
        if (node.has("values")) {
            return readGroup(node);
        }
        if (node.has("steps")) {
            return new FilterSpec.ActionRef(readSteps(node.get("steps")));
        }
        return readProperty(node);
    }

    public static Action readAction(String json) {
        return readAction(parse(json));
    }

    public static Action readAction(Path file) throws IOException {
        return readAction(readFile(file));
    }

    public static Action readAction(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw FilterException.unsupportedSpec("action 必须是 JSON 对象");
        }
        long id = node.path("id").asLong(0L);
        String name = text(node, "name");
        return new Action(id, name, readSteps(node.get("steps")));
    }

    /**
     * 解析 {@code {"properties", "date_from", "date_to"}}，null 或空对象得到空内容。
     */
    public static FilterPayload readPayload(String json) {
        JsonNode node = parse(json);
        if (node.isNull() || node.isMissingNode()) {
            return new FilterPayload(null, null, null);
        }
        if (!node.isObject()) {
            throw FilterException.unsupportedSpec("替换内容必须是 JSON 对象");
        }
        JsonNode properties = node.get("properties");
        FilterSpec spec = properties == null || properties.isNull() ? null : readSpec(properties);
        return new FilterPayload(spec, text(node, "date_from"), text(node, "date_to"));
    }

    public static FilterPayload readPayload(Path file) throws IOException {
        return readPayload(readFile(file));
    }

    private static FilterSpec readGroup(JsonNode node) {
        JsonNode values = node.get("values");
        if (!values.isArray()) {
            throw FilterException.unsupportedSpec("属性组的 values 必须是数组");
        }
        // 无法识别的组合方式留给编译阶段报错
        GroupCombinator combinator = GroupCombinator.fromWireName(text(node, "type"));
        return new FilterSpec.Group(combinator, readMembers(values));
    }

    private static List<FilterSpec> readMembers(JsonNode array) {
        List<FilterSpec> members = new ArrayList<>(array.size());
        for (JsonNode member : array) {
            members.add(readSpec(member));
        }
        return members;
    }

    private static FilterSpec.Property readProperty(JsonNode node) {
        String type = text(node, "type");
        PropertyDomain domain = type == null ? PropertyDomain.EVENT : PropertyDomain.fromWireName(type);
        if (domain == null) {
            throw FilterException.unsupportedDomain("未知的过滤类型: " + type);
        }
        String operatorName = text(node, "operator");
        PropertyOperator operator = null;
        if (operatorName != null) {
            operator = PropertyOperator.fromWireName(operatorName);
            if (operator == null) {
                throw FilterException.unsupportedOperator("未知的运算符: " + operatorName);
            }
        }
        return new FilterSpec.Property(domain, text(node, "key"), operator, toValue(node.get("value")));
    }

    private static List<ActionStep> readSteps(JsonNode steps) {
        if (steps == null || steps.isNull()) {
            return List.of();
        }
        if (!steps.isArray()) {
            throw FilterException.unsupportedSpec("steps 必须是数组");
        }
        List<ActionStep> result = new ArrayList<>(steps.size());
        for (JsonNode step : steps) {
            result.add(readStep(step));
        }
        return result;
    }

    private static ActionStep readStep(JsonNode node) {
        if (!node.isObject()) {
            throw FilterException.unsupportedSpec("action step 必须是 JSON 对象: " + node);
        }
        JsonNode properties = node.get("properties");
        return ActionStep.builder()
            .event(text(node, "event"))
            .selector(text(node, "selector"))
            .tagName(text(node, "tag_name"))
            .href(text(node, "href"), matching(node, "href_matching"))
            .text(text(node, "text"), matching(node, "text_matching"))
            .url(text(node, "url"), matching(node, "url_matching"))
            .properties(properties == null || properties.isNull() ? null : readSpec(properties))
            .build();
    }

    private static MatchingMode matching(JsonNode node, String field) {
        String value = text(node, field);
        try {
            return MatchingMode.fromWireName(value);
        } catch (IllegalArgumentException exception) {
            throw new FilterException(ErrorKind.UNSUPPORTED_SPEC,
                "未知的匹配方式 " + field + "=" + value, exception);
        }
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                if (element.isContainerNode()) {
                    throw FilterException.unsupportedSpec("value 列表只能包含标量: " + node);
                }
                values.add(toValue(element));
            }
            return values;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        throw FilterException.unsupportedSpec("value 不支持该 JSON 结构: " + node);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static JsonNode parse(String json) {
        if (json == null) {
            throw FilterException.unsupportedSpec("JSON 文本不能为空");
        }
        try {
            return ExprJson.mapper().readTree(json);
        } catch (JsonProcessingException exception) {
            throw new FilterException(ErrorKind.UNSUPPORTED_SPEC,
                "JSON 解析失败: " + exception.getOriginalMessage(), exception);
        }
    }

    private static String readFile(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("文件路径不能为空");
        }
        try {
            return Files.readString(file);
        } catch (IOException exception) {
            throw new IOException("读取文件失败: " + file.toAbsolutePath(), exception);
        }
    }
}
