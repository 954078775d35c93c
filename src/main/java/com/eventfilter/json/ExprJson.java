package com.eventfilter.json;

import com.eventfilter.ast.Expr;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;

/**
 * 表达式树的 JSON 输出，节点类型写在 kind 字段，时间常量输出为 ISO-8601 字符串。
 */
public final class ExprJson {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private static final ObjectWriter WRITER = OBJECT_MAPPER.writerFor(Expr.class);

    private ExprJson() {
    }

    public static String write(Expr expr) {
        return write(expr, false);
    }

    public static String writePretty(Expr expr) {
        return write(expr, true);
    }

    private static String write(Expr expr, boolean pretty) {
        if (expr == null) {
            throw new IllegalArgumentException("表达式不能为空");
        }
        try {
            ObjectWriter writer = pretty ? WRITER.withDefaultPrettyPrinter() : WRITER;
            return writer.writeValueAsString(expr);
        } catch (JsonProcessingException exception) {
            throw new UncheckedIOException("表达式序列化失败", exception);
        }
    }

    static ObjectMapper mapper() {
        return OBJECT_MAPPER;
    }
}
