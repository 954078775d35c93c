package com.eventfilter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;

/**
 * 编译器运行时配置
 *
 * 支持从CLI参数或 JSON 配置文件注入，覆盖Constants默认值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompilerConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private int maxNestingDepth = Constants.MAX_NESTING_DEPTH;
    private String defaultDateFrom = Constants.DEFAULT_DATE_FROM;
    private long dateToSkewSeconds = Constants.DATE_TO_SKEW_SECONDS;
    private String defaultTimezone = Constants.DEFAULT_TIMEZONE;

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public String getDefaultDateFrom() {
        return defaultDateFrom;
    }

    public void setDefaultDateFrom(String defaultDateFrom) {
        this.defaultDateFrom = defaultDateFrom;
    }

    public long getDateToSkewSeconds() {
        return dateToSkewSeconds;
    }

    public void setDateToSkewSeconds(long dateToSkewSeconds) {
        this.dateToSkewSeconds = dateToSkewSeconds;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    /**
     * 未指定团队时的时区。
     */
    public ZoneId defaultZone() {
        return ZoneId.of(defaultTimezone);
    }

    /**
     * 使用默认配置创建实例
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig();
    }

    /**
     * 从 JSON 文件读取配置，未出现的字段保留默认值。
     *
     * @param file 配置文件
     * @return 配置实例
     * @throws IOException 读取或解析失败时抛出
     */
    public static CompilerConfig load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        try {
            CompilerConfig config = OBJECT_MAPPER.readValue(Files.readAllBytes(file), CompilerConfig.class);
            if (config.getMaxNestingDepth() <= 0) {
                throw new IOException("maxNestingDepth 必须为正数: " + config.getMaxNestingDepth());
            }
            return config;
        } catch (IOException exception) {
            throw new IOException("读取编译器配置失败: " + file.toAbsolutePath(), exception);
        }
    }
}
