package com.eventfilter.date;

import com.eventfilter.filter.ErrorKind;
import com.eventfilter.filter.FilterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAdjusters;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 默认日期解析：ISO-8601 绝对时间优先，其次相对表达式 -?N(h|d|w|m|q|y)(Start|End)?。
 *
 * <p>相对表达式以注入的 Clock 为"现在"。除小时外的单位会截断到当天零点，
 * Start/End 分别对齐到所在周期的起点与终点。</p>
 */
public class DefaultDateResolver implements DateResolver {
    private static final Logger logger = LoggerFactory.getLogger(DefaultDateResolver.class);
    private static final DateTimeFormatter ABSOLUTE_FORMAT = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .optionalStart()
        .appendLiteral('[')
        .parseCaseSensitive()
        .appendZoneRegionId()
        .appendLiteral(']')
        .optionalEnd()
        .optionalEnd()
        .toFormatter();
    private static final Pattern RELATIVE_PATTERN = Pattern.compile("^-?(?<number>[0-9]+)?(?<unit>[hdwmqy])(?<position>Start|End)?$");

    private final Clock clock;

    public DefaultDateResolver() {
        this(Clock.systemUTC());
    }

    public DefaultDateResolver(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ZonedDateTime resolve(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            throw new FilterException(ErrorKind.UNPARSABLE_DATE, "日期不能为空");
        }
        String trimmed = text.trim();
        ZonedDateTime absolute = parseAbsolute(trimmed, zone);
        if (absolute != null) {
            return absolute;
        }
        logger.debug("日期 {} 不是绝对时间，按相对表达式解析", trimmed);
        ZonedDateTime relative;
        try {
            relative = parseRelative(trimmed, zone);
        } catch (NumberFormatException | DateTimeException | ArithmeticException exception) {
            throw new FilterException(ErrorKind.UNPARSABLE_DATE, "相对日期超出范围: " + text, exception);
        }
        if (relative != null) {
            return relative;
        }
        throw new FilterException(ErrorKind.UNPARSABLE_DATE, "无法解析日期: " + text);
    }

    /**
     * 按带偏移的时间、本地时间、纯日期的优先级解析，均不匹配时返回 null。
     */
    private ZonedDateTime parseAbsolute(String text, ZoneId zone) {
        String normalized = text.length() > 10 && text.charAt(10) == ' '
            ? text.substring(0, 10) + 'T' + text.substring(11)
            : text;
        TemporalAccessor parsed;
        try {
            parsed = ABSOLUTE_FORMAT.parseBest(normalized, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException exception) {
            return null;
        }
        if (parsed instanceof ZonedDateTime zoned) {
            return zoned.withZoneSameInstant(zone);
        }
        if (parsed instanceof LocalDateTime local) {
            return local.atZone(zone);
        }
        return ((LocalDate) parsed).atStartOfDay(zone);
    }

    private ZonedDateTime parseRelative(String text, ZoneId zone) {
        Matcher matcher = RELATIVE_PATTERN.matcher(text);
        if (!matcher.matches()) {
            return null;
        }
        long amount = matcher.group("number") == null ? 0 : Long.parseLong(matcher.group("number"));
        String position = matcher.group("position");
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);

        switch (matcher.group("unit")) {
            case "h": {
                ZonedDateTime shifted = now.minusHours(amount);
                if ("Start".equals(position)) {
                    return shifted.truncatedTo(ChronoUnit.HOURS);
                }
                if ("End".equals(position)) {
                    return shifted.truncatedTo(ChronoUnit.HOURS).plusHours(1).minusNanos(1000);
                }
                return shifted;
            }
            case "d":
                return alignDay(now.minusDays(amount), position);
            case "w": {
                ZonedDateTime shifted = now.minusWeeks(amount);
                if ("Start".equals(position)) {
                    shifted = shifted.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                } else if ("End".equals(position)) {
                    shifted = shifted.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
                }
                return alignDay(shifted, position);
            }
            case "m": {
                ZonedDateTime shifted = now.minusMonths(amount);
                if ("Start".equals(position)) {
                    shifted = shifted.with(TemporalAdjusters.firstDayOfMonth());
                } else if ("End".equals(position)) {
                    shifted = shifted.with(TemporalAdjusters.lastDayOfMonth());
                }
                return alignDay(shifted, position);
            }
            case "q": {
                ZonedDateTime shifted = now.minusMonths(Math.multiplyExact(amount, 3));
                int firstMonthOfQuarter = (shifted.getMonthValue() - 1) / 3 * 3 + 1;
                if ("Start".equals(position)) {
                    shifted = shifted.withMonth(firstMonthOfQuarter).with(TemporalAdjusters.firstDayOfMonth());
                } else if ("End".equals(position)) {
                    shifted = shifted.withMonth(firstMonthOfQuarter + 2).with(TemporalAdjusters.lastDayOfMonth());
                }
                return alignDay(shifted, position);
            }
            case "y": {
                ZonedDateTime shifted = now.minusYears(amount);
                if ("Start".equals(position)) {
                    shifted = shifted.with(TemporalAdjusters.firstDayOfYear());
                } else if ("End".equals(position)) {
                    shifted = shifted.with(TemporalAdjusters.lastDayOfYear());
                }
                return alignDay(shifted, position);
            }
            default:
                return null;
        }
    }

    /**
     * End 对齐到当天最后一微秒，其它情况对齐到当天零点。
     */
    private ZonedDateTime alignDay(ZonedDateTime dateTime, String position) {
        if ("End".equals(position)) {
            return dateTime.toLocalDate().atTime(LocalTime.of(23, 59, 59, 999_999_000)).atZone(dateTime.getZone());
        }
        return dateTime.toLocalDate().atStartOfDay(dateTime.getZone());
    }
}
