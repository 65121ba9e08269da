package com.wangbin.alerting.core.source;

import com.wangbin.alerting.common.domain.enums.MetricCategory;
import com.wangbin.alerting.common.exception.AlertingException;
import com.wangbin.alerting.common.utils.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * HTTP 指标数据源
 *
 * 请求 GET {baseUrl}/{category}?since={ISO时间}，响应为 JSON 对象数组；
 * 每行的时间字段由 {@link MetricCategory#getTimestampField()} 指定。
 * 超时由 RestTemplate 的连接/读取超时控制。
 */
@Slf4j
public class HttpMetricSource implements MetricSource {

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            text -> OffsetDateTime.parse(text).toInstant(),
            Instant::parse,
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final Clock clock;

    public HttpMetricSource(RestTemplate restTemplate, String baseUrl, Clock clock) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw AlertingException.configInvalid("metric-source", "alerting.metric-source.base-url 不能为空");
        }
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.clock = clock;
    }

    @Override
    public List<MetricRow> query(MetricCategory category, Duration window) {
        Instant since = clock.instant().minus(window);
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment(category.getCode())
                .queryParam("since", since.toString())
                .build()
                .toUri();

        String body;
        try {
            body = restTemplate.getForObject(uri, String.class);
        } catch (RestClientException e) {
            throw AlertingException.dataUnavailable(category.getCode(), "指标查询失败: " + uri, e);
        }

        List<Map<String, Object>> objects;
        try {
            objects = JsonUtil.parseObjectList(body);
        } catch (IllegalArgumentException e) {
            throw AlertingException.dataUnavailable(category.getCode(), "指标响应格式错误: " + uri, e);
        }

        List<MetricRow> rows = new ArrayList<>(objects.size());
        for (Map<String, Object> object : objects) {
            Instant timestamp = parseTimestamp(object.get(category.getTimestampField()));
            rows.add(MetricRow.of(timestamp != null ? timestamp : clock.instant(), object));
        }
        rows.sort(Comparator.comparing(MetricRow::getTimestamp));
        log.debug("从 {} 获取 {} 行指标数据", uri, rows.size());
        return rows;
    }

    @Override
    public String getName() {
        return "http:" + baseUrl;
    }

    static Instant parseTimestamp(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        String text = value.toString().trim();
        DateTimeParseException lastError = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        log.debug("无法解析时间字段: {} ({})", text, lastError != null ? lastError.getMessage() : "");
        return null;
    }
}
