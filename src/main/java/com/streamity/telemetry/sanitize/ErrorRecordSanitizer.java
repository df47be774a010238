package com.streamity.telemetry.sanitize;

import com.streamity.telemetry.model.ErrorRecord;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Neutralizes markup in client-supplied {@link ErrorRecord} fields.
 *
 * Each value is reduced to its text content (tags removed, script and style bodies dropped,
 * whitespace and line breaks collapsed) and then HTML-escaped, so it can be shown in an
 * HTML log viewer and embedded in a single line of a flat-text log.
 */
@Slf4j
@Component
public class ErrorRecordSanitizer {

    public ErrorRecord sanitize(ErrorRecord record) {
        if (record == null) {
            return null;
        }
        return record.toBuilder()
                .timestamp(clean(record.getTimestamp()))
                .message(clean(record.getMessage()))
                .source(clean(record.getSource()))
                .context(clean(record.getContext()))
                .userAgent(clean(record.getUserAgent()))
                .pageUrl(clean(record.getPageUrl()))
                .endpointDns(clean(record.getEndpointDns()))
                .stackTrace(cleanLines(record.getStackTrace()))
                .build();
    }

    /**
     * Strip and escape a single value. Null stays null.
     */
    public String clean(String value) {
        if (value == null) {
            return null;
        }
        try {
            String text = Jsoup.parseBodyFragment(value).text();
            return HtmlUtils.htmlEscape(text, StandardCharsets.UTF_8.name());
        } catch (RuntimeException e) {
            // Falls back to escaping the raw value on one line
            log.debug("Markup stripping failed, escaping raw value instead", e);
            String flat = value.replaceAll("\\s+", " ").trim();
            return HtmlUtils.htmlEscape(flat, StandardCharsets.UTF_8.name());
        }
    }

    private List<String> cleanLines(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }
        return lines.stream()
                .map(this::clean)
                .filter(Objects::nonNull)
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
