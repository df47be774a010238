package com.streamity.telemetry.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw request body into an {@link ErrorRecord}.
 *
 * Clients are browsers and other untrusted callers, so field types are taken
 * loosely: scalars become their text, nested structures their JSON text,
 * and {@code stack} may be either an array of lines or one newline-separated string.
 */
@Component
@RequiredArgsConstructor
public class ErrorRecordParser {

    public static final String INVALID_DATA_FORMAT = "Invalid data format";

    private final ObjectMapper objectMapper;

    /**
     * Parse a JSON body.
     *
     * @param body raw request body, may be null
     * @return the parsed record, never null
     * @throws InvalidErrorRecordException if the body is not a JSON object with a non-blank {@code message}
     */
    public ErrorRecord parse(String body) {
        if (body == null || body.isBlank()) {
            throw new InvalidErrorRecordException(INVALID_DATA_FORMAT);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidErrorRecordException(INVALID_DATA_FORMAT, e);
        }

        if (root == null || !root.isObject() || root.isEmpty()) {
            throw new InvalidErrorRecordException(INVALID_DATA_FORMAT);
        }

        String message = text(root.get("message"));
        if (message == null || message.isBlank()) {
            throw new InvalidErrorRecordException(INVALID_DATA_FORMAT);
        }

        return ErrorRecord.builder()
                .timestamp(blankToNull(text(root.get("timestamp"))))
                .message(message)
                .source(text(root.get("source")))
                .context(text(root.get("context")))
                .userAgent(text(root.get("userAgent")))
                .pageUrl(text(root.get("url")))
                .endpointDns(text(root.get("dns")))
                .corsEnabled(flag(root.get("cors")))
                .httpsEnabled(flag(root.get("https")))
                .stackTrace(stack(root.get("stack")))
                .build();
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }

    /**
     * Loose truthiness: false, 0, "", "0" and "false" are false, any other present value is true.
     */
    private static Boolean flag(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0d;
        }
        if (node.isTextual()) {
            String v = node.textValue().trim();
            return !(v.isEmpty() || "0".equals(v) || "false".equalsIgnoreCase(v));
        }
        return !node.isEmpty();
    }

    private static List<String> stack(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                String line = text(element);
                if (line != null) {
                    lines.add(line);
                }
            }
        } else {
            for (String line : text(node).split("\\R")) {
                lines.add(line);
            }
        }
        return List.copyOf(lines);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
