package com.streamity.telemetry.store;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads log files written by {@link LogStore} back into {@link ParsedLogEntry} items.
 */
public final class LogEntryReader {

    private static final Pattern HEADER = Pattern.compile("^\\[(.+?)] \\[([A-Z ]+)](?: (.*))?$");

    private LogEntryReader() {
    }

    public static List<ParsedLogEntry> read(Path file) throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader.lines().toList());
        }
    }

    public static List<ParsedLogEntry> parse(List<String> lines) {
        List<ParsedLogEntry> entries = new ArrayList<>();

        String timestamp = null;
        String level = null;
        Map<String, String> fields = null;
        List<String> stack = null;
        boolean inStack = false;

        for (String line : lines) {
            if (fields == null) {
                Matcher m = HEADER.matcher(line);
                if (!m.matches()) {
                    continue;
                }
                if (m.group(3) != null) {
                    entries.add(new ParsedLogEntry(m.group(1), m.group(2), m.group(3), Map.of(), List.of()));
                    continue;
                }
                timestamp = m.group(1);
                level = m.group(2);
                fields = new LinkedHashMap<>();
                stack = new ArrayList<>();
                inStack = false;
                continue;
            }

            if (line.equals(LogEntryFormatter.SEPARATOR)) {
                entries.add(new ParsedLogEntry(timestamp, level, fields.get("Message"),
                        Collections.unmodifiableMap(fields), List.copyOf(stack)));
                fields = null;
                stack = null;
                continue;
            }

            if (inStack && line.startsWith(LogEntryFormatter.STACK_INDENT)) {
                stack.add(line.substring(LogEntryFormatter.STACK_INDENT.length()));
                continue;
            }
            inStack = false;

            String body = line.startsWith(LogEntryFormatter.FIELD_INDENT)
                    ? line.substring(LogEntryFormatter.FIELD_INDENT.length())
                    : line;
            if (body.equals(LogEntryFormatter.STACK_HEADER)) {
                inStack = true;
                continue;
            }
            int colon = body.indexOf(": ");
            if (colon > 0) {
                fields.put(body.substring(0, colon), body.substring(colon + 2));
            }
        }
        return entries;
    }
}
