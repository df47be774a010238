package com.streamity.telemetry.ingest;

import com.streamity.telemetry.store.LogCategory;
import com.streamity.telemetry.store.LogEntryReader;
import com.streamity.telemetry.store.LogStore;
import com.streamity.telemetry.store.ParsedLogEntry;
import com.streamity.telemetry.testutil.MutableClock;
import com.streamity.telemetry.testutil.TestFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.util.List;

import static com.streamity.telemetry.testutil.TestFactory.BASE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class LoggerControllerTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(BASE);
    private LogStore logStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        logStore = TestFactory.logStore(dir, clock);
        mockMvc = TestFactory.mockMvc(TestFactory.ingestionService(logStore, clock, 10));
    }

    @Test
    void testPreflightReturnsEmptyOkWithCorsHeaders() throws Exception {
        mockMvc.perform(options("/logger"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(header().string("Access-Control-Allow-Methods", "POST"))
                .andExpect(header().string("Access-Control-Allow-Headers", "Content-Type"))
                .andExpect(content().string(""));
    }

    @Test
    void testAcceptedReportEchoesClientTimestamp() throws Exception {
        String body = "{\"timestamp\":\"24/01/2026, 12:00:00\",\"message\":\"boom\",\"source\":\"app.js\"}";

        mockMvc.perform(post("/logger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body)
                        .with(request -> {
                            request.setRemoteAddr("203.0.113.7");
                            return request;
                        }))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.message").value("Error logged successfully"))
                .andExpect(jsonPath("$.timestamp").value("24/01/2026, 12:00:00"));

        List<ParsedLogEntry> entries = LogEntryReader.read(logStore.activeFile(LogCategory.APPLICATION));
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).field("IP")).isEqualTo("203.0.113.7");
        assertThat(entries.get(0).field("Source")).isEqualTo("app.js");
    }

    @Test
    void testMissingTimestampFallsBackToServerTime() throws Exception {
        mockMvc.perform(post("/logger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TestFactory.report("boom", "app.js", "render")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timestamp").value("24/01/2026 12:00:00"));
    }

    @Test
    void testLegacyPathIsServed() throws Exception {
        mockMvc.perform(post("/logger.php")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TestFactory.report("boom", "app.js", "render")))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(jsonPath("$.status").value("success"));
    }

    @Test
    void testInvalidBodyIsRejected() throws Exception {
        mockMvc.perform(post("/logger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Failed to log error: Invalid data format"))
                .andExpect(jsonPath("$.timestamp").doesNotExist());

        List<ParsedLogEntry> runtime = LogEntryReader.read(logStore.activeFile(LogCategory.RUNTIME));
        assertThat(runtime).extracting(ParsedLogEntry::message)
                .containsExactly("Failed to log client error: Invalid data format");
    }

    @Test
    void testEmptyBodyIsRejected() throws Exception {
        mockMvc.perform(post("/logger").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Failed to log error: Invalid data format"));
    }

    @Test
    void testOtherMethodsAreNotAllowed() throws Exception {
        mockMvc.perform(get("/logger"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Method not allowed"));

        mockMvc.perform(delete("/logger.php"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"));
    }

    @Test
    void testEleventhReportInWindowIsThrottled() throws Exception {
        for (int i = 0; i < 10; i++) {
            mockMvc.perform(post("/logger")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(TestFactory.report("boom " + i, "app.js", "render")))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(post("/logger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TestFactory.report("one too many", "app.js", "render")))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Rate limit exceeded"));
    }
}
