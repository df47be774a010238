package com.streamity.telemetry;

import com.streamity.telemetry.ratelimit.InMemoryRateLimitCounterStore;
import com.streamity.telemetry.ratelimit.RateLimitCounterStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "telemetry.log.dir=target/test-logs",
        "telemetry.rate-limit.max-requests=1000"
})
class TelemetryApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RateLimitCounterStore counterStore;

    @Test
    void testContextWiresTheDefaultPipeline() throws Exception {
        assertThat(counterStore).isInstanceOf(InMemoryRateLimitCounterStore.class);

        mockMvc.perform(post("/logger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"context smoke test\",\"source\":\"it\",\"context\":\"boot\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(jsonPath("$.status").value("success"));

        mockMvc.perform(options("/logger.php"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Methods", "POST"));

        mockMvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reportsAccepted").isNumber());
    }
}
