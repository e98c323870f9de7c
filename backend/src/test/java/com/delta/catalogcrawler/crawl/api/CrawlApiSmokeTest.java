package com.delta.catalogcrawler.crawl.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CrawlApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statusIsIdleBeforeAnyRun() throws Exception {
        mockMvc.perform(get("/api/crawl/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("IDLE"))
            .andExpect(jsonPath("$.cancelRequested").value(false));
    }

    @Test
    void stopWithoutActiveRunReportsNothingToStop() throws Exception {
        mockMvc.perform(post("/api/crawl/stop"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stopping").value(false));
    }

    @Test
    void keywordReloadSucceeds() throws Exception {
        mockMvc.perform(post("/api/keywords/reload"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reloaded").value(true));
    }

    @Test
    void sessionsEndpointReturnsArray() throws Exception {
        mockMvc.perform(get("/api/crawl/sessions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }
}
