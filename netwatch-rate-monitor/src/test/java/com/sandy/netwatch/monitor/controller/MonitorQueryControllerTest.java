package com.sandy.netwatch.monitor.controller;

import com.sandy.netwatch.monitor.MutableClock;
import com.sandy.netwatch.monitor.TestClockConfig;
import com.sandy.netwatch.monitor.model.Sample;
import com.sandy.netwatch.monitor.service.SeriesStorageService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class MonitorQueryControllerTest {
    @Autowired MockMvc mockMvc;
    @Autowired SeriesStorageService storage;
    @Autowired MutableClock clock;

    @Test
    void listsConfiguredKeys() throws Exception {
        mockMvc.perform(get("/api/monitor/keys"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[*].key", hasItems("total:s", "errors:m")));
    }

    @Test
    void seriesReturnsPointsInRange() throws Exception {
        long now = clock.instant().getEpochSecond();
        for (int i = 0; i < 5; i++) storage.append("api:s", new Sample(now - 100 + i, i));

        mockMvc.perform(get("/api/monitor/series")
                        .param("key", "api:s")
                        .param("start", String.valueOf(now - 99))
                        .param("end", String.valueOf(now - 97)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key", is("api:s")))
                .andExpect(jsonPath("$.points", hasSize(3)))
                .andExpect(jsonPath("$.points[0].value", is(1.0)));

        mockMvc.perform(get("/api/monitor/series").param("key", "api:s"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.points", hasSize(5)));
    }

    @Test
    void invertedSeriesRangeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/monitor/series").param("key", "total:s").param("start", "200").param("end", "100"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void anomaliesOfUnknownKeyAreNotFound() throws Exception {
        mockMvc.perform(get("/api/monitor/anomalies").param("key", "nope:s"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/monitor/anomalies").param("key", "total:s").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key", is("total:s")));
    }

    @Test
    void recentAlertsIncludeRejectedConfiguration() throws Exception {
        mockMvc.perform(get("/api/monitor/alerts/recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].category", hasItem("CONFIGURATION")));
    }

    @Test
    void storageStatisticsAreExposed() throws Exception {
        storage.append("stats:s", new Sample(clock.instant().getEpochSecond(), 1));
        mockMvc.perform(get("/api/monitor/storage/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blocksWritten").isNumber())
                .andExpect(jsonPath("$.keys").isNumber());
    }
}
