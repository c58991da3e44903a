package com.openforge.gateway.web;

import com.openforge.gateway.config.AppConfig;
import com.openforge.gateway.cost.CostAnalytics;
import com.openforge.gateway.cost.CostTracker;
import com.openforge.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class CostControllerTest {

    private MutableClock clock;
    private CostTracker tracker;
    private CostAnalytics analytics;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-10-15T12:00:00Z");
        tracker = new CostTracker(1.0, 20.0, clock);
        analytics = new CostAnalytics(tracker, 100, Duration.ofMinutes(1), clock);

        mvc = MockMvcBuilders.standaloneSetup(new CostController(tracker, analytics, clock))
                .setControllerAdvice(new GatewayExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new AppConfig().objectMapper()))
                .build();
    }

    @Test
    void statusShouldReflectTrackedUsage() throws Exception {
        tracker.trackUsage("gpt-4o", 50_000, 25_000);

        mvc.perform(get("/v1/costs/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.daily_spend").value(closeTo(0.375, 0.0001)))
                .andExpect(jsonPath("$.daily_percent").value(closeTo(37.5, 0.0001)))
                .andExpect(jsonPath("$.request_count").value(1))
                .andExpect(jsonPath("$.token_count").value(75_000));
    }

    @Test
    void alertsShouldListExceededBudgetFirst() throws Exception {
        for (int i = 0; i < 3; i++) {
            tracker.trackUsage("gpt-4o", 50_000, 25_000);
        }

        mvc.perform(get("/v1/costs/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("daily_budget_exceeded"))
                .andExpect(jsonPath("$[0].level").value("critical"));
    }

    @Test
    void budgetCheckShouldDenyWhenDailyBudgetWouldBeExceeded() throws Exception {
        tracker.trackUsage("gpt-4o", 50_000, 25_000);

        mvc.perform(post("/v1/costs/budget-check").param("estimatedCost", "0.7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(false))
                .andExpect(jsonPath("$.reason").value(containsString("daily budget exceeded")));
        mvc.perform(post("/v1/costs/budget-check").param("estimatedCost", "0.1"))
                .andExpect(jsonPath("$.allowed").value(true));
    }

    @Test
    void budgetCheckWithoutValidAmountShouldBeBadRequest() throws Exception {
        mvc.perform(post("/v1/costs/budget-check"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/v1/costs/budget-check").param("estimatedCost", "lots"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("bad_request"));
    }

    @Test
    void historyShouldDefaultToLastDayAndHonourSince() throws Exception {
        clock.advance(Duration.ofMinutes(2));
        analytics.recordSnapshot();
        clock.advance(Duration.ofMinutes(2));
        analytics.recordSnapshot();

        mvc.perform(get("/v1/costs/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
        mvc.perform(get("/v1/costs/history").param("since", "2026-10-15T12:03:00Z"))
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void trendsAndPredictionShouldRender() throws Exception {
        mvc.perform(get("/v1/costs/trends"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("spend_change")));
        mvc.perform(get("/v1/costs/prediction"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.will_exceed_budget").value(false));
    }
}
