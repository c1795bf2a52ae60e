package com.saurabhshcs.adtech.sagapattern.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "saga.simulation.step-latency=0ms")
@AutoConfigureMockMvc
class OrderApiTest {

    private static final String COOKIE = "session_id";

    @Autowired MockMvc mockMvc;
    @Autowired ObjectMapper objectMapper;

    private Cookie newSession() throws Exception {
        MvcResult result = mockMvc.perform(get("/inventory"))
                .andExpect(status().isOk())
                .andExpect(header().exists(HttpHeaders.SET_COOKIE))
                .andReturn();
        String setCookie = result.getResponse().getHeader(HttpHeaders.SET_COOKIE);
        assertThat(setCookie).startsWith(COOKIE + "=").contains("HttpOnly");
        return new Cookie(COOKIE, setCookie.substring(COOKIE.length() + 1, setCookie.indexOf(';')));
    }

    private JsonNode placeOrder(Cookie session, String userId, String productId, int quantity, double amount) throws Exception {
        String body = String.format("{\"user_id\":\"%s\",\"product_id\":\"%s\",\"quantity\":%d,\"amount\":%s}",
                userId, productId, quantity, amount);
        MvcResult result = mockMvc.perform(post("/orders").cookie(session)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    void successfulOrder_updatesSessionResources() throws Exception {
        Cookie session = newSession();

        JsonNode created = placeOrder(session, "user_1", "product_1", 2, 50.0);

        assertThat(created.get("status").asText()).isEqualTo("completed");
        assertThat(created.get("steps")).hasSize(4);
        mockMvc.perform(get("/inventory").cookie(session))
                .andExpect(jsonPath("$.inventory.product_1").value(98));
        mockMvc.perform(get("/balances").cookie(session))
                .andExpect(jsonPath("$.balances.user_1").value(950.0));
        mockMvc.perform(get("/orders/" + created.get("order_id").asText()).cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.user_id").value("user_1"));
    }

    @Test
    void failedSaga_stillAnswers201WithCompensatedSteps() throws Exception {
        Cookie session = newSession();

        JsonNode created = placeOrder(session, "user_3", "product_1", 3, 30.0);

        assertThat(created.get("status").asText()).isEqualTo("failed");
        mockMvc.perform(get("/sagas/" + created.get("saga_id").asText()).cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.steps[0].status").value("compensated"))
                .andExpect(jsonPath("$.steps[1].status").value("compensated"))
                .andExpect(jsonPath("$.steps[2].status").value("compensated"))
                .andExpect(jsonPath("$.steps[3].status").value("failed"))
                .andExpect(jsonPath("$.steps[3].error_message").value("Shipping address invalid"));
        mockMvc.perform(get("/inventory").cookie(session))
                .andExpect(jsonPath("$.inventory.product_1").value(100));
        mockMvc.perform(get("/balances").cookie(session))
                .andExpect(jsonPath("$.balances.user_3").value(200.0));
    }

    @Test
    void sessionsAreIsolated() throws Exception {
        Cookie first = newSession();
        Cookie second = newSession();

        placeOrder(first, "user_1", "product_2", 10, 100.0);

        mockMvc.perform(get("/inventory").cookie(second))
                .andExpect(jsonPath("$.inventory.product_2").value(50));
        mockMvc.perform(get("/orders").cookie(second))
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void ordersAreListedMostRecentFirst() throws Exception {
        Cookie session = newSession();
        JsonNode older = placeOrder(session, "user_1", "product_1", 1, 10.0);
        JsonNode newer = placeOrder(session, "user_2", "product_2", 1, 10.0);

        mockMvc.perform(get("/orders").cookie(session))
                .andExpect(jsonPath("$[0].id").value(newer.get("order_id").asText()))
                .andExpect(jsonPath("$[1].id").value(older.get("order_id").asText()));
    }

    @Test
    void resetRestoresSeedData() throws Exception {
        Cookie session = newSession();
        placeOrder(session, "user_1", "product_1", 5, 100.0);

        mockMvc.perform(post("/reset").cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Mock database reset to initial state."));

        mockMvc.perform(get("/inventory").cookie(session))
                .andExpect(jsonPath("$.inventory.product_1").value(100));
        mockMvc.perform(get("/orders").cookie(session))
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void unknownOrderAndSagaAre404() throws Exception {
        Cookie session = newSession();

        mockMvc.perform(get("/orders/nope").cookie(session))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Order not found"));
        mockMvc.perform(get("/sagas/nope").cookie(session))
                .andExpect(status().isNotFound());
    }

    @Test
    void invalidRequestIsRejected() throws Exception {
        mockMvc.perform(post("/orders").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\":\"user_1\",\"product_id\":\"product_1\",\"quantity\":0,\"amount\":10}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownCookieGetsAFreshSession() throws Exception {
        MvcResult result = mockMvc.perform(get("/balances").cookie(new Cookie(COOKIE, "forged")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balances.user_1").value(1000.0))
                .andReturn();
        assertThat(result.getResponse().getHeader(HttpHeaders.SET_COOKIE)).doesNotContain("forged");
    }

    @Test
    void healthEndpoint() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }
}
