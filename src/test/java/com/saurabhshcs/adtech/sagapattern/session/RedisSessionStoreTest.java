package com.saurabhshcs.adtech.sagapattern.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.saurabhshcs.adtech.sagapattern.domain.Order;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisSessionStoreTest {

    private static final Duration TIMEOUT = Duration.ofHours(1);

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOps;

    private final SessionCodec codec = new SessionCodec(new ObjectMapper());
    private RedisSessionStore store;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        store = new RedisSessionStore(redisTemplate, codec, TIMEOUT,
                new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
    }

    @Test
    void createWritesRecordWithTimeout() {
        UserSession session = store.create();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("session:" + session.getSessionId()), json.capture(), eq(TIMEOUT));
        assertThat(codec.decode(json.getValue()).getInventory()).containsEntry("product_1", 100);
    }

    @Test
    void getRefreshesTtlAndDecodesRecord() {
        UserSession saved = new UserSession("s1", Instant.parse("2024-01-01T00:00:00Z"));
        Order order = Order.create("user_2", "product_2", 3, new BigDecimal("42.50"));
        saved.getOrders().put(order.getId(), order);
        saved.getBalances().put("user_2", new BigDecimal("457.50"));
        given(valueOps.getAndExpire("session:s1", TIMEOUT)).willReturn(codec.encode(saved));

        UserSession loaded = store.get("s1").orElseThrow();

        assertThat(loaded).usingRecursiveComparison().isEqualTo(saved);
    }

    @Test
    void missingRecordIsAbsent() {
        given(valueOps.getAndExpire(anyString(), any(Duration.class))).willReturn(null);

        assertThat(store.get("gone")).isEmpty();
        verify(redisTemplate, never()).delete(anyString());
    }

    @Test
    void corruptRecordIsPurgedAndReportedAbsent() {
        given(valueOps.getAndExpire("session:bad", TIMEOUT)).willReturn("{\"schema_version\":1,\"orders\":[");

        assertThat(store.get("bad")).isEmpty();
        verify(redisTemplate).delete("session:bad");
    }

    @Test
    void resetPersistsSeedDataUnderSameKey() {
        UserSession saved = new UserSession("s2", Instant.parse("2024-01-01T00:00:00Z"));
        saved.getInventory().put("product_3", 0);
        given(valueOps.getAndExpire("session:s2", TIMEOUT)).willReturn(codec.encode(saved));

        assertThat(store.reset("s2")).isTrue();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("session:s2"), json.capture(), eq(TIMEOUT));
        UserSession written = codec.decode(json.getValue());
        assertThat(written.getSessionId()).isEqualTo("s2");
        assertThat(written.getInventory()).containsEntry("product_3", 25);
    }

    @Test
    void deleteReportsWhetherKeyExisted() {
        given(redisTemplate.delete("session:s3")).willReturn(true);

        assertThat(store.delete("s3")).isTrue();
        assertThat(store.delete(null)).isFalse();
    }
}
