package com.mouse.tracker.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.tracker.config.TrackerConfig;
import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.enums.HookMessageType;
import com.mouse.tracker.model.HookMessage;
import com.mouse.tracker.support.InMemoryTrackingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InterceptionBridgeTest {

    private static final String SANDBOX = "sbx_test";
    private static final String SCHEDULE = "s1";
    private static final String API_URL = "https://shop.example/api/v4/pdp/get_pc?item_id=42";
    private static final String BODY = "{\"data\":{\"item\":{\"models\":[{\"modelid\":1,\"stock\":3}]}}}";

    private InMemoryTrackingStore store;
    private InterceptionBridge bridge;

    @BeforeEach
    void setUp() {
        TrackerConfig config = new TrackerConfig();
        config.setTrackingPattern("/api/v4/pdp/get_pc");
        config.setAlternatePatterns(List.of());
        config.setExtractionPath("data.item.models");
        config.setProximityMs(3_000);

        store = new InMemoryTrackingStore();
        bridge = new InterceptionBridge(store, config, new ObjectMapper(),
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        bridge.openSession(SANDBOX, SCHEDULE);
    }

    private static HookMessage request(HookLayer layer, String id, String url, long ts) {
        return HookMessage.builder()
                .type(HookMessageType.REQUEST)
                .layer(layer)
                .exchangeId(id)
                .url(url)
                .method("POST")
                .requestHeaders(Map.of("content-type", "application/json"))
                .requestBody("{\"itemid\":42}")
                .timestamp(ts)
                .build();
    }

    private static HookMessage response(HookLayer layer, String id, String url, String body, long ts) {
        return HookMessage.builder()
                .type(HookMessageType.RESPONSE)
                .layer(layer)
                .exchangeId(id)
                .url(url)
                .status(200)
                .statusText("OK")
                .responseHeaders(Map.of("content-type", "application/json"))
                .responseBody(body)
                .timestamp(ts)
                .build();
    }

    @Nested
    @DisplayName("correlation")
    class Correlation {

        @Test
        void pairsResponseWithRequestById() {
            assertThat(bridge.accept(SANDBOX, request(HookLayer.PAGE, "p1", API_URL, 1_000))).isEmpty();
            assertThat(bridge.pendingCount(SANDBOX)).isEqualTo(1);

            Optional<CapturedExchange> captured = bridge.accept(SANDBOX, response(HookLayer.PAGE, "p1", API_URL, BODY, 1_200));

            assertThat(captured).isPresent();
            CapturedExchange exchange = captured.get();
            assertThat(exchange.getMethod()).isEqualTo("POST");
            assertThat(exchange.getRequestBody()).isEqualTo("{\"itemid\":42}");
            assertThat(exchange.getRequestHeaders()).containsEntry("content-type", "application/json");
            assertThat(exchange.getResponseStatus()).isEqualTo(200);
            assertThat(exchange.getRequestedAt()).isEqualTo(Instant.ofEpochMilli(1_000));
            assertThat(exchange.getExtractedPayload()).isEqualTo("[{\"modelid\":1,\"stock\":3}]");
            assertThat(exchange.getSource()).isEqualTo(HookLayer.PAGE);
            assertThat(exchange.getSandboxId()).isEqualTo(SANDBOX);
            assertThat(bridge.pendingCount(SANDBOX)).isZero();
            assertThat(store.listCapturedExchanges(SCHEDULE)).hasSize(1);
        }

        @Test
        @DisplayName("without an id the nearest pending request on the same URL wins")
        void fallsBackToProximity() {
            bridge.accept(SANDBOX, request(HookLayer.PAGE, "early", API_URL, 1_000));
            bridge.accept(SANDBOX, request(HookLayer.PAGE, "late", API_URL, 5_000));

            CapturedExchange exchange = bridge.accept(SANDBOX, response(HookLayer.PAGE, null, API_URL, BODY, 5_300)).orElseThrow();

            assertThat(exchange.getExchangeKey()).isEqualTo("late");
            assertThat(exchange.getRequestedAt()).isEqualTo(Instant.ofEpochMilli(5_000));
            assertThat(bridge.pendingCount(SANDBOX)).isEqualTo(1);
        }

        @Test
        void proximityIgnoresRequestsOutsideWindowOrOnOtherLayer() {
            bridge.accept(SANDBOX, request(HookLayer.PAGE, "old", API_URL, 1_000));
            bridge.accept(SANDBOX, request(HookLayer.NETWORK, "net_1", API_URL, 9_900));

            CapturedExchange exchange = bridge.accept(SANDBOX, response(HookLayer.PAGE, null, API_URL, BODY, 10_000)).orElseThrow();

            assertThat(exchange.getRequestedAt()).isNull();
            assertThat(bridge.pendingCount(SANDBOX)).isEqualTo(2);
        }

        @Test
        void responseWithoutRequestIsKeptWhenUrlMatches() {
            CapturedExchange exchange = bridge.accept(SANDBOX, response(HookLayer.PAGE, "orphan", API_URL, BODY, 1_000)).orElseThrow();

            assertThat(exchange.getRequestedAt()).isNull();
            assertThat(exchange.hasPayload()).isTrue();
        }

        @Test
        void nonMatchingTrafficIsIgnored() {
            String other = "https://shop.example/static/app.js";
            assertThat(bridge.accept(SANDBOX, request(HookLayer.PAGE, "js", other, 1_000))).isEmpty();
            assertThat(bridge.pendingCount(SANDBOX)).isZero();
            assertThat(bridge.accept(SANDBOX, response(HookLayer.PAGE, "js", other, "{}", 1_100))).isEmpty();
            assertThat(store.allExchanges()).isEmpty();
        }
    }

    @Nested
    @DisplayName("deduplication")
    class Deduplication {

        @Test
        @DisplayName("the page layer payload enriches the exchange the network layer stored first")
        void enrichesTwinFromOtherLayer() {
            CapturedExchange first = bridge.accept(SANDBOX,
                    response(HookLayer.NETWORK, "net_7", API_URL, null, 1_000)).orElseThrow();
            assertThat(first.hasPayload()).isFalse();

            CapturedExchange enriched = bridge.accept(SANDBOX,
                    response(HookLayer.PAGE, "p7", API_URL, BODY, 1_050)).orElseThrow();

            assertThat(enriched.getId()).isEqualTo(first.getId());
            assertThat(enriched.getSource()).isEqualTo(HookLayer.NETWORK);
            assertThat(enriched.hasPayload()).isTrue();
            assertThat(store.allExchanges()).hasSize(1);
            assertThat(store.allExchanges().get(0).getExtractedPayload()).contains("\"modelid\":1");
        }

        @Test
        void duplicateWithNothingNewIsDropped() {
            bridge.accept(SANDBOX, response(HookLayer.PAGE, "p1", API_URL, BODY, 1_000));

            assertThat(bridge.accept(SANDBOX, response(HookLayer.NETWORK, "net_1", API_URL, BODY, 1_010))).isEmpty();
            assertThat(store.allExchanges()).hasSize(1);
        }

        @Test
        void sameLayerRepeatsAreSeparateExchanges() {
            bridge.accept(SANDBOX, response(HookLayer.PAGE, "p1", API_URL, BODY, 1_000));
            bridge.accept(SANDBOX, response(HookLayer.PAGE, "p2", API_URL, BODY, 2_000));

            assertThat(store.allExchanges()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("session lifecycle")
    class Lifecycle {

        @Test
        void flushDiscardsIncompleteExchanges() {
            bridge.accept(SANDBOX, request(HookLayer.PAGE, "p1", API_URL, 1_000));
            bridge.accept(SANDBOX, request(HookLayer.PAGE, "p2", API_URL, 1_100));

            assertThat(bridge.flush(SANDBOX)).isEqualTo(2);
            assertThat(bridge.hasSession(SANDBOX)).isFalse();
            assertThat(bridge.flush(SANDBOX)).isZero();
            assertThat(bridge.accept(SANDBOX, response(HookLayer.PAGE, "p1", API_URL, BODY, 1_200))).isEmpty();
            assertThat(store.allExchanges()).isEmpty();
        }

        @Test
        void errorCompletesExchangeWithoutPayload() {
            bridge.accept(SANDBOX, request(HookLayer.PAGE, "p1", API_URL, 1_000));

            CapturedExchange exchange = bridge.accept(SANDBOX, HookMessage.builder()
                    .type(HookMessageType.ERROR)
                    .layer(HookLayer.PAGE)
                    .exchangeId("p1")
                    .url(API_URL)
                    .error("net::ERR_CONNECTION_RESET")
                    .timestamp(1_100)
                    .build()).orElseThrow();

            assertThat(exchange.getError()).isEqualTo("net::ERR_CONNECTION_RESET");
            assertThat(exchange.hasPayload()).isFalse();
            assertThat(exchange.isComplete()).isTrue();
        }

        @Test
        void extractionMissStillPersistsExchange() {
            CapturedExchange exchange = bridge.accept(SANDBOX,
                    response(HookLayer.PAGE, "p1", API_URL, "{\"data\":{\"item\":null}}", 1_000)).orElseThrow();

            assertThat(exchange.hasPayload()).isFalse();
            assertThat(exchange.getResponseBody()).isEqualTo("{\"data\":{\"item\":null}}");
            assertThat(store.allExchanges()).hasSize(1);
        }

        @Test
        void heartbeatsProduceNothing() {
            assertThat(bridge.accept(SANDBOX, HookMessage.builder()
                    .type(HookMessageType.HEARTBEAT)
                    .layer(HookLayer.PAGE)
                    .timestamp(1_000)
                    .build())).isEmpty();
        }
    }
}
