package com.mouse.tracker.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.tracker.config.TrackerConfig;
import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.enums.HookMessageType;
import com.mouse.tracker.interfaces.TrackingStore;
import com.mouse.tracker.model.HookMessage;
import com.mouse.tracker.utils.JsonPathExtractor;
import com.mouse.tracker.utils.UrlMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns hook messages into captured exchanges.
 * <p>
 * Each sandbox has a session holding requests still waiting for their response. A response
 * is paired by exchange id, or failing that by URL and nearest request time on the same
 * layer. Completed exchanges are extracted, deduplicated across layers and persisted
 * immediately.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InterceptionBridge {

    private final TrackingStore store;
    private final TrackerConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, BridgeSession> sessions = new ConcurrentHashMap<>();

    public void openSession(String sandboxId, String scheduleId) {
        sessions.put(sandboxId, new BridgeSession(scheduleId, config.urlMatcher()));
    }

    public boolean hasSession(String sandboxId) {
        return sessions.containsKey(sandboxId);
    }

    /**
     * @return the exchange this message completed or enriched, if any
     */
    public Optional<CapturedExchange> accept(String sandboxId, HookMessage message) {
        BridgeSession session = sessions.get(sandboxId);
        if (session == null) {
            log.debug("Dropping hook message for closed sandbox | Sandbox: {} | Type: {}", sandboxId, message.getType());
            return Optional.empty();
        }

        synchronized (session) {
            if (message.getType() == HookMessageType.REQUEST) {
                openExchange(session, message);
                return Optional.empty();
            }
            if (message.completesExchange()) {
                return completeExchange(sandboxId, session, message);
            }
            return Optional.empty();
        }
    }

    /**
     * Ends the session. Requests that never got a response are discarded.
     *
     * @return number of discarded incomplete exchanges
     */
    public int flush(String sandboxId) {
        BridgeSession session = sessions.remove(sandboxId);
        if (session == null) {
            return 0;
        }
        synchronized (session) {
            int discarded = session.pending.size();
            if (discarded > 0) {
                log.debug("Discarding incomplete exchanges | Sandbox: {} | Count: {}", sandboxId, discarded);
            }
            session.pending.clear();
            return discarded;
        }
    }

    public int pendingCount(String sandboxId) {
        BridgeSession session = sessions.get(sandboxId);
        if (session == null) {
            return 0;
        }
        synchronized (session) {
            return session.pending.size();
        }
    }

    private void openExchange(BridgeSession session, HookMessage request) {
        if (request.getExchangeId() == null || !session.matcher.matches(request.getUrl())) {
            return;
        }
        session.pending.put(request.getExchangeId(), request);
    }

    private Optional<CapturedExchange> completeExchange(String sandboxId, BridgeSession session, HookMessage response) {
        HookMessage request = response.getExchangeId() == null ? null : session.pending.remove(response.getExchangeId());
        if (request == null) {
            request = claimByProximity(session, response);
        }
        if (request == null && !session.matcher.matches(response.getUrl())) {
            return Optional.empty();
        }

        CapturedExchange exchange = buildExchange(sandboxId, session.scheduleId, request, response);
        return persistOrMerge(session, exchange);
    }

    /**
     * Pending request on the same layer with the same URL whose timestamp is closest to the
     * response, within the proximity window.
     */
    private HookMessage claimByProximity(BridgeSession session, HookMessage response) {
        if (response.getUrl() == null) {
            return null;
        }
        long window = config.getProximityMs();
        String bestKey = null;
        long bestDistance = Long.MAX_VALUE;

        for (Map.Entry<String, HookMessage> entry : session.pending.entrySet()) {
            HookMessage candidate = entry.getValue();
            if (candidate.getLayer() != response.getLayer() || !response.getUrl().equals(candidate.getUrl())) {
                continue;
            }
            long distance = Math.abs(response.getTimestamp() - candidate.getTimestamp());
            if (distance <= window && distance < bestDistance) {
                bestDistance = distance;
                bestKey = entry.getKey();
            }
        }
        return bestKey == null ? null : session.pending.remove(bestKey);
    }

    private CapturedExchange buildExchange(String sandboxId, String scheduleId, HookMessage request, HookMessage response) {
        HookMessage origin = request != null ? request : response;
        String payload = null;
        if (response.getType() == HookMessageType.RESPONSE) {
            payload = JsonPathExtractor.extract(objectMapper, response.getResponseBody(), config.getExtractionPath())
                    .map(JsonNode::toString)
                    .orElse(null);
        }

        return CapturedExchange.builder()
                .scheduleId(scheduleId)
                .sandboxId(sandboxId)
                .exchangeKey(origin.getExchangeId())
                .url(origin.getUrl() != null ? origin.getUrl() : response.getUrl())
                .method(origin.getMethod() != null ? origin.getMethod() : response.getMethod())
                .requestHeaders(copy(request == null ? null : request.getRequestHeaders()))
                .requestBody(request == null ? null : request.getRequestBody())
                .responseStatus(response.getStatus())
                .responseStatusText(response.getStatusText())
                .responseHeaders(copy(response.getResponseHeaders()))
                .responseBody(response.getResponseBody())
                .extractedPayload(payload)
                .error(response.getError())
                .source(response.getLayer() != null ? response.getLayer() : HookLayer.PAGE)
                .requestedAt(request == null ? null : Instant.ofEpochMilli(request.getTimestamp()))
                .capturedAt(clock.instant())
                .complete(true)
                .build();
    }

    private Optional<CapturedExchange> persistOrMerge(BridgeSession session, CapturedExchange exchange) {
        CapturedExchange twin = findCrossLayerTwin(session, exchange);
        if (twin == null) {
            CapturedExchange saved = store.appendCapturedExchange(session.scheduleId, exchange);
            session.completed.add(saved);
            log.info("Exchange captured | Schedule: {} | Sandbox: {} | Layer: {} | {} {} | Status: {} | Payload: {}",
                    session.scheduleId, saved.getSandboxId(), saved.getSource(), saved.getMethod(),
                    saved.getUrl(), saved.getResponseStatus(), saved.hasPayload() ? "yes" : "no");
            return Optional.of(saved);
        }

        if (!twin.hasPayload() && exchange.hasPayload()) {
            twin.setExtractedPayload(exchange.getExtractedPayload());
            twin.setResponseBody(exchange.getResponseBody());
            if (twin.getResponseStatus() == null) {
                twin.setResponseStatus(exchange.getResponseStatus());
            }
            if (twin.getResponseHeaders() == null || twin.getResponseHeaders().isEmpty()) {
                twin.setResponseHeaders(exchange.getResponseHeaders());
            }
            CapturedExchange enriched = store.updateCapturedExchange(twin);
            session.completed.set(session.completed.indexOf(twin), enriched);
            log.debug("Exchange enriched from {} layer | Id: {} | Url: {}", exchange.getSource(), enriched.getId(), enriched.getUrl());
            return Optional.of(enriched);
        }

        log.debug("Duplicate exchange from {} layer ignored | Url: {}", exchange.getSource(), exchange.getUrl());
        return Optional.empty();
    }

    private CapturedExchange findCrossLayerTwin(BridgeSession session, CapturedExchange exchange) {
        Duration window = Duration.ofMillis(config.getProximityMs());
        for (CapturedExchange existing : session.completed) {
            if (existing.getSource() == exchange.getSource()) {
                continue;
            }
            if (!exchange.getUrl().equals(existing.getUrl()) || !sameMethod(existing.getMethod(), exchange.getMethod())) {
                continue;
            }
            Duration gap = Duration.between(existing.getCapturedAt(), exchange.getCapturedAt()).abs();
            if (gap.compareTo(window) <= 0) {
                return existing;
            }
        }
        return null;
    }

    private static boolean sameMethod(String a, String b) {
        String left = a == null ? "GET" : a;
        String right = b == null ? "GET" : b;
        return left.equalsIgnoreCase(right);
    }

    private static Map<String, String> copy(Map<String, String> headers) {
        return headers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(headers);
    }

    private static final class BridgeSession {
        private final String scheduleId;
        private final UrlMatcher matcher;
        private final Map<String, HookMessage> pending = new LinkedHashMap<>();
        private final List<CapturedExchange> completed = new ArrayList<>();

        private BridgeSession(String scheduleId, UrlMatcher matcher) {
            this.scheduleId = scheduleId;
            this.matcher = matcher;
        }
    }
}
