package com.mouse.tracker.bridge;

import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.enums.HookMessageType;
import com.mouse.tracker.interfaces.InterceptionHook;
import com.mouse.tracker.interfaces.SandboxPlatform;
import com.mouse.tracker.model.HookMessage;
import com.mouse.tracker.model.HookSettings;
import com.mouse.tracker.model.NetworkEvent;
import com.mouse.tracker.model.SandboxHandle;
import com.mouse.tracker.utils.UrlMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Observes the browser network stack. Headers are always available; bodies are read only
 * for matching responses and may be missing (redirects, evicted buffers).
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class NetworkLayerHook implements InterceptionHook {

    static final String ID_PREFIX = "net_";

    private final SandboxPlatform platform;

    @Override
    public HookLayer layer() {
        return HookLayer.NETWORK;
    }

    @Override
    public CompletableFuture<Void> install(SandboxHandle handle, HookSettings settings, Consumer<HookMessage> sink) {
        UrlMatcher matcher = new UrlMatcher(settings.getPattern(), settings.getAlternates());
        return platform.observeNetwork(handle, (h, event) -> relay(event, matcher, sink))
                .thenRun(() -> sink.accept(HookMessage.ready(HookLayer.NETWORK)));
    }

    void relay(NetworkEvent event, UrlMatcher matcher, Consumer<HookMessage> sink) {
        if (!matcher.matches(event.getUrl())) {
            return;
        }

        HookMessage.HookMessageBuilder message = HookMessage.builder()
                .layer(HookLayer.NETWORK)
                .exchangeId(ID_PREFIX + event.getRequestId())
                .url(event.getUrl())
                .method(event.getMethod())
                .timestamp(event.getTimestamp());

        switch (event.getPhase()) {
            case REQUEST -> message.type(HookMessageType.REQUEST)
                    .requestHeaders(event.getRequestHeaders())
                    .requestBody(event.getRequestBody());
            case RESPONSE -> message.type(HookMessageType.RESPONSE)
                    .status(event.getStatus())
                    .statusText(event.getStatusText())
                    .responseHeaders(event.getResponseHeaders())
                    .responseBody(readBody(event));
            case FAILED -> message.type(HookMessageType.ERROR)
                    .error(event.getFailure());
        }
        sink.accept(message.build());
    }

    private String readBody(NetworkEvent event) {
        try {
            return event.readBody();
        } catch (RuntimeException e) {
            log.debug("Response body unavailable | Url: {} | Reason: {}", event.getUrl(), e.getMessage());
            return null;
        }
    }
}
