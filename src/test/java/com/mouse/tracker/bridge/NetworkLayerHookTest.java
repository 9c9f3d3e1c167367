package com.mouse.tracker.bridge;

import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.enums.HookMessageType;
import com.mouse.tracker.interfaces.NetworkListener;
import com.mouse.tracker.interfaces.SandboxPlatform;
import com.mouse.tracker.model.HookMessage;
import com.mouse.tracker.model.HookSettings;
import com.mouse.tracker.model.NetworkEvent;
import com.mouse.tracker.model.SandboxHandle;
import com.mouse.tracker.utils.UrlMatcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NetworkLayerHookTest {

    private static final String API_URL = "https://shop.example/api/v4/pdp/get_pc?item_id=9";

    @Mock
    private SandboxPlatform platform;

    private final SandboxHandle handle = new SandboxHandle("sbx_1", "https://shop.example/item/9");
    private final UrlMatcher matcher = new UrlMatcher("/api/v4/pdp/get_pc", List.of());
    private final List<HookMessage> received = new ArrayList<>();

    @Test
    void installSubscribesAndReportsReady() {
        when(platform.observeNetwork(eq(handle), any())).thenReturn(CompletableFuture.completedFuture(null));
        NetworkLayerHook hook = new NetworkLayerHook(platform);
        HookSettings settings = HookSettings.builder()
                .sandboxId("sbx_1")
                .pattern("/api/v4/pdp/get_pc")
                .alternates(List.of())
                .build();

        hook.install(handle, settings, received::add).join();

        assertThat(received).extracting(HookMessage::getType).containsExactly(HookMessageType.READY);
        assertThat(received.get(0).getLayer()).isEqualTo(HookLayer.NETWORK);

        ArgumentCaptor<NetworkListener> listener = ArgumentCaptor.forClass(NetworkListener.class);
        verify(platform).observeNetwork(eq(handle), listener.capture());
        listener.getValue().onNetworkEvent(handle, NetworkEvent.builder()
                .phase(NetworkEvent.Phase.REQUEST)
                .requestId("5")
                .url(API_URL)
                .method("GET")
                .timestamp(1_000)
                .build());

        assertThat(received).hasSize(2);
        assertThat(received.get(1).getExchangeId()).isEqualTo("net_5");
    }

    @Test
    void responseCarriesBodyAndStatus() {
        new NetworkLayerHook(platform).relay(NetworkEvent.builder()
                .phase(NetworkEvent.Phase.RESPONSE)
                .requestId("7")
                .url(API_URL)
                .method("GET")
                .status(200)
                .statusText("OK")
                .responseHeaders(Map.of("content-type", "application/json"))
                .bodyReader(() -> "{\"data\":{}}")
                .timestamp(2_000)
                .build(), matcher, received::add);

        HookMessage message = received.get(0);
        assertThat(message.getType()).isEqualTo(HookMessageType.RESPONSE);
        assertThat(message.getExchangeId()).isEqualTo("net_7");
        assertThat(message.getStatus()).isEqualTo(200);
        assertThat(message.getResponseBody()).isEqualTo("{\"data\":{}}");
        assertThat(message.getLayer()).isEqualTo(HookLayer.NETWORK);
    }

    @Test
    void unreadableBodyStillRelaysResponse() {
        new NetworkLayerHook(platform).relay(NetworkEvent.builder()
                .phase(NetworkEvent.Phase.RESPONSE)
                .requestId("8")
                .url(API_URL)
                .status(302)
                .bodyReader(() -> {
                    throw new IllegalStateException("Response body is unavailable for redirect responses");
                })
                .build(), matcher, received::add);

        assertThat(received).hasSize(1);
        assertThat(received.get(0).getResponseBody()).isNull();
        assertThat(received.get(0).getStatus()).isEqualTo(302);
    }

    @Test
    void failureBecomesError() {
        new NetworkLayerHook(platform).relay(NetworkEvent.builder()
                .phase(NetworkEvent.Phase.FAILED)
                .requestId("9")
                .url(API_URL)
                .failure("net::ERR_ABORTED")
                .build(), matcher, received::add);

        assertThat(received.get(0).getType()).isEqualTo(HookMessageType.ERROR);
        assertThat(received.get(0).getError()).isEqualTo("net::ERR_ABORTED");
    }

    @Test
    void nonMatchingTrafficIsNotRelayed() {
        new NetworkLayerHook(platform).relay(NetworkEvent.builder()
                .phase(NetworkEvent.Phase.REQUEST)
                .requestId("1")
                .url("https://shop.example/assets/logo.png")
                .build(), matcher, received::add);

        assertThat(received).isEmpty();
    }
}
