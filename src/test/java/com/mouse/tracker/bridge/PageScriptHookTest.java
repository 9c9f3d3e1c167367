package com.mouse.tracker.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.enums.HookMessageType;
import com.mouse.tracker.enums.VisibilityLevel;
import com.mouse.tracker.exception.SandboxException;
import com.mouse.tracker.interfaces.MessageListener;
import com.mouse.tracker.interfaces.SandboxPlatform;
import com.mouse.tracker.model.HookMessage;
import com.mouse.tracker.model.HookSettings;
import com.mouse.tracker.model.SandboxHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageScriptHookTest {

    @Mock
    private SandboxPlatform platform;

    private PageScriptHook hook;
    private final SandboxHandle handle = new SandboxHandle("sbx_1", "https://shop.example/item/1");
    private final HookSettings settings = HookSettings.builder()
            .sandboxId("sbx_1")
            .scheduleId("s1")
            .targetId("t1")
            .pattern("/api/v4/pdp/get_pc")
            .alternates(List.of("/api/v4/item/get"))
            .extractionPath("data.item.models")
            .channel("__apiTrackerRelay_sbx_1")
            .heartbeatMs(5_000)
            .build();

    @BeforeEach
    void setUp() {
        hook = new PageScriptHook(platform, new ObjectMapper());
    }

    @Test
    void scriptCarriesSettingsInPlaceOfPlaceholder() {
        String script = hook.buildScript(settings);

        assertThat(script).doesNotContain(PageScriptHook.SETTINGS_PLACEHOLDER);
        assertThat(script).contains("\"channel\":\"__apiTrackerRelay_sbx_1\"");
        assertThat(script).contains("\"pattern\":\"/api/v4/pdp/get_pc\"");
        assertThat(script).contains("XMLHttpRequest");
    }

    @Test
    @DisplayName("install opens the channel before injecting at page visibility")
    void installOpensChannelThenInjects() {
        when(platform.openChannel(eq(handle), eq("__apiTrackerRelay_sbx_1"), any()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(platform.injectCode(eq(handle), anyString(), eq(VisibilityLevel.PAGE)))
                .thenReturn(CompletableFuture.completedFuture(null));

        List<HookMessage> received = new ArrayList<>();
        CompletableFuture<Void> installed = hook.install(handle, settings, received::add);

        assertThat(installed).isCompleted();
        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        verify(platform).openChannel(eq(handle), eq("__apiTrackerRelay_sbx_1"), listener.capture());

        listener.getValue().onMessage(handle,
                "{\"type\":\"RESPONSE\",\"layer\":\"NETWORK\",\"exchangeId\":\"p1\",\"url\":\"https://shop.example/api/v4/pdp/get_pc\","
                        + "\"status\":200,\"responseBody\":\"{}\",\"timestamp\":1714557600000,\"sandboxId\":\"sbx_1\"}");

        assertThat(received).hasSize(1);
        HookMessage message = received.get(0);
        assertThat(message.getType()).isEqualTo(HookMessageType.RESPONSE);
        assertThat(message.getLayer()).isEqualTo(HookLayer.PAGE);
        assertThat(message.getStatus()).isEqualTo(200);
        assertThat(message.getTimestamp()).isEqualTo(1714557600000L);
    }

    @Test
    void failedChannelSkipsInjection() {
        when(platform.openChannel(eq(handle), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new SandboxException("Target page has been closed")));

        CompletableFuture<Void> installed = hook.install(handle, settings, m -> { });

        assertThat(installed).isCompletedExceptionally();
        verify(platform, never()).injectCode(any(), anyString(), any());
    }

    @Test
    void malformedOrUntypedMessagesAreDropped() {
        List<HookMessage> received = new ArrayList<>();

        hook.parse("not json", received::add);
        hook.parse("{\"url\":\"https://x/api\"}", received::add);
        hook.parse("", received::add);
        hook.parse(null, received::add);

        assertThat(received).isEmpty();
    }
}
