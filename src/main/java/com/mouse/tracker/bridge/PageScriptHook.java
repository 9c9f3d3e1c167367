package com.mouse.tracker.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.enums.VisibilityLevel;
import com.mouse.tracker.exception.SandboxException;
import com.mouse.tracker.interfaces.InterceptionHook;
import com.mouse.tracker.interfaces.SandboxPlatform;
import com.mouse.tracker.model.HookMessage;
import com.mouse.tracker.model.HookSettings;
import com.mouse.tracker.model.SandboxHandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Patches {@code fetch} and {@code XMLHttpRequest} inside the page so bodies are read the
 * way the page reads them. Messages come back through a per-sandbox binding.
 */
@Slf4j
@Component
@Order(2)
public class PageScriptHook implements InterceptionHook {

    static final String SCRIPT_RESOURCE = "scripts/page-hook.js";
    static final String SETTINGS_PLACEHOLDER = "__TRACKER_SETTINGS__";

    private final SandboxPlatform platform;
    private final ObjectMapper objectMapper;
    private final String scriptTemplate;

    public PageScriptHook(SandboxPlatform platform, ObjectMapper objectMapper) {
        this.platform = platform;
        this.objectMapper = objectMapper;
        this.scriptTemplate = loadTemplate();
    }

    @Override
    public HookLayer layer() {
        return HookLayer.PAGE;
    }

    @Override
    public CompletableFuture<Void> install(SandboxHandle handle, HookSettings settings, Consumer<HookMessage> sink) {
        return platform.openChannel(handle, settings.getChannel(), (h, payload) -> parse(payload, sink))
                .thenCompose(v -> platform.injectCode(handle, buildScript(settings), VisibilityLevel.PAGE));
    }

    public String buildScript(HookSettings settings) {
        return scriptTemplate.replace(SETTINGS_PLACEHOLDER, settings.toJson());
    }

    void parse(String payload, Consumer<HookMessage> sink) {
        if (payload == null || payload.isBlank()) {
            return;
        }
        try {
            HookMessage message = objectMapper.readValue(payload, HookMessage.class);
            if (message.getType() == null) {
                log.debug("Ignoring page message without type | Payload: {}", abbreviate(payload));
                return;
            }
            message.setLayer(HookLayer.PAGE);
            sink.accept(message);
        } catch (IOException e) {
            log.debug("Malformed page message | Reason: {} | Payload: {}", e.getMessage(), abbreviate(payload));
        }
    }

    private static String loadTemplate() {
        try (InputStream in = new ClassPathResource(SCRIPT_RESOURCE).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SandboxException("Cannot load page hook script " + SCRIPT_RESOURCE, e);
        }
    }

    private static String abbreviate(String value) {
        return value.length() <= 200 ? value : value.substring(0, 200) + "...";
    }
}
