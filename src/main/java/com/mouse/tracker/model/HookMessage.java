package com.mouse.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.mouse.tracker.enums.HookLayer;
import com.mouse.tracker.enums.HookMessageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One message from an interception hook. REQUEST opens an exchange, RESPONSE or ERROR
 * with the same {@code exchangeId} completes it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HookMessage {

    private HookMessageType type;
    private HookLayer layer;
    private String exchangeId;
    private String url;
    private String method;
    private Map<String, String> requestHeaders;
    private String requestBody;
    private Integer status;
    private String statusText;
    private Map<String, String> responseHeaders;
    private String responseBody;
    private String error;
    private long timestamp;

    public static HookMessage ready(HookLayer layer) {
        return HookMessage.builder()
                .type(HookMessageType.READY)
                .layer(layer)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    public boolean completesExchange() {
        return type == HookMessageType.RESPONSE || type == HookMessageType.ERROR;
    }
}
