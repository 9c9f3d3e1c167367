package com.mouse.tracker.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.function.Supplier;

/**
 * A request, response or failure reported by the browser network stack.
 * <p>
 * {@link #readBody()} must be called from inside the listener callback, on the thread that
 * delivered the event.
 */
@Value
@Builder
public class NetworkEvent {

    public enum Phase { REQUEST, RESPONSE, FAILED }

    Phase phase;
    String requestId;
    String url;
    String method;
    Map<String, String> requestHeaders;
    String requestBody;
    Integer status;
    String statusText;
    Map<String, String> responseHeaders;
    String failure;
    long timestamp;
    Supplier<String> bodyReader;

    public String readBody() {
        return bodyReader == null ? null : bodyReader.get();
    }
}
