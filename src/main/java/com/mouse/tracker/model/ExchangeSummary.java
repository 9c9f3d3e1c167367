package com.mouse.tracker.model;

import com.mouse.tracker.entity.CapturedExchange;
import com.mouse.tracker.enums.HookLayer;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExchangeSummary {
    String id;
    String url;
    String method;
    Integer status;
    HookLayer source;
    boolean hasPayload;

    public static ExchangeSummary of(CapturedExchange exchange) {
        return ExchangeSummary.builder()
                .id(exchange.getId())
                .url(exchange.getUrl())
                .method(exchange.getMethod())
                .status(exchange.getResponseStatus())
                .source(exchange.getSource())
                .hasPayload(exchange.hasPayload())
                .build();
    }
}
