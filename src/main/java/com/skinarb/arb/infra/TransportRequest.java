package com.skinarb.arb.infra;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class TransportRequest {
    String url;
    @Builder.Default
    String method = "GET";
    @Singular
    Map<String, String> headers;
    String body; // null for GET
    @Builder.Default
    String contentType = "application/json";

    public static TransportRequest get(String url) {
        return TransportRequest.builder().url(url).build();
    }

    public static TransportRequest post(String url, String jsonBody) {
        return TransportRequest.builder().url(url).method("POST").body(jsonBody).build();
    }
}
