package com.ewsmon.service.core.probe;

import java.util.Map;
import java.util.Objects;

/** Ready-to-send SOAP call: envelope text plus HTTP headers (always including {@code Content-Type}). */
public record ProbeRequest(String body, Map<String, String> headers) {

    public ProbeRequest {
        Objects.requireNonNull(body, "body");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public String contentType() {
        return headers.get(ProbeRequestBuilder.CONTENT_TYPE_HEADER);
    }
}
