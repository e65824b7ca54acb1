package com.askus.backend.config;

import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

public final class HttpTimeouts {

    private HttpTimeouts() {}

    public static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        int millis = (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis()));
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(millis);
        factory.setReadTimeout(millis);
        return factory;
    }
}
