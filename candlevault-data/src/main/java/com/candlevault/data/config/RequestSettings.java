package com.candlevault.data.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Paging and timing of upstream requests (the {@code request} section).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestSettings {

    public static final int DEFAULT_LIMIT = 1000;
    /** Binance returns at most this many klines per request. */
    public static final int MAX_LIMIT = 1000;
    public static final double DEFAULT_RATE_LIMIT_SLEEP_SECONDS = 0.2;
    public static final double DEFAULT_TIMEOUT_SECONDS = 30;

    private int limit = DEFAULT_LIMIT;

    @JsonProperty("rate_limit_sleep")
    private double rateLimitSleep = DEFAULT_RATE_LIMIT_SLEEP_SECONDS;

    private double timeout = DEFAULT_TIMEOUT_SECONDS;

    public RequestSettings() {}

    public RequestSettings(int limit, double rateLimitSleep, double timeout) {
        this.limit = limit;
        this.rateLimitSleep = rateLimitSleep;
        this.timeout = timeout;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    /** Seconds between two page requests. */
    public double getRateLimitSleep() {
        return rateLimitSleep;
    }

    public void setRateLimitSleep(double rateLimitSleep) {
        this.rateLimitSleep = rateLimitSleep;
    }

    /** Per-request timeout in seconds. */
    public double getTimeout() {
        return timeout;
    }

    public void setTimeout(double timeout) {
        this.timeout = timeout;
    }

    public Duration pageDelay() {
        return Duration.ofNanos(Math.round(rateLimitSleep * 1_000_000_000d));
    }

    public Duration requestTimeout() {
        return Duration.ofNanos(Math.round(timeout * 1_000_000_000d));
    }
}
