package com.candlevault.data;

import com.candlevault.data.config.UpstreamSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binance API client for kline pages.
 * Uses the public API (no authentication required).
 *
 * API Endpoint: GET /api/v3/klines
 * Response: array of [openTime, open, high, low, close, volume, closeTime,
 * quoteVolume, trades, takerBuyBase, takerBuyQuote, ignore]
 */
public class BinanceKlineClient implements KlineSource {

    private static final Logger log = LoggerFactory.getLogger(BinanceKlineClient.class);

    private final String klinesUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public BinanceKlineClient(UpstreamSettings upstream, Duration requestTimeout) {
        this(upstream.klinesUrl(), HttpClientFactory.getClient(requestTimeout));
    }

    public BinanceKlineClient(String klinesUrl, OkHttpClient client) {
        this.klinesUrl = klinesUrl;
        this.client = client;
        this.mapper = HttpClientFactory.getMapper();
    }

    @Override
    public List<JsonNode> fetchPage(String symbol, String interval, long startTime, Long endTime, int limit)
            throws IOException {

        StringBuilder url = new StringBuilder(klinesUrl)
            .append("?symbol=").append(symbol)
            .append("&interval=").append(interval)
            .append("&limit=").append(limit)
            .append("&startTime=").append(startTime);

        if (endTime != null) {
            url.append("&endTime=").append(endTime);
        }

        Request request = new Request.Builder()
            .url(url.toString())
            .get()
            .build();

        log.debug("Requesting klines {}", url);

        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";

            if (!response.isSuccessful()) {
                throw new IOException("Binance API error: " + response.code() + " " + response.message() + " - " + body);
            }

            JsonNode root = mapper.readTree(body);
            if (root == null || !root.isArray()) {
                throw new IOException("Unexpected klines response, expected a JSON array: " + abbreviate(body));
            }

            List<JsonNode> rows = new ArrayList<>(root.size());
            for (JsonNode kline : root) {
                if (!kline.isArray()) {
                    throw new IOException("Unexpected kline row, expected a JSON array: " + kline);
                }
                rows.add(kline);
            }
            return rows;
        }
    }

    private static String abbreviate(String body) {
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
