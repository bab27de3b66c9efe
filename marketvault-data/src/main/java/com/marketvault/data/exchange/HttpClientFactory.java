package com.marketvault.data.exchange;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client and JSON mapper shared by the exchange clients.
 *
 * Page requests carry their own call timeout (see {@link PageRequest#timeout()}),
 * so the client timeouts here only bound connection setup and stalled reads.
 */
public final class HttpClientFactory {

    static final String USER_AGENT = "marketvault/0.4.1";

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration READ_TIMEOUT = Duration.ofSeconds(60);

    private static final OkHttpClient SHARED_CLIENT = newClient(CONNECT_TIMEOUT, READ_TIMEOUT);

    private static final ObjectMapper SHARED_MAPPER = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .build();

    private HttpClientFactory() {
    }

    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }

    /**
     * Client tagged with the MarketVault user agent. One pool sized for the
     * download workers; idle connections are kept for a minute between pages.
     */
    static OkHttpClient newClient(Duration connectTimeout, Duration readTimeout) {
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(16, 1, TimeUnit.MINUTES))
            .connectTimeout(connectTimeout)
            .readTimeout(readTimeout)
            .addInterceptor(userAgent())
            .build();
    }

    private static Interceptor userAgent() {
        return chain -> chain.proceed(chain.request().newBuilder()
            .header("User-Agent", USER_AGENT)
            .build());
    }
}
