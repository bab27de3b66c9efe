package com.marketvault.data.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketvault.core.model.DataType;
import com.marketvault.core.model.Trade;
import com.marketvault.data.exception.MarketDataException;
import com.marketvault.data.exception.NetworkException;
import com.marketvault.data.exception.RateLimitedException;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Binance public market data client (no authentication required).
 *
 * Exchange ids:
 * - "binance": spot API (klines, aggTrades)
 * - "binanceusdm": USD-M futures API (klines, aggTrades, fundingRate)
 *
 * Symbols may be given in unified form ("BTC/USDT", "BTC/USDT:USDT") or as Binance
 * market ids ("BTCUSDT").
 */
public class BinanceMarketDataClient implements MarketDataApi {

    private static final Logger log = LoggerFactory.getLogger(BinanceMarketDataClient.class);

    public static final String SPOT = "binance";
    public static final String USDM_FUTURES = "binanceusdm";

    private static final Map<String, String> DEFAULT_BASE_URLS = Map.of(
        SPOT, "https://api.binance.com/api/v3",
        USDM_FUTURES, "https://fapi.binance.com/fapi/v1"
    );

    private static final int MAX_KLINES_PER_REQUEST = 1000;
    private static final int MAX_TRADES_PER_REQUEST = 1000;
    private static final int MAX_FUNDING_PER_REQUEST = 1000;
    private static final long DEFAULT_RETRY_AFTER_MS = 60_000;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> baseUrls;

    public BinanceMarketDataClient() {
        this(HttpClientFactory.getClient(), HttpClientFactory.getMapper(), DEFAULT_BASE_URLS);
    }

    public BinanceMarketDataClient(OkHttpClient client, ObjectMapper mapper, Map<String, String> baseUrls) {
        this.client = client;
        this.mapper = mapper;
        this.baseUrls = Map.copyOf(baseUrls);
    }

    @Override
    public Set<String> listSymbols(String exchange) throws MarketDataException {
        String baseUrl = baseUrl(exchange);
        JsonNode root = get(baseUrl + "/exchangeInfo", 0);

        Set<String> symbols = new TreeSet<>();
        for (JsonNode market : root.path("symbols")) {
            if (!"TRADING".equals(market.path("status").asText())) {
                continue;
            }
            String base = market.path("baseAsset").asText();
            String quote = market.path("quoteAsset").asText();
            if (USDM_FUTURES.equals(exchange)) {
                // Only perpetuals map to a unified swap symbol
                if (!"PERPETUAL".equals(market.path("contractType").asText())) {
                    continue;
                }
                symbols.add(base + "/" + quote + ":" + market.path("marginAsset").asText(quote));
            } else {
                symbols.add(base + "/" + quote);
            }
        }
        log.debug("Loaded {} symbols for {}", symbols.size(), exchange);
        return new LinkedHashSet<>(symbols);
    }

    @Override
    public List<JsonNode> fetchPage(PageRequest request) throws MarketDataException {
        return switch (request.dataType()) {
            case CANDLES -> fetchKlines(request);
            case TRADES -> fetchAggTrades(request);
            case FUNDING -> fetchFundingRates(request);
        };
    }

    @Override
    public int maxPageSize(DataType dataType) {
        return switch (dataType) {
            case CANDLES -> MAX_KLINES_PER_REQUEST;
            case TRADES -> MAX_TRADES_PER_REQUEST;
            case FUNDING -> MAX_FUNDING_PER_REQUEST;
        };
    }

    /**
     * Kline format: [openTime, open, high, low, close, volume, closeTime, ...]
     */
    private List<JsonNode> fetchKlines(PageRequest request) throws MarketDataException {
        String url = baseUrl(request.exchange()) + "/klines"
            + "?symbol=" + toMarketId(request.symbol())
            + "&interval=" + request.subTypeId()
            + "&startTime=" + request.since()
            + "&limit=" + Math.min(request.limit(), MAX_KLINES_PER_REQUEST);

        List<JsonNode> page = new ArrayList<>();
        for (JsonNode kline : get(url, timeoutMs(request))) {
            ArrayNode row = mapper.createArrayNode();
            for (int i = 0; i < 6; i++) {
                row.add(kline.get(i));
            }
            page.add(row);
        }
        return page;
    }

    /**
     * AggTrade format: {"a":id,"p":"price","q":"qty","f":firstId,"l":lastId,"T":time,"m":isBuyerMaker}
     */
    private List<JsonNode> fetchAggTrades(PageRequest request) throws MarketDataException {
        String url = baseUrl(request.exchange()) + "/aggTrades"
            + "?symbol=" + toMarketId(request.symbol())
            + "&startTime=" + request.since()
            + "&limit=" + Math.min(request.limit(), MAX_TRADES_PER_REQUEST);

        List<JsonNode> page = new ArrayList<>();
        for (JsonNode trade : get(url, timeoutMs(request))) {
            ObjectNode row = mapper.createObjectNode();
            row.put("id", trade.path("a").asText());
            row.put("timestamp", trade.path("T").asLong());
            // Buyer is maker -> the taker sold
            row.put("side", trade.path("m").asBoolean() ? Trade.SELL : Trade.BUY);
            row.set("price", trade.get("p"));
            row.set("amount", trade.get("q"));
            page.add(row);
        }
        return page;
    }

    /**
     * Funding format: {symbol, fundingRate, fundingTime, markPrice}
     */
    private List<JsonNode> fetchFundingRates(PageRequest request) throws MarketDataException {
        if (!USDM_FUTURES.equals(request.exchange())) {
            throw new MarketDataException("Funding rates are only available on " + USDM_FUTURES
                + ", not " + request.exchange());
        }
        String url = baseUrl(request.exchange()) + "/fundingRate"
            + "?symbol=" + toMarketId(request.symbol())
            + "&startTime=" + request.since()
            + "&limit=" + Math.min(request.limit(), MAX_FUNDING_PER_REQUEST);

        List<JsonNode> page = new ArrayList<>();
        for (JsonNode node : get(url, timeoutMs(request))) {
            ObjectNode row = mapper.createObjectNode();
            row.put("timestamp", node.path("fundingTime").asLong());
            row.set("fundingRate", node.get("fundingRate"));
            if (node.hasNonNull("markPrice") && !node.get("markPrice").asText().isEmpty()) {
                row.set("markPrice", node.get("markPrice"));
            }
            page.add(row);
        }
        return page;
    }

    private JsonNode get(String url, long timeoutMs) throws MarketDataException {
        Request request = new Request.Builder()
            .url(url)
            .get()
            .build();

        Call call = client.newCall(request);
        if (timeoutMs > 0) {
            call.timeout().timeout(timeoutMs, TimeUnit.MILLISECONDS);
        }

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";

            if (response.code() == 429 || response.code() == 418) {
                long retryAfterMs = parseRetryAfter(response.header("Retry-After"));
                throw new RateLimitedException("Binance rate limit hit (" + response.code() + ") for " + url,
                    retryAfterMs);
            }
            if (response.code() >= 500) {
                throw new NetworkException("Binance server error: " + response.code() + " " + response.message());
            }
            if (!response.isSuccessful()) {
                throw new MarketDataException("Binance API error: " + response.code() + " " + response.message()
                    + " - " + text);
            }
            return mapper.readTree(text);
        } catch (IOException e) {
            throw new NetworkException("Request failed: " + url, e);
        }
    }

    private String baseUrl(String exchange) throws MarketDataException {
        String baseUrl = baseUrls.get(exchange);
        if (baseUrl == null) {
            throw new MarketDataException("Unsupported exchange '" + exchange + "', expected one of "
                + new TreeSet<>(baseUrls.keySet()));
        }
        return baseUrl;
    }

    private static long timeoutMs(PageRequest request) {
        return request.timeout() != null ? request.timeout().toMillis() : 0;
    }

    private static long parseRetryAfter(String header) {
        if (header == null) {
            return DEFAULT_RETRY_AFTER_MS;
        }
        try {
            return Long.parseLong(header.trim()) * 1000;
        } catch (NumberFormatException e) {
            return DEFAULT_RETRY_AFTER_MS;
        }
    }

    /**
     * "BTC/USDT:USDT" -> "BTCUSDT", "BTC/USDT" -> "BTCUSDT", "BTCUSDT" unchanged.
     */
    static String toMarketId(String symbol) {
        int settle = symbol.indexOf(':');
        String pair = settle >= 0 ? symbol.substring(0, settle) : symbol;
        return pair.replace("/", "").toUpperCase();
    }
}
