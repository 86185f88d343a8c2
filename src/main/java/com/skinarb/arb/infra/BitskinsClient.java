package com.skinarb.arb.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skinarb.arb.core.QuoteFactory;
import com.skinarb.arb.core.QuoteFetchException;
import com.skinarb.arb.core.QuoteSource;
import com.skinarb.arb.core.SaleStatsCalculator;
import com.skinarb.arb.core.SaleStatsSource;
import com.skinarb.arb.domain.DataUnavailableException;
import com.skinarb.arb.domain.Listing;
import com.skinarb.arb.domain.Market;
import com.skinarb.arb.domain.Quote;
import com.skinarb.arb.domain.SaleHistoryEntry;
import com.skinarb.arb.domain.SaleStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * BitSkins market search and 30-day pricing summary. Prices on the wire are
 * integer thousandths.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "arb.bitskins", name = "enabled", havingValue = "true")
public class BitskinsClient implements QuoteSource, SaleStatsSource {

    private static final int APP_ID = 730;
    private static final int MAX_TRADE_HOLD_DAYS = 7;
    private static final int SEARCH_LIMIT = 30;

    private final ResilientRequestExecutor executor;
    private final QuoteFactory quoteFactory;
    private final SaleStatsCalculator saleStatsCalculator;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    // skin ids are only learned from search results
    private final Map<String, Long> skinIds = new ConcurrentHashMap<>();

    public BitskinsClient(ResilientRequestExecutor executor, QuoteFactory quoteFactory,
            SaleStatsCalculator saleStatsCalculator, ObjectMapper objectMapper,
            @Value("${arb.bitskins.base-url:https://api.bitskins.com}") String baseUrl,
            @Value("${arb.bitskins.api-key:}") String apiKey) {
        this.executor = executor;
        this.quoteFactory = quoteFactory;
        this.saleStatsCalculator = saleStatsCalculator;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
    }

    @Override
    public Market market() {
        return Market.BITSKINS;
    }

    @Override
    public Quote fetch(String itemName) {
        ObjectNode where = objectMapper.createObjectNode()
                .put("skin_name", itemName)
                .put("tradehold_to", MAX_TRADE_HOLD_DAYS)
                .put("price_from", 10)
                .put("price_to", 25_000_000);
        where.putArray("category_id").add(categoryOf(itemName));
        ObjectNode query = objectMapper.createObjectNode();
        query.putArray("order").addObject().put("field", "price").put("order", "ASC");
        query.put("offset", 0).put("limit", SEARCH_LIMIT);
        query.set("where", where);

        JsonNode list = post(itemName, "/market/search/" + APP_ID, query).path("list");
        List<Listing> listings = new ArrayList<>();
        for (JsonNode entry : list) {
            String name = entry.path("name").asText();
            if (name.equals(itemName) && entry.hasNonNull("skin_id")) {
                skinIds.putIfAbsent(itemName, entry.get("skin_id").asLong());
            }
            listings.add(Listing.of(name, thousandths(entry.path("price").asLong()), entry.path("tradehold").asInt()));
        }
        if (listings.isEmpty()) {
            throw new QuoteFetchException(QuoteFetchException.Kind.NOT_FOUND, market(), itemName,
                    "search returned no listings", null);
        }
        try {
            return quoteFactory.fromListings(itemName, market(), listings);
        } catch (DataUnavailableException e) {
            throw new QuoteFetchException(QuoteFetchException.Kind.NOT_FOUND, market(), itemName, e.getMessage(), e);
        }
    }

    @Override
    public SaleStats fetchSaleStats(String itemName) {
        Long skinId = skinIds.get(itemName);
        if (skinId == null) {
            throw new QuoteFetchException(QuoteFetchException.Kind.NOT_FOUND, market(), itemName,
                    "skin id unknown until the item shows up in a search", null);
        }
        LocalDate today = LocalDate.now();
        ObjectNode query = objectMapper.createObjectNode()
                .put("app_id", APP_ID)
                .put("skin_id", skinId)
                .put("date_from", today.minusDays(30).toString())
                .put("date_to", today.toString());

        JsonNode rows = post(itemName, "/market/pricing/summary", query);
        List<SaleHistoryEntry> history = new ArrayList<>();
        for (JsonNode row : rows) {
            history.add(SaleHistoryEntry.of(LocalDate.parse(row.path("date").asText()),
                    thousandths(row.path("price_min").asLong()), row.path("counter").asInt()));
        }
        return saleStatsCalculator.compute(itemName, market(), history, today);
    }

    private JsonNode post(String itemName, String path, ObjectNode payload) {
        TransportRequest.TransportRequestBuilder request = TransportRequest.builder()
                .url(baseUrl + path)
                .method("POST");
        if (!apiKey.isEmpty()) {
            request.header("x-apikey", apiKey);
        }
        try {
            request.body(objectMapper.writeValueAsString(payload));
            TransportResponse response = executor.read(market(), request.build()).requireSuccess(market());
            return objectMapper.readTree(response.getBody());
        } catch (NetworkFailureException e) {
            QuoteFetchException.Kind kind = e.isTransient()
                    ? QuoteFetchException.Kind.TRANSIENT
                    : QuoteFetchException.Kind.FATAL;
            throw new QuoteFetchException(kind, market(), itemName, e.getMessage(), e);
        } catch (IOException e) {
            throw new QuoteFetchException(QuoteFetchException.Kind.FATAL, market(), itemName,
                    "unreadable response from " + path, e);
        }
    }

    private static int categoryOf(String itemName) {
        if (itemName.contains("Souvenir")) {
            return 5;
        }
        return itemName.contains("StatTrak") ? 3 : 1;
    }

    private static BigDecimal thousandths(long value) {
        return BigDecimal.valueOf(value, 3);
    }
}
