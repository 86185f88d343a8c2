package com.skinarb.arb.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.skinarb.arb.domain.Market;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured settings from arb-config.yaml: commission schedules, the proxy
 * pool, allowed markets, margins and the item watchlist.
 * Loaded once at startup; edit the file and restart to apply changes.
 */
@Slf4j
@Component
public class ArbConfig {

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
            new PropertyPlaceholderHelper("${", "}", ":", true);

    private final String configFile;
    private final Environment env;

    private ConfigRoot root = new ConfigRoot();

    @Autowired
    public ArbConfig(@Value("${arb.config-file:arb-config.yaml}") String configFile, Environment env) {
        this.configFile = configFile;
        this.env = env;
    }

    private ArbConfig(ConfigRoot root) {
        this.configFile = null;
        this.env = null;
        this.root = root;
    }

    /** Config backed by an in-memory root, without classpath loading. */
    public static ArbConfig of(ConfigRoot root) {
        return new ArbConfig(root);
    }

    @PostConstruct
    public void load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                return;
            }
            ConfigRoot loaded = mapper.readValue(is, ConfigRoot.class);
            loaded.getProxies().setUsername(resolve(loaded.getProxies().getUsername()));
            loaded.getProxies().setPassword(resolve(loaded.getProxies().getPassword()));
            loaded.getTrading().setAccount(resolve(loaded.getTrading().getAccount()));
            this.root = loaded;
            log.info("ArbConfig loaded from '{}': {} commission schedules, {} proxies, {} watched items",
                    configFile, root.getCommissions().size(), root.getProxies().getEndpoints().size(),
                    root.getWatchlist().size());
        } catch (Exception e) {
            log.error("Failed to load '{}', engine will use defaults: {}", configFile, e.getMessage());
        }
    }

    /** Resolves ${VAR:default} placeholders that Jackson reads as literal strings. */
    private String resolve(String value) {
        if (value == null || env == null) {
            return value;
        }
        return PLACEHOLDER_HELPER.replacePlaceholders(value, env::getProperty);
    }

    public Map<Market, Commission> commissions() { return root.getCommissions(); }
    public Proxies proxies()                     { return root.getProxies(); }
    public Trading trading()                     { return root.getTrading(); }
    public List<String> watchlist()              { return root.getWatchlist(); }

    public int maxCountFor(String itemName) {
        return root.getMaxCounts().getOrDefault(itemName, root.getTrading().getDefaultMaxCount());
    }

    @Data public static class ConfigRoot {
        private Map<Market, Commission> commissions = new EnumMap<>(Market.class);
        private Proxies proxies = new Proxies();
        private Trading trading = new Trading();
        private List<String> watchlist = new ArrayList<>();
        private Map<String, Integer> maxCounts = new LinkedHashMap<>();
    }

    /** Percentages charged by a market: on purchase, on sale and any extra sale fee. */
    @Data public static class Commission {
        private int buy;
        private int sell;
        private int extraSell;

        public static Commission of(int buy, int sell, int extraSell) {
            Commission c = new Commission();
            c.setBuy(buy);
            c.setSell(sell);
            c.setExtraSell(extraSell);
            return c;
        }

        public int totalSell() {
            return sell + extraSell;
        }
    }

    @Data public static class Proxies {
        private String username = "";
        private String password = "";
        private List<String> endpoints = new ArrayList<>();
    }

    @Data public static class Trading {
        private String account = "";
        private List<Market> buyMarkets = new ArrayList<>(List.of(
                Market.DMARKET, Market.BITSKINS, Market.CS_FLOAT, Market.LIS_SKINS, Market.CS_MONEY));
        private List<Market> sellMarkets = new ArrayList<>(List.of(Market.MARKET_CSGO));
        private double minProfitMargin = 10;
        private int defaultMaxCount = 1; // 0 means no cap
    }
}
