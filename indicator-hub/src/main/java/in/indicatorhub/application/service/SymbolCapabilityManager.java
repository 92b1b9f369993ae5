package in.indicatorhub.application.service;

import in.indicatorhub.domain.indicator.FallbackReason;
import in.indicatorhub.domain.plan.PlanTier;
import in.indicatorhub.domain.plan.SymbolRoute;
import in.indicatorhub.domain.plan.SymbolStats;
import in.indicatorhub.infrastructure.provider.IndicatorProvider;
import in.indicatorhub.infrastructure.provider.ProviderErrorClassifier;
import in.indicatorhub.infrastructure.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tracks which symbols the active provider credentials may query.
 *
 * Responsibilities:
 * - Discover the permitted symbol list and infer the plan tier from its size
 * - Route each symbol to LIVE or FALLBACK_ONLY before any provider call
 * - Blacklist symbols only on unambiguous entitlement / invalid-symbol rejections
 * - Refresh the list once it is older than the refresh interval
 *
 * Until discovery succeeds the supported set holds the known free-plan symbols
 * and is not authoritative: unknown symbols still route LIVE and the provider
 * decides. Once discovery succeeds the list is authoritative and a symbol
 * missing from it routes FALLBACK_ONLY ({@code unsupported_by_plan}) without
 * a live attempt. Supported and blacklisted sets are kept disjoint.
 */
public class SymbolCapabilityManager {
    private static final Logger log = LoggerFactory.getLogger(SymbolCapabilityManager.class);

    public static final List<String> FREE_PLAN_SYMBOLS =
        List.of("BTCUSDT", "ETHUSDT", "XRPUSDT", "LTCUSDT", "XMRUSDT");

    // longest first
    private static final List<String> QUOTE_ASSETS =
        List.of("FDUSD", "USDT", "USDC", "BUSD", "BTC", "ETH", "BNB");

    private static final Pattern PERMITTED_LIST = Pattern.compile("\\[(.*?)\\]");
    private static final int STATS_SAMPLE_SIZE = 20;

    private final IndicatorProvider provider;
    private final String exchange;
    private final Duration refreshInterval;
    private final Clock clock;

    private final Set<String> supported = ConcurrentHashMap.newKeySet();
    private final Map<String, FallbackReason> blacklisted = new ConcurrentHashMap<>();
    private final AtomicBoolean refreshing = new AtomicBoolean(false);

    private volatile PlanTier planTier = PlanTier.UNKNOWN;
    private volatile boolean authoritative = false;
    private volatile Instant lastRefresh;
    private volatile Consumer<PlanTier> planListener;

    public SymbolCapabilityManager(IndicatorProvider provider, String exchange,
                                   Duration refreshInterval, Clock clock) {
        this.provider = provider;
        this.exchange = exchange;
        this.refreshInterval = refreshInterval;
        this.clock = clock;
        supported.addAll(FREE_PLAN_SYMBOLS);
    }

    public SymbolCapabilityManager(IndicatorProvider provider, String exchange) {
        this(provider, exchange, Duration.ofHours(24), Clock.systemUTC());
    }

    /**
     * Query the provider for the permitted symbol list.
     * Never completes exceptionally; on failure the previous state is kept.
     *
     * @return the plan tier after discovery
     */
    public CompletableFuture<PlanTier> initialize() {
        if (!refreshing.compareAndSet(false, true)) {
            log.debug("[SymbolCapability] Discovery already running");
            return CompletableFuture.completedFuture(planTier);
        }
        log.info("[SymbolCapability] Discovering permitted symbols on {}", exchange);
        CompletableFuture<List<String>> fetch;
        try {
            fetch = provider.fetchExchangeSymbols(exchange);
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        return fetch.handle((symbols, error) -> {
            try {
                if (error == null) {
                    applyDiscoveredSymbols(symbols, PlanTier.fromSymbolCount(symbols.size()), "exchange-symbols");
                } else {
                    applyDiscoveryFailure(error);
                }
            } finally {
                refreshing.set(false);
            }
            return planTier;
        });
    }

    /**
     * Re-run discovery if the list is older than the refresh interval.
     */
    public CompletableFuture<PlanTier> refreshIfStale() {
        Instant last = lastRefresh;
        if (last != null && Duration.between(last, clock.instant()).compareTo(refreshInterval) < 0) {
            return CompletableFuture.completedFuture(planTier);
        }
        return initialize();
    }

    /**
     * Operator refresh: forget the blacklist and rediscover.
     */
    public CompletableFuture<PlanTier> refreshSymbols() {
        int cleared = blacklisted.size();
        blacklisted.clear();
        log.warn("[SymbolCapability] Forced refresh, cleared {} blacklisted symbols", cleared);
        return initialize();
    }

    private void applyDiscoveryFailure(Throwable error) {
        Throwable cause = ProviderErrorClassifier.unwrap(error);
        if (cause instanceof ProviderException pe && pe.getStatusCode() == 403) {
            List<String> permitted = parsePermittedSymbols(pe.getProviderMessage());
            if (!permitted.isEmpty()) {
                log.info("[SymbolCapability] Provider listed permitted symbols in plan restriction: {}", permitted);
                applyDiscoveredSymbols(permitted, PlanTier.FREE, "plan-restriction");
                return;
            }
        }
        log.warn("[SymbolCapability] Symbol discovery failed, keeping {} known symbols (authoritative={}): {}",
            supported.size(), authoritative, cause.getMessage());
    }

    private void applyDiscoveredSymbols(Collection<String> symbols, PlanTier tier, String origin) {
        Set<String> normalized = new TreeSet<>();
        for (String symbol : symbols) {
            if (symbol != null && !symbol.isBlank()) {
                normalized.add(normalize(symbol));
            }
        }
        normalized.removeAll(blacklisted.keySet());

        supported.retainAll(normalized);
        supported.addAll(normalized);
        // a symbol blacklisted while the list was being applied
        supported.removeAll(blacklisted.keySet());
        authoritative = true;
        lastRefresh = clock.instant();

        PlanTier previous = planTier;
        planTier = tier;
        log.info("[SymbolCapability] {} symbols permitted via {}, plan tier {} (limits {})",
            supported.size(), origin, tier, tier.limits());

        if (previous != tier) {
            notifyPlanListener(tier);
        }
    }

    /**
     * Extract the bracketed symbol list from a plan-restriction message, e.g.
     * "Free plans only permits [BTC/USDT, ETH/USDT]".
     *
     * @return normalized symbols, empty if the message carries no list
     */
    static List<String> parsePermittedSymbols(String message) {
        List<String> symbols = new ArrayList<>();
        if (message == null || !message.toLowerCase(Locale.ROOT).contains("only permits")) {
            return symbols;
        }
        Matcher matcher = PERMITTED_LIST.matcher(message);
        if (!matcher.find()) {
            return symbols;
        }
        for (String part : matcher.group(1).split(",")) {
            String trimmed = part.trim().replace("\"", "").replace("'", "");
            if (!trimmed.isEmpty()) {
                symbols.add(normalize(trimmed));
            }
        }
        return symbols;
    }

    /**
     * Decide how a symbol will be served. Blacklisted symbols and, once the
     * list is authoritative, symbols outside it are never tried live.
     */
    public SymbolRoute route(String symbol) {
        String normalized = normalize(symbol);
        FallbackReason blacklistReason = blacklisted.get(normalized);
        if (blacklistReason != null) {
            return SymbolRoute.fallbackOnly(normalized, FallbackReason.BLACKLISTED);
        }
        if (supported.contains(normalized)) {
            return SymbolRoute.live(normalized, toProviderFormat(normalized), "supported");
        }
        if (!authoritative) {
            return SymbolRoute.live(normalized, toProviderFormat(normalized), "unverified");
        }
        return SymbolRoute.fallbackOnly(normalized, FallbackReason.UNSUPPORTED_BY_PLAN);
    }

    public boolean isServable(String symbol) {
        return route(symbol).isLive();
    }

    /**
     * Blacklist a symbol after a confirmed plan or invalid-symbol rejection.
     *
     * @return true if the symbol was not blacklisted before
     */
    public boolean markUnsupported(String symbol, FallbackReason reason) {
        String normalized = normalize(symbol);
        // blacklist before removing so a concurrent add is always undone by one side
        boolean added = blacklisted.putIfAbsent(normalized, reason) == null;
        supported.remove(normalized);
        if (added) {
            log.warn("[SymbolCapability] Blacklisted {} ({})", normalized, reason.code());
        }
        return added;
    }

    /**
     * Record that the provider served a symbol.
     */
    public void markSupported(String symbol) {
        String normalized = normalize(symbol);
        if (blacklisted.containsKey(normalized) || !supported.add(normalized)) {
            return;
        }
        if (blacklisted.containsKey(normalized)) {
            supported.remove(normalized);
            return;
        }
        log.debug("[SymbolCapability] Learned supported symbol {}", normalized);
    }

    public SymbolStats getStats() {
        List<String> sample = new TreeSet<>(supported).stream().limit(STATS_SAMPLE_SIZE).toList();
        List<String> blacklist = List.copyOf(new TreeSet<>(blacklisted.keySet()));
        return new SymbolStats(planTier, planTier.limits(), authoritative, supported.size(), sample,
            blacklist.size(), blacklist, lastRefresh, recommendations());
    }

    List<String> recommendations() {
        List<String> recommendations = new ArrayList<>();
        if (planTier == PlanTier.FREE) {
            recommendations.add("Free plan detected - consider upgrading for more symbols");
            recommendations.add("Focus trading on: " + String.join(", ", new TreeSet<>(supported)));
        }
        if (blacklisted.size() > 10) {
            recommendations.add("Many symbols unsupported - optimize symbol selection");
        }
        if (supported.size() < 10) {
            recommendations.add("Limited symbol coverage - refresh symbol list or upgrade plan");
        }
        return recommendations;
    }

    private void notifyPlanListener(PlanTier tier) {
        Consumer<PlanTier> listener = planListener;
        if (listener == null) {
            return;
        }
        try {
            listener.accept(tier);
        } catch (Exception e) {
            log.error("[SymbolCapability] Plan listener failed: {}", e.getMessage(), e);
        }
    }

    public void onPlanChange(Consumer<PlanTier> listener) {
        this.planListener = listener;
    }

    public PlanTier getPlanTier() {
        return planTier;
    }

    public boolean isAuthoritative() {
        return authoritative;
    }

    public int getBlacklistedCount() {
        return blacklisted.size();
    }

    public boolean isBlacklisted(String symbol) {
        return blacklisted.containsKey(normalize(symbol));
    }

    public boolean isSupported(String symbol) {
        return supported.contains(normalize(symbol));
    }

    public Instant getLastRefresh() {
        return lastRefresh;
    }

    /**
     * Canonical symbol form: "btc/usdt", "BTC-USDT" and "btcusdt" all become "BTCUSDT".
     */
    public static String normalize(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        StringBuilder sb = new StringBuilder(symbol.length());
        for (char c : symbol.trim().toCharArray()) {
            if (c != '/' && c != '-' && c != '_' && !Character.isWhitespace(c)) {
                sb.append(Character.toUpperCase(c));
            }
        }
        return sb.toString();
    }

    /**
     * Provider symbol form: "BTCUSDT" becomes "BTC/USDT".
     * Symbols without a known quote asset are passed through unchanged.
     */
    public static String toProviderFormat(String symbol) {
        String normalized = normalize(symbol);
        for (String quote : QUOTE_ASSETS) {
            if (normalized.length() > quote.length() && normalized.endsWith(quote)) {
                return normalized.substring(0, normalized.length() - quote.length()) + "/" + quote;
            }
        }
        return normalized;
    }
}
