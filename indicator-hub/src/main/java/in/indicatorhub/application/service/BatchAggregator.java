package in.indicatorhub.application.service;

import in.indicatorhub.domain.indicator.CacheKey;
import in.indicatorhub.domain.indicator.FallbackReason;
import in.indicatorhub.domain.indicator.Indicator;
import in.indicatorhub.domain.indicator.IndicatorSnapshot;
import in.indicatorhub.domain.indicator.SnapshotSource;
import in.indicatorhub.domain.plan.PlanTier;
import in.indicatorhub.infrastructure.provider.BulkConstruct;
import in.indicatorhub.infrastructure.provider.BulkResult;
import in.indicatorhub.infrastructure.provider.ProviderErrorClassifier;
import in.indicatorhub.infrastructure.provider.ProviderErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Packs several symbols into one bulk provider call and splits the answer back
 * into per-symbol snapshots.
 *
 * Every indicator item carries the correlation id {@code SYMBOL:indicatorKey}.
 * A symbol with no usable item in the response gets a fallback snapshot; a
 * partially answered symbol is live with {@code realIndicatorCount} set to the
 * number of indicators that parsed.
 */
public class BatchAggregator {
    private static final Logger log = LoggerFactory.getLogger(BatchAggregator.class);

    public static final List<Indicator> BULK_INDICATORS = List.of(Indicator.values());

    /**
     * One queued request taking part in a bulk call.
     */
    public record Member(CacheKey key, String providerSymbol) {}

    /**
     * Demultiplexed bulk response.
     *
     * @param snapshots one snapshot per member, live or fallback
     * @param rejected members whose every item was refused with a blacklisting error
     */
    public record BatchOutcome(Map<CacheKey, IndicatorSnapshot> snapshots,
                               Map<CacheKey, ProviderErrorType> rejected) {}

    private final FallbackProvider fallbackProvider;
    private final boolean enabled;
    private final Duration collectionDelay;
    private final Clock clock;

    public BatchAggregator(FallbackProvider fallbackProvider, boolean enabled,
                           Duration collectionDelay, Clock clock) {
        this.fallbackProvider = fallbackProvider;
        this.enabled = enabled;
        this.collectionDelay = collectionDelay;
        this.clock = clock;
    }

    /**
     * @return whether bulk calls are used under the given plan
     */
    public boolean isActive(PlanTier tier) {
        return enabled && tier.limits().supportsBulk();
    }

    /**
     * @return symbols per bulk call under the given plan, 1 when batching is off
     */
    public int batchSize(PlanTier tier) {
        return isActive(tier) ? tier.limits().bulkBatchSize() : 1;
    }

    public Duration getCollectionDelay() {
        return collectionDelay;
    }

    public List<BulkConstruct> buildConstructs(List<Member> members) {
        List<BulkConstruct> constructs = new ArrayList<>(members.size());
        for (Member member : members) {
            CacheKey key = member.key();
            constructs.add(new BulkConstruct(key.symbol(), member.providerSymbol(),
                key.interval(), key.exchange(), BULK_INDICATORS));
        }
        return constructs;
    }

    public BatchOutcome demultiplex(List<Member> members, List<BulkResult> results) {
        Map<String, List<BulkResult>> bySymbol = new HashMap<>();
        for (BulkResult result : results) {
            int sep = result.id().lastIndexOf(BulkConstruct.ID_SEPARATOR);
            if (sep <= 0) {
                log.warn("[BatchAggregator] Ignoring bulk item with unexpected id '{}'", result.id());
                continue;
            }
            bySymbol.computeIfAbsent(result.id().substring(0, sep), s -> new ArrayList<>()).add(result);
        }

        Instant now = clock.instant();
        Map<CacheKey, IndicatorSnapshot> snapshots = new LinkedHashMap<>();
        Map<CacheKey, ProviderErrorType> rejected = new LinkedHashMap<>();

        for (Member member : members) {
            CacheKey key = member.key();
            List<BulkResult> items = bySymbol.getOrDefault(key.symbol(), List.of());

            Map<String, Double> values = new LinkedHashMap<>();
            int parsed = 0;
            for (BulkResult item : items) {
                Map<String, Double> extracted = extract(item);
                if (!extracted.isEmpty()) {
                    values.putAll(extracted);
                    parsed++;
                }
            }

            if (parsed > 0) {
                snapshots.put(key, IndicatorSnapshot.live(key, values, parsed, SnapshotSource.BATCH, now));
                continue;
            }

            Optional<ProviderErrorType> rejection = commonRejection(items);
            if (rejection.isPresent()) {
                rejected.put(key, rejection.get());
                snapshots.put(key, fallbackProvider.build(key.symbol(), key.interval(), key.exchange(),
                    rejection.get().fallbackReason(), items.get(0).errors().get(0)));
            } else {
                log.warn("[BatchAggregator] No indicators received for {}, using fallback", key);
                snapshots.put(key, fallbackProvider.build(key.symbol(), key.interval(), key.exchange(),
                    FallbackReason.MISSING_FROM_BATCH, items.isEmpty() ? "absent" : "malformed"));
            }
        }

        log.debug("[BatchAggregator] Demultiplexed {} items into {} snapshots ({} rejected)",
            results.size(), snapshots.size(), rejected.size());
        return new BatchOutcome(snapshots, rejected);
    }

    private Map<String, Double> extract(BulkResult item) {
        if (item.hasErrors() || item.result() == null) {
            return Map.of();
        }
        String indicatorKey = item.id().substring(item.id().lastIndexOf(BulkConstruct.ID_SEPARATOR) + 1);
        try {
            return Indicator.fromKey(indicatorKey).extract(item.result());
        } catch (IllegalArgumentException e) {
            log.warn("[BatchAggregator] Unknown indicator in bulk id '{}'", item.id());
            return Map.of();
        }
    }

    /**
     * A symbol is rejected only when every one of its items carries an error
     * that classifies to the same blacklisting type.
     */
    private Optional<ProviderErrorType> commonRejection(List<BulkResult> items) {
        if (items.isEmpty()) {
            return Optional.empty();
        }
        ProviderErrorType common = null;
        for (BulkResult item : items) {
            if (!item.hasErrors()) {
                return Optional.empty();
            }
            Optional<ProviderErrorType> type = ProviderErrorClassifier.classifyMessage(item.errors().get(0));
            if (type.isEmpty() || !type.get().blacklists()) {
                return Optional.empty();
            }
            if (common != null && common != type.get()) {
                return Optional.empty();
            }
            common = type.get();
        }
        return Optional.ofNullable(common);
    }
}
