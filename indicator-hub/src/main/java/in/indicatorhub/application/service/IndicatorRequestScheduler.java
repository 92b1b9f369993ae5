package in.indicatorhub.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.indicatorhub.domain.indicator.CacheKey;
import in.indicatorhub.domain.indicator.FallbackReason;
import in.indicatorhub.domain.indicator.Indicator;
import in.indicatorhub.domain.indicator.IndicatorSnapshot;
import in.indicatorhub.domain.indicator.IndicatorSpec;
import in.indicatorhub.domain.indicator.SnapshotSource;
import in.indicatorhub.domain.monitoring.OrchestratorHealth;
import in.indicatorhub.domain.plan.PlanTier;
import in.indicatorhub.domain.plan.SymbolRoute;
import in.indicatorhub.infrastructure.provider.BulkResult;
import in.indicatorhub.infrastructure.provider.IndicatorProvider;
import in.indicatorhub.infrastructure.provider.ProviderErrorClassifier;
import in.indicatorhub.infrastructure.provider.ProviderErrorType;
import in.indicatorhub.infrastructure.provider.ProviderException;
import in.indicatorhub.infrastructure.provider.common.CircuitBreaker;
import in.indicatorhub.infrastructure.provider.common.CircuitOpenException;
import in.indicatorhub.infrastructure.provider.common.RateLimitedException;
import in.indicatorhub.infrastructure.provider.common.RateLimiter;
import in.indicatorhub.infrastructure.provider.metrics.IndicatorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Request orchestrator in front of the indicator provider.
 *
 * Every {@link #enqueue} call resolves to a snapshot, live or fallback; the
 * returned future never completes exceptionally. Requests go through:
 * <ol>
 *   <li>result cache</li>
 *   <li>symbol capability routing (blacklisted / unsupported symbols never reach the queue)</li>
 *   <li>in-flight de-duplication (one provider call per key, any number of waiters)</li>
 *   <li>FIFO queue drained one request, or one contiguous bulk batch, at a time</li>
 * </ol>
 *
 * Threading: the queue, the pending map and the drain loop are confined to a
 * single scheduler thread. Rate-limit waits and provider responses resume on that
 * thread as scheduled continuations, so at most one drain is ever active.
 *
 * Usage:
 * <pre>
 * IndicatorRequestScheduler scheduler = IndicatorRequestScheduler.builder()
 *     .provider(new TaapiIndicatorProvider(url, secret, timeout, bulkTimeout))
 *     .metrics(metrics)
 *     .build();
 * scheduler.start();
 *
 * scheduler.enqueue("BTCUSDT", "1h", "binance")
 *     .thenAccept(snapshot -> score(snapshot));
 * </pre>
 */
public class IndicatorRequestScheduler {
    private static final Logger log = LoggerFactory.getLogger(IndicatorRequestScheduler.class);

    public static final String DEFAULT_INTERVAL = "1h";
    public static final String DEFAULT_EXCHANGE = "binance";

    static final List<Indicator> SEQUENTIAL_INDICATORS =
        List.of(Indicator.RSI, Indicator.MACD, Indicator.BBANDS, Indicator.EMA20);

    private static final AtomicInteger INSTANCE_COUNTER = new AtomicInteger();

    public enum SchedulerState {
        IDLE,
        COLLECTING,
        DRAINING
    }

    /**
     * One queued or in-flight provider request and everyone waiting for it.
     */
    private static final class PendingRequest {
        final CacheKey key;
        final Instant createdAt;
        final List<CompletableFuture<IndicatorSnapshot>> waiters = new ArrayList<>();
        String providerSymbol;
        boolean resolved;

        PendingRequest(CacheKey key, String providerSymbol, Instant createdAt) {
            this.key = key;
            this.providerSymbol = providerSymbol;
            this.createdAt = createdAt;
        }
    }

    private final IndicatorProvider provider;
    private final ResultCache cache;
    private final CircuitBreaker breaker;
    private final RateLimiter rateLimiter;
    private final SymbolCapabilityManager capabilities;
    private final BatchAggregator batchAggregator;
    private final FallbackProvider fallbackProvider;
    private final IndicatorMetrics metrics;
    private final Clock clock;
    private final Duration interCallPause;
    private final Duration providerTimeout;
    private final Duration bulkTimeout;
    private final Duration maintenanceInterval;

    private final ScheduledThreadPoolExecutor executor;
    private final String threadName;

    // drain-thread state
    private final Deque<PendingRequest> queue = new ArrayDeque<>();
    private final Map<CacheKey, PendingRequest> pending = new HashMap<>();
    private ScheduledFuture<?> wakeup;
    private ScheduledFuture<?> maintenanceTask;

    // readable from any thread
    private volatile SchedulerState state = SchedulerState.IDLE;
    private final AtomicInteger queueLength = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean running = new AtomicBoolean(true);

    private IndicatorRequestScheduler(Builder b, ResultCache cache, CircuitBreaker breaker,
                                      RateLimiter rateLimiter, SymbolCapabilityManager capabilities,
                                      FallbackProvider fallbackProvider, BatchAggregator batchAggregator) {
        this.provider = b.provider;
        this.cache = cache;
        this.breaker = breaker;
        this.rateLimiter = rateLimiter;
        this.capabilities = capabilities;
        this.fallbackProvider = fallbackProvider;
        this.batchAggregator = batchAggregator;
        this.metrics = b.metrics;
        this.clock = b.clock;
        this.interCallPause = b.interCallPause;
        this.providerTimeout = b.providerTimeout;
        this.bulkTimeout = b.bulkTimeout;
        this.maintenanceInterval = b.maintenanceInterval;

        this.threadName = "IndicatorScheduler-" + INSTANCE_COUNTER.incrementAndGet();
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);

        breaker.onStateChange(newState -> {
            if (metrics != null) {
                metrics.recordBreakerState(newState == CircuitBreaker.State.OPEN);
            }
        });
        if (b.adaptMinDelayToPlan) {
            capabilities.onPlanChange(tier -> rateLimiter.setMinDelay(tier.limits().minCallSpacing()));
        }
    }

    /**
     * Begin symbol discovery and periodic maintenance (cache sweep, stale symbol refresh).
     *
     * @return plan tier once discovery has finished (never fails)
     */
    public CompletableFuture<PlanTier> start() {
        log.info("[Scheduler] Starting {} (provider={}, interCallPause={}ms, batching={})",
            threadName, provider.getProviderCode(), interCallPause.toMillis(),
            batchAggregator.isActive(capabilities.getPlanTier()));
        runOnDrainThread(() -> {
            if (maintenanceTask == null) {
                long period = maintenanceInterval.toMillis();
                maintenanceTask = executor.scheduleAtFixedRate(this::maintenance, period, period,
                    TimeUnit.MILLISECONDS);
            }
        });
        return capabilities.initialize();
    }

    public CompletableFuture<IndicatorSnapshot> enqueue(String symbol) {
        return enqueue(symbol, DEFAULT_INTERVAL, DEFAULT_EXCHANGE);
    }

    /**
     * Request indicators for a symbol.
     *
     * @return future completing with a live, batch or fallback snapshot; never exceptional
     */
    public CompletableFuture<IndicatorSnapshot> enqueue(String symbol, String interval, String exchange) {
        try {
            CacheKey key;
            try {
                key = new CacheKey(SymbolCapabilityManager.normalize(symbol), interval, exchange);
            } catch (IllegalArgumentException e) {
                log.warn("[Scheduler] Rejected request symbol={} interval={} exchange={}: {}",
                    symbol, interval, exchange, e.getMessage());
                return CompletableFuture.completedFuture(fallback(String.valueOf(symbol), interval, exchange,
                    FallbackReason.INVALID_SYMBOL, e.getMessage()));
            }

            IndicatorSnapshot cached = cache.get(key);
            if (metrics != null) {
                metrics.recordCacheLookup(cached != null);
            }
            if (cached != null) {
                log.debug("[Scheduler] Cache hit for {}", key);
                return CompletableFuture.completedFuture(cached);
            }

            SymbolRoute route = capabilities.route(key.symbol());
            if (!route.isLive()) {
                log.debug("[Scheduler] {} routed to fallback ({})", key, route.fallbackReason().code());
                return CompletableFuture.completedFuture(fallback(key, route.fallbackReason(), null));
            }

            CompletableFuture<IndicatorSnapshot> result = new CompletableFuture<>();
            if (!running.get()) {
                result.complete(fallback(key, FallbackReason.SHUTDOWN, null));
                return result;
            }
            try {
                executor.execute(() -> admit(key, route, result));
            } catch (RejectedExecutionException e) {
                result.complete(fallback(key, FallbackReason.SHUTDOWN, "scheduler stopped"));
            }
            return result;

        } catch (RuntimeException e) {
            log.error("[Scheduler] Unexpected failure enqueueing {}: {}", symbol, e.getMessage(), e);
            return CompletableFuture.completedFuture(fallback(String.valueOf(symbol), interval, exchange,
                FallbackReason.PROVIDER_ERROR, e.getMessage()));
        }
    }

    private void admit(CacheKey key, SymbolRoute route, CompletableFuture<IndicatorSnapshot> waiter) {
        if (!running.get()) {
            waiter.complete(fallback(key, FallbackReason.SHUTDOWN, null));
            return;
        }

        // a drain may have filled the cache since the caller looked
        IndicatorSnapshot cached = cache.get(key);
        if (cached != null) {
            waiter.complete(cached);
            return;
        }

        PendingRequest existing = pending.get(key);
        if (existing != null) {
            existing.waiters.add(waiter);
            if (metrics != null) {
                metrics.recordDeduplicated();
            }
            log.debug("[Scheduler] {} already pending, attached waiter #{}", key, existing.waiters.size());
            return;
        }

        PendingRequest request = new PendingRequest(key, route.providerSymbol(), clock.instant());
        request.waiters.add(waiter);
        pending.put(key, request);
        queue.addLast(request);
        publishQueueLength();
        log.debug("[Scheduler] Queued {} ({} waiting)", key, queue.size());

        onQueued();
    }

    private void onQueued() {
        switch (state) {
            case DRAINING -> {
                // the running drain picks it up
            }
            case COLLECTING -> {
                if (queue.size() >= currentBatchSize()) {
                    startDrain();
                }
            }
            case IDLE -> {
                int batchSize = currentBatchSize();
                if (batchSize > 1 && queue.size() < batchSize) {
                    transition(SchedulerState.COLLECTING);
                    wakeup = executor.schedule(this::startDrain,
                        batchAggregator.getCollectionDelay().toMillis(), TimeUnit.MILLISECONDS);
                } else {
                    startDrain();
                }
            }
        }
    }

    private void startDrain() {
        cancelWakeup();
        transition(SchedulerState.DRAINING);
        drainNext();
    }

    /**
     * One step of the drain loop. Runs on the drain thread; the next step is
     * scheduled once the current provider call has been resolved.
     */
    private void drainNext() {
        wakeup = null;
        if (queue.isEmpty()) {
            transition(SchedulerState.IDLE);
            return;
        }
        if (breaker.isOpen()) {
            emergencyDrain(FallbackReason.CIRCUIT_OPEN);
            transition(SchedulerState.IDLE);
            return;
        }

        int batchSize = currentBatchSize();
        List<PendingRequest> taken = batchSize > 1 ? takeContiguousBatch(batchSize) : takeOne();
        publishQueueLength();
        if (taken.isEmpty()) {
            runOnDrainThread(this::drainNext);
            return;
        }

        boolean batched = batchSize > 1;
        CompletableFuture<Void> call = batched ? processBatch(taken) : processSingle(taken.get(0));
        call.whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("[Scheduler] Drain step failed unexpectedly: {}", error.getMessage(), error);
                for (PendingRequest request : taken) {
                    resolve(request, fallback(request.key, FallbackReason.PROVIDER_ERROR, error.getMessage()));
                }
            }
            continueDrain(batched);
        });
    }

    private void continueDrain(boolean batched) {
        if (!running.get()) {
            return;
        }
        if (queue.isEmpty()) {
            transition(SchedulerState.IDLE);
            return;
        }
        if (batched || interCallPause.isZero()) {
            runOnDrainThread(this::drainNext);
        } else {
            wakeup = executor.schedule(this::drainNext, interCallPause.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Pop the head request, answering any request whose symbol became
     * unservable while it was queued.
     */
    private List<PendingRequest> takeOne() {
        while (!queue.isEmpty()) {
            PendingRequest request = queue.pollFirst();
            if (reroute(request)) {
                return List.of(request);
            }
        }
        return List.of();
    }

    /**
     * Pop up to {@code batchSize} requests from the head that share the head's
     * interval and exchange. Stops at the first request of another series so
     * queue order is preserved.
     */
    private List<PendingRequest> takeContiguousBatch(int batchSize) {
        List<PendingRequest> batch = new ArrayList<>(batchSize);
        CacheKey head = null;
        while (!queue.isEmpty() && batch.size() < batchSize) {
            PendingRequest next = queue.peekFirst();
            if (head != null && !head.sameSeries(next.key)) {
                break;
            }
            queue.pollFirst();
            if (reroute(next)) {
                batch.add(next);
                head = next.key;
            }
        }
        return batch;
    }

    private boolean reroute(PendingRequest request) {
        SymbolRoute route = capabilities.route(request.key.symbol());
        if (!route.isLive()) {
            resolve(request, fallback(request.key, route.fallbackReason(), "rerouted while queued"));
            return false;
        }
        request.providerSymbol = route.providerSymbol();
        return true;
    }

    private CompletableFuture<Void> processSingle(PendingRequest request) {
        inFlight.incrementAndGet();
        log.debug("[Scheduler] Processing {} (waited {}ms, {} remaining)", request.key,
            Duration.between(request.createdAt, clock.instant()).toMillis(), queue.size());

        Map<String, Double> values = new LinkedHashMap<>();
        AtomicInteger parsed = new AtomicInteger();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Indicator indicator : SEQUENTIAL_INDICATORS) {
            IndicatorSpec spec = new IndicatorSpec(indicator, request.providerSymbol,
                request.key.interval(), request.key.exchange());
            chain = chain
                .thenCompose(v -> awaitClearance())
                .thenCompose(v -> callSingle(spec))
                .thenAccept(result -> {
                    Map<String, Double> extracted = indicator.extract(result);
                    if (!extracted.isEmpty()) {
                        values.putAll(extracted);
                        parsed.incrementAndGet();
                    } else {
                        log.warn("[Scheduler] Malformed {} result for {}", indicator.key(), request.key);
                    }
                });
        }

        return chain.handle((v, error) -> {
            inFlight.decrementAndGet();
            if (error == null && parsed.get() == 0) {
                error = new ProviderException("No usable indicator values for " + request.key, null);
            }
            if (error != null) {
                handleFailure(List.of(request), error);
                return null;
            }
            recordSuccess();
            IndicatorSnapshot snapshot = IndicatorSnapshot.live(request.key, values, parsed.get(),
                SnapshotSource.LIVE, clock.instant());
            cache.put(request.key, snapshot);
            capabilities.markSupported(request.key.symbol());
            resolve(request, snapshot);
            log.info("[Scheduler] {} served live ({} indicators)", request.key, parsed.get());
            return null;
        });
    }

    private CompletableFuture<Void> processBatch(List<PendingRequest> batch) {
        inFlight.addAndGet(batch.size());
        List<BatchAggregator.Member> members = new ArrayList<>(batch.size());
        for (PendingRequest request : batch) {
            members.add(new BatchAggregator.Member(request.key, request.providerSymbol));
        }
        log.info("[Scheduler] Bulk request for {} symbols ({} remaining)", batch.size(), queue.size());

        return awaitClearance()
            .thenCompose(v -> callBulk(members))
            .handle((results, error) -> {
                inFlight.addAndGet(-batch.size());
                if (error != null) {
                    handleFailure(batch, error);
                    return null;
                }
                BatchAggregator.BatchOutcome outcome = batchAggregator.demultiplex(members, results);
                boolean anyLive = outcome.snapshots().values().stream().anyMatch(s -> !s.fallbackData());
                boolean opened = false;
                if (anyLive || !outcome.rejected().isEmpty()) {
                    recordSuccess();
                } else {
                    // an empty bulk answer counts against the breaker like an empty single response
                    opened = breaker.recordFailure(ProviderErrorType.TRANSIENT.breakerWeight());
                    log.warn("[Scheduler] Bulk response for {} symbols carried no usable data", batch.size());
                }
                outcome.rejected().forEach((key, type) -> {
                    if (capabilities.markUnsupported(key.symbol(), type.fallbackReason())) {
                        publishBlacklistSize();
                    }
                });
                for (PendingRequest request : batch) {
                    IndicatorSnapshot snapshot = outcome.snapshots().get(request.key);
                    if (snapshot == null) {
                        snapshot = fallback(request.key, FallbackReason.MISSING_FROM_BATCH, null);
                    } else if (!snapshot.fallbackData()) {
                        cache.put(request.key, snapshot);
                        capabilities.markSupported(request.key.symbol());
                    }
                    resolve(request, snapshot);
                }
                if (opened) {
                    emergencyDrain(FallbackReason.CIRCUIT_OPEN);
                }
                return null;
            });
    }

    /**
     * Breaker check plus rate-limiter slot; completes on the drain thread once
     * the call may go out.
     */
    private CompletableFuture<Void> awaitClearance() {
        if (breaker.isOpen()) {
            return CompletableFuture.failedFuture(new CircuitOpenException(breaker.getReopenAt()));
        }
        Duration wait;
        try {
            wait = rateLimiter.reserve();
        } catch (RateLimitedException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (wait.isZero()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> cleared = new CompletableFuture<>();
        executor.schedule(() -> cleared.complete(null), wait.toMillis(), TimeUnit.MILLISECONDS);
        return cleared;
    }

    private CompletableFuture<JsonNode> callSingle(IndicatorSpec spec) {
        long started = System.nanoTime();
        return invoke(() -> provider.fetchIndicator(spec))
            .orTimeout(providerTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenCompleteAsync((result, error) -> recordCall("SINGLE", started, error), this::runOnDrainThread);
    }

    private CompletableFuture<List<BulkResult>> callBulk(List<BatchAggregator.Member> members) {
        long started = System.nanoTime();
        return invoke(() -> provider.fetchBulk(batchAggregator.buildConstructs(members)))
            .orTimeout(bulkTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenCompleteAsync((result, error) -> recordCall("BULK", started, error), this::runOnDrainThread);
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> call) {
        try {
            CompletableFuture<T> future = call.get();
            return future != null ? future : CompletableFuture.failedFuture(
                new ProviderException("Provider returned no future", null));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void recordSuccess() {
        breaker.recordSuccess();
        rateLimiter.recordSuccess();
    }

    /**
     * Apply the failure policy for one provider call and answer its requests
     * with fallback snapshots.
     */
    private void handleFailure(List<PendingRequest> requests, Throwable error) {
        ProviderErrorType type = ProviderErrorClassifier.classify(error);
        Throwable cause = ProviderErrorClassifier.unwrap(error);
        String symbols = requests.size() == 1 ? requests.get(0).key.toString() : requests.size() + " symbols";

        if (type == ProviderErrorType.THROTTLED && !ProviderErrorClassifier.isLocal(error)) {
            rateLimiter.engage();
            if (metrics != null) {
                metrics.recordRateLimitHit();
            }
        }
        if (type.blacklists() && requests.size() == 1) {
            if (capabilities.markUnsupported(requests.get(0).key.symbol(), type.fallbackReason())) {
                publishBlacklistSize();
            }
        }

        boolean opened = breaker.recordFailure(type.breakerWeight());
        if (type == ProviderErrorType.CIRCUIT_OPEN || type == ProviderErrorType.THROTTLED) {
            log.debug("[Scheduler] {} not sent: {}", symbols, cause.getMessage());
        } else {
            log.warn("[Scheduler] Provider call for {} failed ({}): {}", symbols, type, cause.getMessage());
        }

        for (PendingRequest request : requests) {
            resolve(request, fallback(request.key, type.fallbackReason(), cause.getMessage()));
        }
        if (opened) {
            emergencyDrain(FallbackReason.CIRCUIT_OPEN);
        }
    }

    /**
     * Answer every queued request with a fallback snapshot.
     *
     * @return number of requests drained
     */
    private int emergencyDrain(FallbackReason reason) {
        int drained = 0;
        PendingRequest request;
        while ((request = queue.pollFirst()) != null) {
            resolve(request, fallback(request.key, reason, null));
            drained++;
        }
        publishQueueLength();
        if (drained > 0) {
            log.warn("[Scheduler] Emergency drain: {} queued requests answered with fallback ({})",
                drained, reason.code());
        }
        return drained;
    }

    private void resolve(PendingRequest request, IndicatorSnapshot snapshot) {
        if (request.resolved) {
            return;
        }
        request.resolved = true;
        pending.remove(request.key, request);
        for (CompletableFuture<IndicatorSnapshot> waiter : request.waiters) {
            waiter.complete(snapshot);
        }
    }

    private IndicatorSnapshot fallback(CacheKey key, FallbackReason reason, String detail) {
        return fallback(key.symbol(), key.interval(), key.exchange(), reason, detail);
    }

    private IndicatorSnapshot fallback(String symbol, String interval, String exchange,
                                       FallbackReason reason, String detail) {
        if (metrics != null) {
            metrics.recordFallback(reason.code());
        }
        return fallbackProvider.build(symbol, interval, exchange, reason, detail);
    }

    /**
     * Operator escape hatch: clear breaker, rate-limit and cache state and
     * answer everything queued with fallback data.
     *
     * @return number of queued requests drained
     */
    public CompletableFuture<Integer> forceReset() {
        CompletableFuture<Integer> done = new CompletableFuture<>();
        boolean submitted = runOnDrainThread(() -> {
            log.warn("[Scheduler] Force reset requested");
            breaker.reset();
            rateLimiter.reset();
            cache.clear();
            int drained = emergencyDrain(FallbackReason.EMERGENCY_DRAIN);
            if (state == SchedulerState.COLLECTING || (state == SchedulerState.DRAINING && wakeup != null)) {
                cancelWakeup();
                transition(SchedulerState.IDLE);
            }
            done.complete(drained);
        });
        if (!submitted) {
            done.complete(0);
        }
        return done;
    }

    /**
     * Start draining now instead of waiting for the collection delay or the
     * inter-call pause. No effect while a provider call is in flight.
     *
     * @return queue length at the time of the flush
     */
    public CompletableFuture<Integer> forceFlush() {
        CompletableFuture<Integer> done = new CompletableFuture<>();
        boolean submitted = runOnDrainThread(() -> {
            int queued = queue.size();
            if (queued > 0 && (state != SchedulerState.DRAINING || wakeup != null)) {
                log.info("[Scheduler] Force flush of {} queued requests", queued);
                startDrain();
            }
            done.complete(queued);
        });
        if (!submitted) {
            done.complete(0);
        }
        return done;
    }

    public OrchestratorHealth getHealth() {
        return new OrchestratorHealth(
            breaker.isOpen(),
            breaker.getConsecutiveErrors(),
            rateLimiter.isRateLimited(),
            queueLength.get(),
            inFlight.get(),
            cache.size(),
            capabilities.getPlanTier(),
            state.name(),
            capabilities.getBlacklistedCount()
        );
    }

    public SchedulerState getState() {
        return state;
    }

    public SymbolCapabilityManager getCapabilities() {
        return capabilities;
    }

    /**
     * Answer everything outstanding with fallback data and stop the drain thread.
     */
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("[Scheduler] Stopping {}", threadName);

        CompletableFuture<Void> drained = new CompletableFuture<>();
        boolean submitted = runOnDrainThread(() -> {
            cancelWakeup();
            if (maintenanceTask != null) {
                maintenanceTask.cancel(false);
                maintenanceTask = null;
            }
            emergencyDrain(FallbackReason.SHUTDOWN);
            for (PendingRequest request : new ArrayList<>(pending.values())) {
                resolve(request, fallback(request.key, FallbackReason.SHUTDOWN, "in flight at shutdown"));
            }
            transition(SchedulerState.IDLE);
            drained.complete(null);
        });
        if (submitted) {
            try {
                drained.get(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                log.warn("[Scheduler] Outstanding requests not drained before stop: {}", e.getMessage());
            }
        }

        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void maintenance() {
        try {
            cache.sweep();
            capabilities.refreshIfStale();
            publishQueueLength();
            publishBlacklistSize();
        } catch (Exception e) {
            log.error("[Scheduler] Maintenance failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Single transition function for the drain state machine.
     */
    private void transition(SchedulerState target) {
        if (state != target) {
            log.debug("[Scheduler] {} -> {}", state, target);
            state = target;
        }
    }

    private void cancelWakeup() {
        if (wakeup != null) {
            wakeup.cancel(false);
            wakeup = null;
        }
    }

    private int currentBatchSize() {
        return batchAggregator.batchSize(capabilities.getPlanTier());
    }

    private boolean runOnDrainThread(Runnable task) {
        try {
            executor.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("[Scheduler] {} stopped, dropping task", threadName);
            return false;
        }
    }

    private void recordCall(String callType, long startedNanos, Throwable error) {
        if (metrics == null) {
            return;
        }
        String outcome = error == null ? "success" : ProviderErrorClassifier.classify(error).name();
        metrics.recordProviderCall(callType, outcome, Duration.ofNanos(System.nanoTime() - startedNanos));
    }

    private void publishQueueLength() {
        queueLength.set(queue.size());
        if (metrics != null) {
            metrics.recordQueueLength(queue.size());
        }
    }

    private void publishBlacklistSize() {
        if (metrics != null) {
            metrics.recordBlacklistSize(capabilities.getBlacklistedCount());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for IndicatorRequestScheduler. Only the provider is required.
     */
    public static class Builder {
        private IndicatorProvider provider;
        private ResultCache cache;
        private CircuitBreaker circuitBreaker;
        private RateLimiter rateLimiter;
        private SymbolCapabilityManager capabilities;
        private BatchAggregator batchAggregator;
        private FallbackProvider fallbackProvider;
        private IndicatorMetrics metrics;
        private Clock clock = Clock.systemUTC();
        private Duration interCallPause = Duration.ofSeconds(2);
        private Duration providerTimeout = Duration.ofSeconds(10);
        private Duration bulkTimeout = Duration.ofSeconds(30);
        private Duration maintenanceInterval = Duration.ofMinutes(1);
        private boolean adaptMinDelayToPlan = true;

        public Builder provider(IndicatorProvider provider) {
            this.provider = provider;
            return this;
        }

        public Builder cache(ResultCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder capabilities(SymbolCapabilityManager capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder batchAggregator(BatchAggregator batchAggregator) {
            this.batchAggregator = batchAggregator;
            return this;
        }

        public Builder fallbackProvider(FallbackProvider fallbackProvider) {
            this.fallbackProvider = fallbackProvider;
            return this;
        }

        /**
         * Optional; no metrics are recorded when absent.
         */
        public Builder metrics(IndicatorMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder interCallPause(Duration interCallPause) {
            if (interCallPause.isNegative()) {
                throw new IllegalArgumentException("Inter-call pause cannot be negative");
            }
            this.interCallPause = interCallPause;
            return this;
        }

        public Builder providerTimeout(Duration providerTimeout) {
            if (providerTimeout.isNegative() || providerTimeout.isZero()) {
                throw new IllegalArgumentException("Provider timeout must be positive");
            }
            this.providerTimeout = providerTimeout;
            return this;
        }

        public Builder bulkTimeout(Duration bulkTimeout) {
            if (bulkTimeout.isNegative() || bulkTimeout.isZero()) {
                throw new IllegalArgumentException("Bulk timeout must be positive");
            }
            this.bulkTimeout = bulkTimeout;
            return this;
        }

        public Builder maintenanceInterval(Duration maintenanceInterval) {
            if (maintenanceInterval.isNegative() || maintenanceInterval.isZero()) {
                throw new IllegalArgumentException("Maintenance interval must be positive");
            }
            this.maintenanceInterval = maintenanceInterval;
            return this;
        }

        /**
         * Whether the limiter's spacing follows the detected plan tier.
         * Disable when a min delay has been configured explicitly.
         */
        public Builder adaptMinDelayToPlan(boolean adaptMinDelayToPlan) {
            this.adaptMinDelayToPlan = adaptMinDelayToPlan;
            return this;
        }

        public IndicatorRequestScheduler build() {
            if (provider == null) {
                throw new IllegalStateException("Indicator provider is required");
            }
            FallbackProvider fallbacks = fallbackProvider != null ? fallbackProvider : new FallbackProvider(clock);
            ResultCache resultCache = cache != null ? cache : new ResultCache(Duration.ofMinutes(5), clock);
            CircuitBreaker breaker = circuitBreaker != null
                ? circuitBreaker
                : CircuitBreaker.builder().clock(clock).build();
            RateLimiter limiter = rateLimiter != null
                ? rateLimiter
                : RateLimiter.builder().clock(clock).minDelay(PlanTier.UNKNOWN.limits().minCallSpacing()).build();
            SymbolCapabilityManager symbolManager = capabilities != null
                ? capabilities
                : new SymbolCapabilityManager(provider, DEFAULT_EXCHANGE, Duration.ofHours(24), clock);
            BatchAggregator aggregator = batchAggregator != null
                ? batchAggregator
                : new BatchAggregator(fallbacks, true, Duration.ofMillis(250), clock);
            return new IndicatorRequestScheduler(this, resultCache, breaker, limiter, symbolManager,
                fallbacks, aggregator);
        }
    }
}
