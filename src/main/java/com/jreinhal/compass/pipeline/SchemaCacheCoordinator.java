package com.jreinhal.compass.pipeline;

import com.github.benmanes.caffeine.cache.Cache;
import com.jreinhal.compass.schema.DynamicSchema;
import com.jreinhal.compass.schema.SchemaDiscoveryService;
import com.jreinhal.compass.schema.SchemaPromptBuilder;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Owns the schema cache, the pre-built prompt sections and the per-namespace pipeline state.
 *
 * <p>Regeneration is driven by document changes only. Requests are debounced per namespace,
 * at most one regeneration runs per namespace, and a request arriving while one runs is
 * queued (merged with any entry already queued for that namespace) and drained after a
 * settle delay. While a namespace regenerates, or has a follow-up waiting out the settle
 * delay, {@link #checkPipelineStatus(Collection)} reports it as blocked so queries never run
 * against a half-built schema.</p>
 *
 * <p>Every run is stamped with the namespace generation it started under. Clearing a namespace
 * bumps the generation; a run still in flight from an older generation keeps the namespace
 * busy until it ends, but its result is discarded.</p>
 *
 * <p>Reads ({@link #getSchemas}, {@link #getPrompt}) never trigger discovery.</p>
 */
@Component
public class SchemaCacheCoordinator {
    private static final Logger log = LoggerFactory.getLogger(SchemaCacheCoordinator.class);

    static final String GLOBAL_LOCK_MESSAGE = "시스템이 업데이트 중입니다. 잠시 후 다시 시도해 주세요.";
    static final String SINGLE_UPDATE_MESSAGE = "데이터가 업데이트 중입니다. 약 10-30초 후 다시 질문해 주세요.";
    static final long MIN_WAIT_MS = 5000L;
    static final long MAX_WAIT_MS = 60000L;
    private static final long DEFAULT_ESTIMATE_MS = 30000L;

    private final SchemaDiscoveryService discoveryService;
    private final SchemaPromptBuilder promptBuilder;
    private final ScheduledExecutorService scheduler;
    private final Executor discoveryExecutor;
    private final Cache<String, String> promptCache;
    private final Clock clock;

    @Value("${compass.pipeline.debounce-ms:2000}")
    private long debounceMs;
    @Value("${compass.pipeline.settle-ms:500}")
    private long settleMs;
    @Value("${compass.pipeline.max-queue-size:100}")
    private int maxQueueSize;
    @Value("${compass.pipeline.wait-timeout-ms:60000}")
    private long defaultWaitTimeoutMs;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, NamespacePipelineState> states = new HashMap<>();
    private final Map<String, DynamicSchema> schemas = new HashMap<>();
    private final Map<String, PendingDebounce> debounces = new HashMap<>();
    private final Map<String, UpdateRequest> inFlight = new HashMap<>();
    private final LinkedHashMap<String, UpdateRequest> queue = new LinkedHashMap<>();
    private final Map<String, UpdateRequest> settling = new HashMap<>();
    private final Map<String, Long> generations = new HashMap<>();
    private final Map<String, List<CompletableFuture<Boolean>>> waiters = new HashMap<>();
    private boolean globalLock;
    private String globalLockReason;

    public SchemaCacheCoordinator(SchemaDiscoveryService discoveryService,
                                  SchemaPromptBuilder promptBuilder,
                                  @Qualifier("schemaUpdateScheduler") ScheduledExecutorService scheduler,
                                  @Qualifier("discoveryExecutor") Executor discoveryExecutor,
                                  @Qualifier("schemaPromptCache") Cache<String, String> promptCache,
                                  Clock clock) {
        this.discoveryService = discoveryService;
        this.promptBuilder = promptBuilder;
        this.scheduler = scheduler;
        this.discoveryExecutor = discoveryExecutor;
        this.promptCache = promptCache;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        log.info("Schema cache coordinator initialized (debounceMs={}, settleMs={}, maxQueueSize={})",
                this.debounceMs, this.settleMs, this.maxQueueSize);
    }

    /**
     * Requests regeneration of one namespace. A newer request inside the debounce window
     * replaces the pending one and inherits its completion futures; {@link UpdateReason#INITIAL}
     * skips the debounce.
     *
     * @return completes with the success flag of the regeneration that served this request,
     *         or {@code false} if the request was dropped
     */
    public CompletableFuture<Boolean> requestUpdate(String namespace, UpdateReason reason, String documentId) {
        CompletableFuture<Boolean> completion = new CompletableFuture<>();
        UpdateRequest request = new UpdateRequest(namespace, reason, Instant.now(this.clock));
        request.addDocument(documentId);
        request.futures.add(completion);
        boolean immediate = reason == UpdateReason.INITIAL;
        this.lock.lock();
        try {
            PendingDebounce existing = this.debounces.remove(namespace);
            if (existing != null) {
                existing.timer().cancel(false);
                request.absorb(existing.request());
                log.debug("Debounced update for {} superseded by newer request", namespace);
            }
            if (!immediate) {
                ScheduledFuture<?> timer = this.scheduler.schedule(() -> this.fireDebounced(namespace, request),
                        this.debounceMs, TimeUnit.MILLISECONDS);
                this.debounces.put(namespace, new PendingDebounce(request, timer));
            }
        }
        finally {
            this.lock.unlock();
        }
        if (immediate) {
            this.executeUpdate(request);
        }
        return completion;
    }

    private void fireDebounced(String namespace, UpdateRequest request) {
        this.lock.lock();
        try {
            PendingDebounce pending = this.debounces.get(namespace);
            if (pending == null || pending.request() != request) {
                return;
            }
            this.debounces.remove(namespace);
        }
        finally {
            this.lock.unlock();
        }
        this.executeUpdate(request);
    }

    void executeUpdate(UpdateRequest request) {
        String namespace = request.namespace;
        List<CompletableFuture<Boolean>> dropped = List.of();
        boolean start = false;
        this.lock.lock();
        try {
            if (request.cancelled) {
                return;
            }
            UpdateRequest settled = this.settling.get(namespace);
            if (settled == request) {
                this.settling.remove(namespace);
                settled = null;
            }
            if (settled != null) {
                settled.absorb(request);
                log.debug("Update for {} merged into settling follow-up", namespace);
            } else if (this.isBusy(namespace)) {
                UpdateRequest queued = this.queue.get(namespace);
                if (queued != null) {
                    queued.absorb(request);
                    log.debug("Update for {} merged into queued entry", namespace);
                } else if (this.queue.size() >= this.maxQueueSize) {
                    log.warn("Update queue full ({} entries), dropping update for {} (reason: {})",
                            this.queue.size(), namespace, request.reason.id());
                    dropped = new ArrayList<>(request.futures);
                } else {
                    this.queue.put(namespace, request);
                    log.info("Update queued for {} (already updating)", namespace);
                }
            } else {
                this.markStarted(namespace, request.reason);
                request.generation = this.generationOf(namespace);
                this.inFlight.put(namespace, request);
                start = true;
            }
        }
        finally {
            this.lock.unlock();
        }
        dropped.forEach(f -> f.complete(false));
        if (!start) {
            return;
        }
        try {
            this.discoveryExecutor.execute(() -> this.runDiscovery(request));
        }
        catch (RejectedExecutionException e) {
            log.error("Discovery executor rejected update for {}", namespace, e);
            this.finishUpdate(namespace, request, false, "Discovery executor rejected update");
        }
    }

    private void runDiscovery(UpdateRequest request) {
        String namespace = request.namespace;
        try {
            this.updateProgress(request, 10);
            Optional<DynamicSchema> schema = this.discoveryService.discoverNamespaceSchema(namespace);
            this.updateProgress(request, 80);
            this.storeSchema(request, schema.orElse(null));
            this.finishUpdate(namespace, request, true, null);
        }
        catch (RuntimeException e) {
            log.error("Schema regeneration failed for {}", namespace, e);
            this.finishUpdate(namespace, request, false, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void storeSchema(UpdateRequest request, DynamicSchema schema) {
        String namespace = request.namespace;
        this.lock.lock();
        try {
            if (!this.isCurrent(request)) {
                log.info("Discarding regenerated schema for {} (namespace cleared during update)", namespace);
                return;
            }
            if (schema == null) {
                this.schemas.remove(namespace);
                this.promptCache.invalidate(namespace);
            } else {
                this.schemas.put(namespace, schema);
                this.promptCache.put(namespace, this.promptBuilder.buildSection(schema));
            }
        }
        finally {
            this.lock.unlock();
        }
    }

    /**
     * Marks a namespace as updating without scheduling discovery.
     *
     * @return false if the namespace is already updating
     */
    public boolean startUpdate(String namespace, UpdateReason reason) {
        this.lock.lock();
        try {
            if (this.isBusy(namespace)) {
                return false;
            }
            this.markStarted(namespace, reason);
            return true;
        }
        finally {
            this.lock.unlock();
        }
    }

    private void markStarted(String namespace, UpdateReason reason) {
        NamespacePipelineState current = this.states.getOrDefault(namespace, NamespacePipelineState.idle(namespace));
        this.states.put(namespace, current.started(reason, Instant.now(this.clock)));
        log.info("Update started for {} (reason: {})", namespace, reason.id());
    }

    private void updateProgress(UpdateRequest request, int progress) {
        this.lock.lock();
        try {
            if (this.isCurrent(request)) {
                this.updateProgress(request.namespace, progress);
            }
        }
        finally {
            this.lock.unlock();
        }
    }

    public void updateProgress(String namespace, int progress) {
        this.lock.lock();
        try {
            NamespacePipelineState state = this.states.get(namespace);
            if (state != null) {
                this.states.put(namespace, state.withProgress(progress));
            }
        }
        finally {
            this.lock.unlock();
        }
    }

    /**
     * Ends the running update of a namespace and fires its completion futures. Waiters are
     * released only once nothing is queued behind it; otherwise the queued follow-up is
     * scheduled after the settle delay and the waiters stay with the namespace.
     */
    public void completeUpdate(String namespace, boolean success, String error) {
        this.finishUpdate(namespace, null, success, error);
    }

    private void finishUpdate(String namespace, UpdateRequest expected, boolean success, String error) {
        List<CompletableFuture<Boolean>> finishedFutures = List.of();
        List<CompletableFuture<Boolean>> released = List.of();
        boolean superseded;
        UpdateRequest next;
        this.lock.lock();
        try {
            UpdateRequest finished = this.inFlight.get(namespace);
            if (expected != null && finished != expected) {
                log.debug("Ignoring completion of an update for {} that is no longer in flight", namespace);
                return;
            }
            superseded = finished != null && !this.isCurrent(finished);
            if (finished != null) {
                this.inFlight.remove(namespace);
                finishedFutures = new ArrayList<>(finished.futures);
            }
            if (!superseded) {
                NamespacePipelineState state = this.states.get(namespace);
                if (state != null) {
                    this.states.put(namespace, state.completed(success, error, Instant.now(this.clock)));
                }
            }
            next = this.queue.remove(namespace);
            if (next != null) {
                this.settling.put(namespace, next);
            } else {
                List<CompletableFuture<Boolean>> namespaceWaiters = this.waiters.remove(namespace);
                if (namespaceWaiters != null) {
                    released = namespaceWaiters;
                }
            }
        }
        finally {
            this.lock.unlock();
        }
        if (superseded) {
            log.info("Update of cleared namespace {} finished, result discarded", namespace);
        } else {
            log.info("Update completed for {} (success: {})", namespace, success);
        }
        boolean outcome = success && !superseded;
        boolean idleOutcome = success || superseded;
        finishedFutures.forEach(f -> f.complete(outcome));
        released.forEach(f -> f.complete(idleOutcome));
        if (next != null) {
            this.scheduler.schedule(() -> this.executeUpdate(next), this.settleMs, TimeUnit.MILLISECONDS);
        }
    }

    private boolean isBusy(String namespace) {
        NamespacePipelineState state = this.states.get(namespace);
        return (state != null && state.updating())
                || this.inFlight.containsKey(namespace)
                || this.settling.containsKey(namespace);
    }

    private long generationOf(String namespace) {
        return this.generations.getOrDefault(namespace, 0L);
    }

    private boolean isCurrent(UpdateRequest request) {
        return this.inFlight.get(request.namespace) == request && request.generation == this.generationOf(request.namespace);
    }

    public PipelineStatus checkPipelineStatus(Collection<String> namespaces) {
        this.lock.lock();
        try {
            List<String> updating = namespaces.stream()
                    .filter(this::isBusy)
                    .toList();
            if (this.globalLock || !updating.isEmpty()) {
                PipelineStatus.BlockReason reason = this.globalLock ? PipelineStatus.BlockReason.GLOBAL : PipelineStatus.BlockReason.NAMESPACE;
                return new PipelineStatus.Blocked(reason, this.blockedMessage(updating), this.estimateWaitTime(updating), updating);
            }
            Instant lastUpdated = null;
            boolean allReady = !namespaces.isEmpty();
            for (String ns : namespaces) {
                NamespacePipelineState state = this.states.get(ns);
                Instant stamp = state != null ? state.lastUpdatedAt() : null;
                if (stamp == null) {
                    allReady = false;
                } else if (lastUpdated == null || stamp.isAfter(lastUpdated)) {
                    lastUpdated = stamp;
                }
            }
            return new PipelineStatus.Ready(allReady, lastUpdated);
        }
        finally {
            this.lock.unlock();
        }
    }

    private String blockedMessage(List<String> updating) {
        if (this.globalLock) {
            return GLOBAL_LOCK_MESSAGE;
        }
        if (updating.size() == 1) {
            return SINGLE_UPDATE_MESSAGE;
        }
        return updating.size() + "개 데이터 영역이 업데이트 중입니다. 잠시 후 다시 시도해 주세요.";
    }

    long estimateWaitTime(List<String> updating) {
        long now = this.clock.millis();
        double maxWait = 0.0;
        for (String ns : updating) {
            NamespacePipelineState state = this.states.get(ns);
            if (state == null || !state.updating() || state.updateStartedAt() == null) {
                continue;
            }
            long elapsed = now - state.updateStartedAt().toEpochMilli();
            if (state.progress() > 0) {
                double estimatedTotal = (double) elapsed / state.progress() * 100.0;
                maxWait = Math.max(maxWait, estimatedTotal - elapsed);
            } else {
                maxWait = Math.max(maxWait, DEFAULT_ESTIMATE_MS - elapsed);
            }
        }
        return Math.max(MIN_WAIT_MS, Math.min((long) maxWait, MAX_WAIT_MS));
    }

    public boolean waitForUpdate(String namespace) {
        return this.waitForUpdate(namespace, this.defaultWaitTimeoutMs);
    }

    /**
     * Blocks until the namespace has no running or pending regeneration.
     *
     * @return true when idle (immediately or after the update succeeded); false on timeout,
     *         interruption or a failed update
     */
    public boolean waitForUpdate(String namespace, long timeoutMs) {
        CompletableFuture<Boolean> waiter = new CompletableFuture<>();
        this.lock.lock();
        try {
            boolean pending = this.debounces.containsKey(namespace) || this.queue.containsKey(namespace);
            if (!this.isBusy(namespace) && !pending) {
                return true;
            }
            this.waiters.computeIfAbsent(namespace, k -> new ArrayList<>()).add(waiter);
        }
        finally {
            this.lock.unlock();
        }
        try {
            return waiter.get(timeoutMs, TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            log.warn("Timed out after {}ms waiting for update of {}", timeoutMs, namespace);
            this.removeWaiter(namespace, waiter);
            return false;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            this.removeWaiter(namespace, waiter);
            return false;
        }
        catch (ExecutionException e) {
            log.warn("Waiting for update of {} failed: {}", namespace, e.getMessage());
            return false;
        }
    }

    private void removeWaiter(String namespace, CompletableFuture<Boolean> waiter) {
        this.lock.lock();
        try {
            List<CompletableFuture<Boolean>> list = this.waiters.get(namespace);
            if (list != null) {
                list.remove(waiter);
                if (list.isEmpty()) {
                    this.waiters.remove(namespace);
                }
            }
        }
        finally {
            this.lock.unlock();
        }
    }

    public void setGlobalLock(boolean locked, String reason) {
        this.lock.lock();
        try {
            this.globalLock = locked;
            this.globalLockReason = locked ? reason : null;
        }
        finally {
            this.lock.unlock();
        }
        log.info("Global lock {} ({})", locked ? "acquired" : "released", reason);
    }

    public GlobalPipelineState getGlobalState() {
        this.lock.lock();
        try {
            List<String> updating = new ArrayList<>();
            Instant lastGlobalUpdate = null;
            for (NamespacePipelineState state : this.states.values()) {
                if (state.lastUpdatedAt() != null && (lastGlobalUpdate == null || state.lastUpdatedAt().isAfter(lastGlobalUpdate))) {
                    lastGlobalUpdate = state.lastUpdatedAt();
                }
            }
            Set<String> known = new TreeSet<>(this.states.keySet());
            known.addAll(this.inFlight.keySet());
            known.addAll(this.settling.keySet());
            known.stream().filter(this::isBusy).forEach(updating::add);
            List<GlobalPipelineState.QueuedUpdate> queued = this.queue.values().stream()
                    .map(r -> new GlobalPipelineState.QueuedUpdate(r.namespace, r.reason, r.requestedAt, List.copyOf(r.documentIds)))
                    .toList();
            return new GlobalPipelineState(!updating.isEmpty() || this.globalLock, this.globalLock, this.globalLockReason,
                    updating, lastGlobalUpdate, queued);
        }
        finally {
            this.lock.unlock();
        }
    }

    public Optional<NamespacePipelineState> getState(String namespace) {
        this.lock.lock();
        try {
            return Optional.ofNullable(this.states.get(namespace));
        }
        finally {
            this.lock.unlock();
        }
    }

    public void initializeNamespace(String namespace) {
        this.lock.lock();
        try {
            this.states.putIfAbsent(namespace, NamespacePipelineState.idle(namespace));
        }
        finally {
            this.lock.unlock();
        }
    }

    /**
     * Forgets a namespace entirely: state, schema, prompt section, pending debounce, queued
     * entry and settling follow-up. Futures of dropped requests and any waiters complete with
     * {@code false}. A discovery already running is left to finish, but its result is discarded
     * and the namespace counts as busy until it ends, so a new request is queued behind it.
     */
    public void clearNamespace(String namespace) {
        List<CompletableFuture<Boolean>> cancelled = new ArrayList<>();
        this.lock.lock();
        try {
            this.generations.merge(namespace, 1L, Long::sum);
            this.states.remove(namespace);
            this.schemas.remove(namespace);
            this.promptCache.invalidate(namespace);
            PendingDebounce pending = this.debounces.remove(namespace);
            if (pending != null) {
                pending.timer().cancel(false);
                pending.request().cancelled = true;
                cancelled.addAll(pending.request().futures);
            }
            UpdateRequest queued = this.queue.remove(namespace);
            if (queued != null) {
                queued.cancelled = true;
                cancelled.addAll(queued.futures);
            }
            UpdateRequest settled = this.settling.remove(namespace);
            if (settled != null) {
                settled.cancelled = true;
                cancelled.addAll(settled.futures);
            }
            List<CompletableFuture<Boolean>> namespaceWaiters = this.waiters.remove(namespace);
            if (namespaceWaiters != null) {
                cancelled.addAll(namespaceWaiters);
            }
        }
        finally {
            this.lock.unlock();
        }
        cancelled.forEach(f -> f.complete(false));
        log.info("Namespace {} cleared", namespace);
    }

    /**
     * True when the namespace never completed a successful regeneration and none is running
     * or pending for it.
     */
    public boolean needsInitialUpdate(String namespace) {
        this.lock.lock();
        try {
            if (this.isBusy(namespace)) {
                return false;
            }
            if (this.debounces.containsKey(namespace) || this.queue.containsKey(namespace)) {
                return false;
            }
            NamespacePipelineState state = this.states.get(namespace);
            return state == null || state.lastUpdatedAt() == null;
        }
        finally {
            this.lock.unlock();
        }
    }

    public List<DynamicSchema> getSchemas(Collection<String> namespaces) {
        this.lock.lock();
        try {
            return namespaces.stream()
                    .map(this.schemas::get)
                    .filter(s -> s != null)
                    .toList();
        }
        finally {
            this.lock.unlock();
        }
    }

    /**
     * Concatenates the pre-built prompt sections of the given namespaces. A section evicted
     * from the size-bounded cache is rebuilt from its cached schema.
     */
    public String getPrompt(Collection<String> namespaces) {
        List<String> sections = new ArrayList<>();
        for (DynamicSchema schema : this.getSchemas(namespaces)) {
            sections.add(this.promptCache.get(schema.namespace(), ns -> this.promptBuilder.buildSection(schema)));
        }
        if (sections.isEmpty()) {
            return this.promptBuilder.buildPromptSection(List.of());
        }
        return String.join("\n\n", sections);
    }

    /**
     * Drops cached schemas and prompt sections, for one namespace or all when {@code namespace}
     * is null. Affected namespaces report {@link #needsInitialUpdate} until regenerated.
     */
    public void invalidateCache(String namespace) {
        this.lock.lock();
        try {
            if (namespace == null) {
                this.schemas.clear();
                this.promptCache.invalidateAll();
                this.states.replaceAll((ns, state) -> state.invalidated());
            } else {
                this.schemas.remove(namespace);
                this.promptCache.invalidate(namespace);
                this.states.computeIfPresent(namespace, (ns, state) -> state.invalidated());
            }
        }
        finally {
            this.lock.unlock();
        }
        log.info("Schema cache invalidated for {}", namespace != null ? namespace : "all namespaces");
    }

    public List<CacheEntryInfo> getCacheInfo() {
        this.lock.lock();
        try {
            return this.schemas.values().stream()
                    .sorted((a, b) -> a.namespace().compareTo(b.namespace()))
                    .map(s -> new CacheEntryInfo(s.namespace(), s.templateType(), s.fields().size(), s.vectorCount(),
                            s.lastDiscoveredAt(), this.promptCache.getIfPresent(s.namespace()) != null))
                    .toList();
        }
        finally {
            this.lock.unlock();
        }
    }

    private record PendingDebounce(UpdateRequest request, ScheduledFuture<?> timer) {
    }

    static final class UpdateRequest {
        private final String namespace;
        private final UpdateReason reason;
        private final Instant requestedAt;
        private final List<String> documentIds = new ArrayList<>();
        private final List<CompletableFuture<Boolean>> futures = new ArrayList<>();
        private long generation;
        private boolean cancelled;

        UpdateRequest(String namespace, UpdateReason reason, Instant requestedAt) {
            this.namespace = namespace;
            this.reason = reason;
            this.requestedAt = requestedAt;
        }

        void addDocument(String documentId) {
            if (documentId != null && !this.documentIds.contains(documentId)) {
                this.documentIds.add(documentId);
            }
        }

        void absorb(UpdateRequest other) {
            other.documentIds.forEach(this::addDocument);
            this.futures.addAll(other.futures);
        }
    }
}
