package com.analyticsplatform.analysis.registry;

import com.analyticsplatform.analysis.artifact.ModelArtifactLoader;
import com.analyticsplatform.analysis.model.ModelCatalog;
import com.analyticsplatform.analysis.model.ModelCatalogEntry;
import com.analyticsplatform.common.exception.AnalyticsException;
import com.analyticsplatform.common.exception.ModelLoadFailureException;
import com.analyticsplatform.common.exception.ModelNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide, lazily populated cache of {@link ModelHandle}s with single-flight loading.
 *
 * <h3>Single flight</h3>
 * The first {@link #acquire} for a modelId installs one cached {@code Mono} via
 * {@link ConcurrentHashMap#computeIfAbsent}; every concurrent or later caller subscribes to
 * that same {@code Mono}, so the loader runs at most once per modelId.
 *
 * <h3>Failure handling</h3>
 * <ul>
 *   <li>{@link ModelNotFoundException}: the entry is evicted so a later call may retry once
 *       the artifact appears.</li>
 *   <li>{@link ModelLoadFailureException} (or any other loader error): the failure stays
 *       cached, the modelId is marked unavailable for the process lifetime and the failure is
 *       logged once.</li>
 * </ul>
 *
 * <p>Loaded handles are released by {@link #close()} at shutdown.
 */
public class ModelRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final ModelCatalog catalog;
    private final ModelArtifactLoader loader;
    private final Clock clock;

    private final ConcurrentHashMap<String, Mono<ModelHandle>> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ModelHandle> loaded = new ConcurrentHashMap<>();
    private final Set<String> unavailable = ConcurrentHashMap.newKeySet();
    private final AtomicLong loadAttempts = new AtomicLong();

    public ModelRegistry(ModelCatalog catalog, ModelArtifactLoader loader) {
        this(catalog, loader, Clock.systemUTC());
    }

    public ModelRegistry(ModelCatalog catalog, ModelArtifactLoader loader, Clock clock) {
        this.catalog = catalog;
        this.loader = loader;
        this.clock = clock;
    }

    /** Returns the shared handle for {@code modelId}, loading it on first access. */
    public Mono<ModelHandle> acquire(String modelId) {
        ModelCatalogEntry entry = catalog.entry(modelId).orElse(null);
        if (entry == null) {
            return Mono.error(new ModelNotFoundException(String.valueOf(modelId), "not in catalog"));
        }
        if (unavailable.contains(modelId)) {
            return Mono.error(new ModelLoadFailureException(modelId, "marked unavailable after an earlier load failure", null));
        }
        return inFlight.computeIfAbsent(modelId, id -> singleFlight(entry));
    }

    /** Blocking variant of {@link #acquire}; call only from a thread that may block. */
    public ModelHandle handle(String modelId) {
        return acquire(modelId).block();
    }

    public boolean isUnavailable(String modelId) {
        return unavailable.contains(modelId);
    }

    public boolean isLoaded(String modelId) {
        return loaded.containsKey(modelId);
    }

    public Set<String> unavailableModels() {
        return new TreeSet<>(unavailable);
    }

    public Set<String> loadedModels() {
        return new TreeSet<>(loaded.keySet());
    }

    /** Number of times the loader has been invoked since startup. */
    public long loadAttempts() {
        return loadAttempts.get();
    }

    @Override
    public void close() {
        for (Map.Entry<String, ModelHandle> e : loaded.entrySet()) {
            try {
                e.getValue().artifact().close();
            } catch (RuntimeException ex) {
                log.warn("[ModelRegistry] Failed to release modelId={}", e.getKey(), ex);
            }
        }
        log.info("[ModelRegistry] Released {} model handle(s)", loaded.size());
        loaded.clear();
        inFlight.clear();
    }

    // ── single flight ──────────────────────────────────────────────────────

    private Mono<ModelHandle> singleFlight(ModelCatalogEntry entry) {
        String modelId = entry.id();
        AtomicReference<Mono<ModelHandle>> self = new AtomicReference<>();
        Mono<ModelHandle> shared = Mono.fromCallable(() -> load(entry))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(handle -> loaded.put(modelId, handle))
            .doOnError(ModelNotFoundException.class, e -> {
                inFlight.remove(modelId, self.get());
                log.warn("[ModelRegistry] modelId={} not found: {}", modelId, e.getMessage());
            })
            .doOnError(ModelLoadFailureException.class, e -> {
                unavailable.add(modelId);
                log.error("[ModelRegistry] modelId={} marked unavailable for process lifetime", modelId, e);
            })
            .cache();
        self.set(shared);
        return shared;
    }

    private ModelHandle load(ModelCatalogEntry entry) {
        loadAttempts.incrementAndGet();
        log.info("[ModelRegistry] Loading modelId={} task={}", entry.id(), entry.task());
        try {
            return new ModelHandle(entry.id(), entry, loader.load(entry), clock.instant());
        } catch (AnalyticsException e) {
            if (e instanceof ModelNotFoundException || e instanceof ModelLoadFailureException) {
                throw e;
            }
            throw new ModelLoadFailureException(entry.id(), e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ModelLoadFailureException(entry.id(), String.valueOf(e.getMessage()), e);
        }
    }
}
