package com.botanical.ingestion.dedup;

import com.botanical.ingestion.core.model.EnrichmentPayload;
import com.botanical.ingestion.core.model.Herb;
import com.botanical.ingestion.core.model.HerbStatus;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.lock.DistributedLock;
import com.botanical.ingestion.lock.LocalDistributedLock;
import com.botanical.ingestion.logging.LogContext;
import com.botanical.ingestion.merge.HerbMerger;
import com.botanical.ingestion.metrics.MetricsService;
import com.botanical.ingestion.metrics.NoOpMetricsService;
import com.botanical.ingestion.resolution.HerbMatch;
import com.botanical.ingestion.resolution.HerbResolver;
import com.botanical.ingestion.resolution.MatchCriteria;
import com.botanical.ingestion.rules.ScientificNameNormalizer;
import com.botanical.ingestion.store.HerbQuery;
import com.botanical.ingestion.store.HerbStore;
import com.botanical.ingestion.tracing.NoOpTracingService;
import com.botanical.ingestion.tracing.Span;
import com.botanical.ingestion.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for turning provider records into deduplicated herb records.
 *
 * <p>Ingestion and reconciliation share one lock, so the resolve, merge and
 * persist sequence never interleaves with another writer in the same process
 * (or across processes, given a distributed {@link DistributedLock}).</p>
 *
 * <pre>
 * HerbDeduplicationService service = HerbDeduplicationService.builder()
 *     .store(herbStore)
 *     .metricsService(metrics)
 *     .build();
 *
 * trefleClient.enrich("Panax ginseng", "Ginseng")
 *     .ifPresent(payload -&gt; service.createOrUpdate(payload, Provider.TREFLE));
 *
 * ReconcileResult result = service.bulkReconcile();
 * </pre>
 */
public class HerbDeduplicationService {
    private static final Logger log = LoggerFactory.getLogger(HerbDeduplicationService.class);

    static final String MANUAL_SOURCE = "Manual";

    private final HerbStore store;
    private final ScientificNameNormalizer normalizer;
    private final HerbResolver resolver;
    private final HerbMerger merger;
    private final HerbMapper mapper;
    private final DistributedLock lock;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final DeduplicationConfig config;

    private HerbDeduplicationService(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.config = builder.config != null ? builder.config : DeduplicationConfig.defaults();
        this.normalizer = builder.normalizer != null ? builder.normalizer : new ScientificNameNormalizer();
        this.merger = builder.merger != null ? builder.merger : new HerbMerger();
        this.mapper = builder.mapper != null ? builder.mapper : new HerbMapper();
        this.lock = builder.lock != null ? builder.lock : new LocalDistributedLock();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.resolver = new HerbResolver(store, normalizer, config.scanPageSize());
    }

    /**
     * Stores a provider record, merging it into the existing herb it matches or
     * creating a new draft when nothing matches.
     *
     * @param payload extracted provider record
     * @param source  provider the record came from; must equal {@code payload.provider()}
     * @throws IllegalArgumentException if the payload has no usable name or its provider differs from {@code source}
     * @throws com.botanical.ingestion.lock.LockAcquisitionException if the ingestion lock cannot be acquired
     * @throws com.botanical.ingestion.store.HerbStoreException if the store rejects the write
     */
    public IngestResult createOrUpdate(EnrichmentPayload payload, Provider source) {
        Objects.requireNonNull(payload, "payload is required");
        Objects.requireNonNull(source, "source is required");
        if (payload.provider() != source) {
            throw new IllegalArgumentException("Payload from " + payload.provider()
                    + " submitted as " + source);
        }
        Herb incoming = mapper.toHerb(payload);

        try (LogContext ctx = LogContext.forIngest(LogContext.generateCorrelationId(), source, payload.scientificName());
             Span span = tracingService.startIngestSpan(source, payload.scientificName(), incoming.getTitle())) {
            lock.tryLock(config.lockKey());
            try {
                IngestResult result = resolveAndStore(incoming, source);
                span.setAttribute("created", String.valueOf(result.created()));
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            } finally {
                lock.unlock(config.lockKey());
            }
        }
    }

    private IngestResult resolveAndStore(Herb incoming, Provider source) {
        Optional<HerbMatch> match = resolver.find(MatchCriteria.of(incoming));
        if (match.isPresent()) {
            Herb existing = match.get().herb();
            Herb stored = store.update(existing.getId(), merger.merge(existing, incoming));
            metricsService.incrementHerbUpdated(source, match.get().matchType());
            log.info("herb.updated id={} title='{}' matchType={}",
                    stored.getId(), stored.getTitle(), match.get().matchType());
            return IngestResult.updated(stored, match.get().matchType());
        }

        Herb stored = store.create(Herb.builder(incoming).status(HerbStatus.DRAFT).build());
        metricsService.incrementHerbCreated(source);
        log.info("herb.created id={} title='{}'", stored.getId(), stored.getTitle());
        return IngestResult.created(stored);
    }

    /**
     * Collapses every group of herbs sharing a normalized scientific name into
     * one record. The primary of a group is the first published member, or
     * failing that the member with the most provider sources; ties keep store
     * order. A failing group is logged and counted and does not stop the run.
     *
     * @throws com.botanical.ingestion.lock.LockAcquisitionException if the ingestion lock cannot be acquired
     */
    public ReconcileResult bulkReconcile() {
        String runId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forReconcile(runId);
             Span span = tracingService.startReconcileSpan(runId)) {
            lock.tryLock(config.lockKey());
            try {
                ReconcileResult result = reconcile();
                span.setAttribute("merged", result.merged());
                span.setAttribute("errors", result.errors());
                span.setStatus(result.hasErrors() ? Span.SpanStatus.ERROR : Span.SpanStatus.OK);
                metricsService.recordReconcile(result.merged(), result.deleted(), result.errors());
                log.info("reconcile.completed processed={} merged={} deleted={} errors={}",
                        result.processed(), result.merged(), result.deleted(), result.errors());
                return result;
            } finally {
                lock.unlock(config.lockKey());
            }
        }
    }

    private ReconcileResult reconcile() {
        List<Herb> corpus = store.find(HerbQuery.all(), config.corpusLimit());
        if (corpus.size() >= config.corpusLimit()) {
            log.warn("reconcile.corpusTruncated limit={}", config.corpusLimit());
        }

        int processed = 0;
        int merged = 0;
        int deleted = 0;
        int errors = 0;
        for (Map.Entry<String, List<Herb>> group : groupByNormalizedName(corpus).entrySet()) {
            List<Herb> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            processed += members.size();

            List<Herb> ordered = new ArrayList<>(members);
            ordered.sort(PRIMARY_FIRST);
            Herb primary = ordered.get(0);
            try {
                for (Herb duplicate : ordered.subList(1, ordered.size())) {
                    primary = store.update(primary.getId(), merger.merge(primary, duplicate));
                    merged++;
                    store.delete(duplicate.getId());
                    deleted++;
                    log.info("reconcile.merged primary={} duplicate={} name='{}'",
                            primary.getId(), duplicate.getId(), group.getKey());
                }
            } catch (RuntimeException e) {
                errors++;
                log.error("reconcile.groupFailed name='{}' primary={}", group.getKey(), primary.getId(), e);
            }
        }
        return new ReconcileResult(processed, merged, deleted, errors);
    }

    private static final Comparator<Herb> PRIMARY_FIRST =
            Comparator.comparing((Herb herb) -> !herb.isPublished())
                    .thenComparing(herb -> herb.getBotanicalInfo().sourceCount(), Comparator.reverseOrder());

    /**
     * Lists herbs that share a normalized scientific name, without changing anything.
     *
     * @param scientificName when non-blank, only names containing its normalized form are considered
     */
    public DuplicateReport checkForDuplicates(String scientificName) {
        String filter = normalizer.normalize(scientificName);
        List<Herb> corpus = store.find(HerbQuery.all(), config.scanPageSize());

        List<DuplicateReport.Entry> duplicates = new ArrayList<>();
        for (Map.Entry<String, List<Herb>> group : groupByNormalizedName(corpus).entrySet()) {
            if (group.getValue().size() < 2 || !group.getKey().contains(filter)) {
                continue;
            }
            for (Herb herb : group.getValue()) {
                duplicates.add(new DuplicateReport.Entry(herb.getId(), herb.getTitle(),
                        herb.getScientificName(), group.getKey(), sourcesOf(herb)));
            }
        }
        log.debug("duplicates.checked filter='{}' found={}", filter, duplicates.size());
        return duplicates.isEmpty() ? DuplicateReport.none() : new DuplicateReport(true, duplicates);
    }

    private Map<String, List<Herb>> groupByNormalizedName(List<Herb> herbs) {
        Map<String, List<Herb>> groups = new LinkedHashMap<>();
        for (Herb herb : herbs) {
            String normalized = normalizer.normalize(herb.getScientificName());
            if (!normalized.isEmpty()) {
                groups.computeIfAbsent(normalized, k -> new ArrayList<>()).add(herb);
            }
        }
        return groups;
    }

    private static List<String> sourcesOf(Herb herb) {
        List<String> sources = new ArrayList<>();
        for (Provider provider : Provider.values()) {
            if (herb.getBotanicalInfo().sourceId(provider).isPresent()) {
                sources.add(provider.displayName());
            }
        }
        if (sources.isEmpty()) {
            sources.add(MANUAL_SOURCE);
        }
        return sources;
    }

    public HerbResolver getResolver() {
        return resolver;
    }

    public DeduplicationConfig getConfig() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private HerbStore store;
        private ScientificNameNormalizer normalizer;
        private HerbMerger merger;
        private HerbMapper mapper;
        private DistributedLock lock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private DeduplicationConfig config;

        public Builder store(HerbStore store) {
            this.store = store;
            return this;
        }

        public Builder normalizer(ScientificNameNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder merger(HerbMerger merger) {
            this.merger = merger;
            return this;
        }

        public Builder mapper(HerbMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder distributedLock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder config(DeduplicationConfig config) {
            this.config = config;
            return this;
        }

        public HerbDeduplicationService build() {
            return new HerbDeduplicationService(this);
        }
    }
}
