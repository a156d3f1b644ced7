package com.botanical.ingestion.resolution;

import com.botanical.ingestion.core.model.Herb;
import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.rules.ScientificNameNormalizer;
import com.botanical.ingestion.store.HerbQuery;
import com.botanical.ingestion.store.HerbStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds the existing canonical herb, if any, for an incoming record.
 *
 * <p>Match rules are tried in order and the first hit wins:</p>
 * <ol>
 *   <li>{@link MatchType#SOURCE_ID}: same provider ID (Trefle, then Perenual)</li>
 *   <li>{@link MatchType#SCIENTIFIC_NAME}: normalized name or genus+species equality</li>
 *   <li>{@link MatchType#COMMON_NAME}: exact title equality</li>
 * </ol>
 *
 * <p>The scientific-name rule scans one page of {@code scanPageSize} records;
 * records beyond that page are never compared.</p>
 */
public class HerbResolver {
    private static final Logger log = LoggerFactory.getLogger(HerbResolver.class);

    public static final int DEFAULT_SCAN_PAGE_SIZE = 1000;

    private final HerbStore store;
    private final ScientificNameNormalizer normalizer;
    private final int scanPageSize;

    public HerbResolver(HerbStore store, ScientificNameNormalizer normalizer) {
        this(store, normalizer, DEFAULT_SCAN_PAGE_SIZE);
    }

    public HerbResolver(HerbStore store, ScientificNameNormalizer normalizer, int scanPageSize) {
        if (scanPageSize <= 0) {
            throw new IllegalArgumentException("scanPageSize must be > 0");
        }
        this.store = store;
        this.normalizer = normalizer;
        this.scanPageSize = scanPageSize;
    }

    public Optional<HerbMatch> find(MatchCriteria criteria) {
        for (Provider provider : Provider.values()) {
            Long sourceId = criteria.sourceIds().get(provider);
            if (sourceId == null) {
                continue;
            }
            List<Herb> hits = store.find(HerbQuery.bySourceId(provider, sourceId), 1);
            if (!hits.isEmpty()) {
                log.debug("resolver.matched type=SOURCE_ID provider={} sourceId={} herbId={}",
                        provider.key(), sourceId, hits.get(0).getId());
                return Optional.of(new HerbMatch(hits.get(0), MatchType.SOURCE_ID));
            }
        }

        String scientificName = criteria.scientificName();
        if (scientificName != null && !scientificName.isBlank()) {
            List<Herb> page = store.find(HerbQuery.all(), scanPageSize);
            for (Herb herb : page) {
                if (normalizer.matches(herb.getScientificName(), scientificName)) {
                    log.debug("resolver.matched type=SCIENTIFIC_NAME scientificName={} herbId={}",
                            scientificName, herb.getId());
                    return Optional.of(new HerbMatch(herb, MatchType.SCIENTIFIC_NAME));
                }
            }
            if (page.size() >= scanPageSize) {
                log.warn("resolver.scanTruncated pageSize={} scientificName={}", scanPageSize, scientificName);
            }
        }

        String commonName = criteria.commonName();
        if (commonName != null && !commonName.isBlank()) {
            List<Herb> hits = store.find(HerbQuery.byTitle(commonName), 1);
            if (!hits.isEmpty()) {
                log.debug("resolver.matched type=COMMON_NAME title={} herbId={}", commonName, hits.get(0).getId());
                return Optional.of(new HerbMatch(hits.get(0), MatchType.COMMON_NAME));
            }
        }

        log.debug("resolver.noMatch scientificName={} commonName={}", scientificName, commonName);
        return Optional.empty();
    }
}
