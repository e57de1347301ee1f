package com.judgmentrag.service.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentrag.config.DatasetConfig;
import com.judgmentrag.dto.internal.ScoredEntry;
import com.judgmentrag.dto.internal.SearchFilters;
import com.judgmentrag.exception.DimensionMismatchException;
import com.judgmentrag.model.IndexEntry;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory cosine index backed by a {@link VersionedJournal}.
 * <p>
 * Entries are immutable and swapped per key in a {@link ConcurrentHashMap}, so readers never
 * lock and never see a half-written entry. Concurrent upserts of the same segment id are
 * ordered by the version drawn inside {@code compute}; the journal keeps the same order on
 * replay.
 */
@Slf4j
@Service
public class JournaledVectorIndex implements VectorIndex {

    static final String JOURNAL_FILE = "segments.jsonl";

    private static final Comparator<ScoredEntry> RANKING =
            Comparator.comparingDouble(ScoredEntry::score).reversed()
                    .thenComparing(ScoredEntry::segmentId);

    private record Slot(IndexEntry entry, long version, double norm) {
    }

    private final VersionedJournal<IndexEntry> journal;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicLong versions = new AtomicLong();
    private final AtomicInteger dimension = new AtomicInteger();

    public JournaledVectorIndex(DatasetConfig datasetConfig, ObjectMapper objectMapper) {
        this.journal = new VersionedJournal<>(
                datasetConfig.getIndexPath().resolve(JOURNAL_FILE), objectMapper, IndexEntry.class);
    }

    @PostConstruct
    public void load() {
        slots.clear();
        long maxVersion = 0;
        for (Map.Entry<String, VersionedJournal.Versioned<IndexEntry>> e : journal.replay().entrySet()) {
            VersionedJournal.Versioned<IndexEntry> versioned = e.getValue();
            maxVersion = Math.max(maxVersion, versioned.version());
            if (!versioned.isTombstone()) {
                IndexEntry entry = versioned.value();
                dimension.compareAndSet(0, entry.dimension());
                slots.put(e.getKey(), new Slot(entry, versioned.version(), norm(entry.vector())));
            }
        }
        versions.set(maxVersion);
        log.info("Vector index loaded: {} segments from {}", slots.size(), journal.getFile());
    }

    @Override
    public void upsert(Collection<IndexEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        for (IndexEntry entry : entries) {
            checkDimension(entry.dimension());
        }

        List<VersionedJournal.Change<IndexEntry>> changes = new ArrayList<>(entries.size());
        for (IndexEntry entry : entries) {
            double norm = norm(entry.vector());
            Slot slot = slots.compute(entry.segmentId(),
                    (id, previous) -> new Slot(entry, versions.incrementAndGet(), norm));
            changes.add(new VersionedJournal.Change<>(entry.segmentId(), entry, slot.version()));
        }
        journal.append(changes);

        log.debug("Upserted {} segments (index size {})", entries.size(), slots.size());
    }

    @Override
    public List<ScoredEntry> search(float[] queryVector, int topK, SearchFilters filters) {
        if (topK <= 0 || slots.isEmpty()) {
            return List.of();
        }
        int indexDimension = dimension.get();
        if (indexDimension != 0 && queryVector.length != indexDimension) {
            throw new DimensionMismatchException(indexDimension, queryVector.length);
        }

        SearchFilters effective = filters != null ? filters : SearchFilters.none();
        double queryNorm = norm(queryVector);

        // min-heap of the current best topK; the head is the weakest kept entry
        PriorityQueue<ScoredEntry> best = new PriorityQueue<>(topK + 1, RANKING.reversed());
        for (Slot slot : slots.values()) {
            IndexEntry entry = slot.entry();
            if (!effective.matches(entry.metadata())) {
                continue;
            }
            best.add(new ScoredEntry(entry, cosine(queryVector, queryNorm, entry.vector(), slot.norm())));
            if (best.size() > topK) {
                best.poll();
            }
        }

        List<ScoredEntry> ranked = new ArrayList<>(best);
        ranked.sort(RANKING);
        return ranked;
    }

    @Override
    public Optional<IndexEntry> get(String segmentId) {
        Slot slot = slots.get(segmentId);
        return slot == null ? Optional.empty() : Optional.of(slot.entry());
    }

    @Override
    public int count() {
        return slots.size();
    }

    @Override
    public int caseCount() {
        Set<String> caseIds = new HashSet<>();
        slots.values().forEach(slot -> caseIds.add(slot.entry().caseId()));
        return caseIds.size();
    }

    @Override
    public int removeCase(String caseId) {
        return removeWhere(caseId, Set.of());
    }

    @Override
    public int pruneCase(String caseId, Collection<String> keepSegmentIds) {
        return removeWhere(caseId, new HashSet<>(keepSegmentIds));
    }

    @Override
    public List<IndexEntry> entries() {
        return slots.values().stream()
                .map(Slot::entry)
                .sorted(Comparator.comparing(IndexEntry::segmentId))
                .toList();
    }

    @Override
    public void clear() {
        List<VersionedJournal.Change<IndexEntry>> tombstones = new ArrayList<>();
        for (String segmentId : new ArrayList<>(slots.keySet())) {
            if (slots.remove(segmentId) != null) {
                tombstones.add(new VersionedJournal.Change<>(segmentId, null, versions.incrementAndGet()));
            }
        }
        journal.append(tombstones);
        dimension.set(0);
        log.info("Vector index cleared ({} segments removed)", tombstones.size());
    }

    @Override
    public void compact() {
        List<VersionedJournal.Change<IndexEntry>> live = slots.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> new VersionedJournal.Change<>(e.getKey(), e.getValue().entry(), e.getValue().version()))
                .toList();
        journal.rewrite(live);
        log.info("Vector index journal compacted to {} segments", live.size());
    }

    private int removeWhere(String caseId, Set<String> keep) {
        List<VersionedJournal.Change<IndexEntry>> tombstones = new ArrayList<>();
        for (Map.Entry<String, Slot> e : slots.entrySet()) {
            String segmentId = e.getKey();
            if (!caseId.equals(e.getValue().entry().caseId()) || keep.contains(segmentId)) {
                continue;
            }
            if (slots.remove(segmentId, e.getValue())) {
                tombstones.add(new VersionedJournal.Change<>(segmentId, null, versions.incrementAndGet()));
            }
        }
        journal.append(tombstones);
        return tombstones.size();
    }

    private void checkDimension(int actual) {
        if (!dimension.compareAndSet(0, actual) && dimension.get() != actual) {
            throw new DimensionMismatchException(dimension.get(), actual);
        }
    }

    private static double norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    private static double cosine(float[] a, double normA, float[] b, double normB) {
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot / (normA * normB);
    }
}
