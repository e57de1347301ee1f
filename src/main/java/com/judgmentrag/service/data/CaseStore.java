package com.judgmentrag.service.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentrag.config.DatasetConfig;
import com.judgmentrag.model.CaseRecord;
import com.judgmentrag.service.index.VersionedJournal;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * Indexed cases by id, persisted next to the segment journal.
 */
@Slf4j
@Service
public class CaseStore {

    static final String JOURNAL_FILE = "cases.jsonl";

    private final VersionedJournal<CaseRecord> journal;
    private final Map<String, CaseRecord> cases = new ConcurrentHashMap<>();
    private final Map<String, Long> versionsById = new ConcurrentHashMap<>();
    private final AtomicLong versions = new AtomicLong();

    public CaseStore(DatasetConfig datasetConfig, ObjectMapper objectMapper) {
        this.journal = new VersionedJournal<>(
                datasetConfig.getIndexPath().resolve(JOURNAL_FILE), objectMapper, CaseRecord.class);
    }

    @PostConstruct
    public void load() {
        cases.clear();
        versionsById.clear();
        long maxVersion = 0;
        for (Map.Entry<String, VersionedJournal.Versioned<CaseRecord>> e : journal.replay().entrySet()) {
            maxVersion = Math.max(maxVersion, e.getValue().version());
            if (!e.getValue().isTombstone()) {
                cases.put(e.getKey(), e.getValue().value());
                versionsById.put(e.getKey(), e.getValue().version());
            }
        }
        versions.set(maxVersion);
        log.info("Case store loaded: {} cases", cases.size());
    }

    public void putAll(Collection<CaseRecord> records) {
        List<VersionedJournal.Change<CaseRecord>> changes = new ArrayList<>(records.size());
        for (CaseRecord record : records) {
            long version = versions.incrementAndGet();
            cases.put(record.caseId(), record);
            versionsById.put(record.caseId(), version);
            changes.add(new VersionedJournal.Change<>(record.caseId(), record, version));
        }
        journal.append(changes);
    }

    public Optional<CaseRecord> find(String caseId) {
        return caseId == null ? Optional.empty() : Optional.ofNullable(cases.get(caseId));
    }

    public boolean remove(String caseId) {
        if (cases.remove(caseId) == null) {
            return false;
        }
        versionsById.remove(caseId);
        journal.append(List.of(new VersionedJournal.Change<>(caseId, null, versions.incrementAndGet())));
        return true;
    }

    /**
     * Snapshot ordered by case id.
     */
    public List<CaseRecord> all() {
        return cases.values().stream()
                .sorted(Comparator.comparing(CaseRecord::caseId))
                .toList();
    }

    public int count() {
        return cases.size();
    }

    /**
     * Changes whenever the stored cases change.
     */
    public long revision() {
        return versions.get();
    }

    public void clear() {
        List<VersionedJournal.Change<CaseRecord>> tombstones = new ArrayList<>();
        for (String caseId : new ArrayList<>(cases.keySet())) {
            if (cases.remove(caseId) != null) {
                versionsById.remove(caseId);
                tombstones.add(new VersionedJournal.Change<>(caseId, null, versions.incrementAndGet()));
            }
        }
        journal.append(tombstones);
    }

    public void compact() {
        List<VersionedJournal.Change<CaseRecord>> live = cases.values().stream()
                .sorted(Comparator.comparing(CaseRecord::caseId))
                .map(r -> new VersionedJournal.Change<>(r.caseId(), r, versionsById.getOrDefault(r.caseId(), 0L)))
                .toList();
        journal.rewrite(live);
    }
}
