package com.mike.leadscout.store;

import com.mike.leadscout.cache.CacheEntry;
import com.mike.leadscout.entity.CachedEmailRecord;
import com.mike.leadscout.repository.CachedEmailRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable email cache backed by the {@code cached_emails} table. One row per domain, last write wins.
 */
@RequiredArgsConstructor
public class JpaEmailCacheStore implements KeyValueStore<String, CacheEntry> {

    private final CachedEmailRecordRepository repository;

    @Override
    @Transactional(readOnly = true)
    public CacheEntry get(String domain) {
        return repository.findByDomain(domain)
                .map(JpaEmailCacheStore::toEntry)
                .orElse(null);
    }

    @Override
    @Transactional
    public void put(String domain, CacheEntry entry) {
        CachedEmailRecord record = repository.findByDomain(domain).orElseGet(CachedEmailRecord::new);
        record.setDomain(domain);
        record.setEmail(entry.email());
        record.setConfidence(entry.confidence());
        record.setSource(entry.source());
        record.setCatchAll(entry.catchAll());
        record.setCachedAt(entry.cachedAt());
        repository.save(record);
    }

    @Override
    @Transactional
    public void remove(String domain) {
        repository.deleteByDomain(domain);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, CacheEntry> snapshot() {
        Map<String, CacheEntry> out = new LinkedHashMap<>();
        for (CachedEmailRecord r : repository.findAll()) {
            out.put(r.getDomain(), toEntry(r));
        }
        return out;
    }

    private static CacheEntry toEntry(CachedEmailRecord r) {
        return new CacheEntry(r.getDomain(), r.getEmail(), r.getConfidence(), r.getSource(), r.isCatchAll(), r.getCachedAt());
    }
}
