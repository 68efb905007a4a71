package me.golemcore.aigate.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.aigate.domain.model.CacheEntry;
import me.golemcore.aigate.domain.model.CacheStats;
import me.golemcore.aigate.domain.model.GenerationResponse;
import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory response cache keyed by request fingerprint.
 *
 * <p>
 * Entries are immutable and replaced on write (last writer wins). An entry is
 * never served at or after {@code createdAt + ttl}; expired entries are
 * dropped lazily on read and by {@link #evictExpired()}. When the cache is
 * full, the oldest ~10% of entries are evicted before inserting.
 */
@Component
@Slf4j
public class ResponseCache {

    private final AiGateProperties properties;
    private final Clock clock;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong puts = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public ResponseCache(AiGateProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<CacheEntry> get(String fingerprint) {
        if (fingerprint == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        CacheEntry entry = entries.get(fingerprint);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(Instant.now(clock))) {
            // Only drop the entry we saw, a concurrent put may have replaced it
            if (entries.remove(fingerprint, entry)) {
                evictions.incrementAndGet();
            }
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry);
    }

    public void put(String fingerprint, String payload, Duration ttl) {
        store(CacheEntry.builder()
                .fingerprint(fingerprint)
                .payload(payload)
                .ttl(ttl));
    }

    /**
     * Stores a generation answer. Fallback answers keep their degradation
     * reason so a later hit is still reported as degraded.
     */
    public void put(String fingerprint, GenerationResponse response, Duration ttl) {
        store(CacheEntry.builder()
                .fingerprint(fingerprint)
                .payload(response.getText())
                .ttl(ttl)
                .providerUsed(response.getProviderUsed())
                .modelUsed(response.getModelUsed())
                .reason(response.isDegraded() ? response.getReason() : null)
                .confidence(response.getConfidence()));
    }

    // A zero or negative TTL is a no-op
    private void store(CacheEntry.CacheEntryBuilder builder) {
        CacheEntry draft = builder.createdAt(Instant.now(clock)).build();
        Duration ttl = draft.getTtl();
        if (draft.getFingerprint() == null || draft.getPayload() == null || ttl == null || ttl.isZero()
                || ttl.isNegative()) {
            return;
        }
        if (!properties.getCache().isEnabled()) {
            return;
        }

        if (!entries.containsKey(draft.getFingerprint())
                && entries.size() >= properties.getCache().getMaxEntries()) {
            evictOldest();
        }

        entries.put(draft.getFingerprint(), draft);
        puts.incrementAndGet();
        log.debug("[Cache] Stored {} (ttl {}, fallback {})", RequestFingerprinter.prefix(draft.getFingerprint()),
                ttl, draft.isFallback());
    }

    public boolean invalidate(String fingerprint) {
        return fingerprint != null && entries.remove(fingerprint) != null;
    }

    public int invalidateAll() {
        int size = entries.size();
        entries.clear();
        log.info("[Cache] Invalidated all entries ({})", size);
        return size;
    }

    /**
     * @return number of expired entries removed
     */
    public int evictExpired() {
        Instant now = Instant.now(clock);
        int removed = 0;
        for (Map.Entry<String, CacheEntry> entry : entries.entrySet()) {
            if (entry.getValue().isExpired(now) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            evictions.addAndGet(removed);
            log.debug("[Cache] Evicted {} expired entries", removed);
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    public CacheStats getStats() {
        return CacheStats.builder()
                .hits(hits.get())
                .misses(misses.get())
                .puts(puts.get())
                .evictions(evictions.get())
                .size(entries.size())
                .build();
    }

    private void evictOldest() {
        int toRemove = Math.max(1, entries.size() / 10);
        List<CacheEntry> oldest = new ArrayList<>(entries.values());
        oldest.sort(Comparator.comparing(CacheEntry::getCreatedAt));
        int removed = 0;
        for (int i = 0; i < toRemove && i < oldest.size(); i++) {
            CacheEntry entry = oldest.get(i);
            if (entries.remove(entry.getFingerprint(), entry)) {
                removed++;
            }
        }
        evictions.addAndGet(removed);
        log.debug("[Cache] Cache full, evicted {} oldest entries", removed);
    }
}
