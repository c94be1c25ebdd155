package org.symproof.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.engine.ProofCertificate;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 内存缓存层：按缓存键精确匹配，只有显式 clear 才会清空。
 */
public class ProofCache {

    private static final Logger logger = LoggerFactory.getLogger(ProofCache.class);

    private final ConcurrentMap<String, ProofCertificate> entries = new ConcurrentHashMap<>();

    public Optional<ProofCertificate> get(String key) {
        ProofCertificate hit = entries.get(key);
        logger.debug("内存缓存{}: {}", hit == null ? "未命中" : "命中", key);
        return Optional.ofNullable(hit);
    }

    public void put(String key, ProofCertificate certificate) {
        entries.put(Objects.requireNonNull(key, "Cache key cannot be null"),
                Objects.requireNonNull(certificate, "Certificate cannot be null"));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        logger.debug("清空内存缓存，共 {} 条", entries.size());
        entries.clear();
    }
}
