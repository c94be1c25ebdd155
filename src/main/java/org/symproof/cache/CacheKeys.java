package org.symproof.cache;

import org.symproof.utils.Fingerprints;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * 缓存键的组装。每个组成部分带标签和长度前缀，避免不同拼接产生相同文本。
 */
public final class CacheKeys {

    private final StringBuilder material = new StringBuilder();

    private CacheKeys() {
    }

    public static CacheKeys newKey() {
        return new CacheKeys();
    }

    public CacheKeys part(String label, String value) {
        String text = String.valueOf(value);
        material.append(label).append(':').append(text.length()).append(':').append(text).append('\n');
        return this;
    }

    public CacheKeys part(String label, int value) {
        return part(label, Integer.toString(value));
    }

    /**
     * 集合按顺序逐项加入。
     */
    public CacheKeys parts(String label, Collection<String> values) {
        part(label + "#", values.size());
        for (String value : values) {
            part(label, value);
        }
        return this;
    }

    /**
     * Map 按键排序后加入，与插入顺序无关。
     */
    public CacheKeys parts(String label, Map<String, String> values) {
        Map<String, String> sorted = new TreeMap<>(values);
        part(label + "#", sorted.size());
        sorted.forEach((k, v) -> part(label + "." + k, v));
        return this;
    }

    public String build() {
        return Fingerprints.shortHash(material.toString());
    }
}
