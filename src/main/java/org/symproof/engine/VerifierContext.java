package org.symproof.engine;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.cache.DiskProofStore;
import org.symproof.cache.ProofCache;
import org.symproof.translate.Translator;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;

/**
 * 验证器上下文：求解超时、循环展开上限以及两层缓存。
 * 创建一次，传给引擎使用，用完 close（清空内存缓存）。
 */
public final class VerifierContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(VerifierContext.class);

    public static final String TIMEOUT_KEY = "symproof.timeout-ms";
    public static final String MAX_UNROLL_KEY = "symproof.max-unroll";
    public static final String CACHE_DIR_KEY = "symproof.cache-dir";

    public static final int DEFAULT_TIMEOUT_MS = 5000;
    public static final String DEFAULT_RESOURCE = "/symproof.properties";

    @Getter
    private final int timeoutMs;
    @Getter
    private final int maxUnroll;
    @Getter
    private final ProofCache memoryCache;
    private final DiskProofStore diskStore;

    private VerifierContext(int timeoutMs, int maxUnroll, Path cacheDirectory) {
        this.timeoutMs = timeoutMs;
        this.maxUnroll = maxUnroll;
        this.memoryCache = new ProofCache();
        this.diskStore = cacheDirectory == null ? null : new DiskProofStore(cacheDirectory);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 全部取默认值、不启用持久缓存的上下文。
     */
    public static VerifierContext defaults() {
        return builder().build();
    }

    /**
     * 从 properties 构造；同名的 JVM 系统属性优先。
     * @throws IllegalArgumentException 取值不合法。
     */
    public static VerifierContext fromProperties(Properties properties) {
        Builder builder = builder();
        String timeout = lookup(properties, TIMEOUT_KEY);
        if (timeout != null) {
            builder.timeoutMs(parseInt(TIMEOUT_KEY, timeout));
        }
        String unroll = lookup(properties, MAX_UNROLL_KEY);
        if (unroll != null) {
            builder.maxUnroll(parseInt(MAX_UNROLL_KEY, unroll));
        }
        String dir = lookup(properties, CACHE_DIR_KEY);
        if (dir != null) {
            builder.cacheDirectory(Paths.get(dir));
        }
        return builder.build();
    }

    /**
     * 读取 classpath 上的 symproof.properties（不存在时使用默认值），再应用系统属性。
     */
    public static VerifierContext loadDefault() {
        Properties properties = new Properties();
        try (InputStream in = VerifierContext.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.debug("classpath 上没有 {}，使用默认配置", DEFAULT_RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULT_RESOURCE, e);
        }
        return fromProperties(properties);
    }

    private static String lookup(Properties properties, String key) {
        String value = System.getProperty(key, properties.getProperty(key));
        return StringUtils.isBlank(value) ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    /**
     * 持久缓存层；未配置目录时为空。
     */
    public Optional<DiskProofStore> getDiskStore() {
        return Optional.ofNullable(diskStore);
    }

    public Optional<Path> getCacheDirectory() {
        return getDiskStore().map(DiskProofStore::getDirectory);
    }

    @Override
    public void close() {
        memoryCache.clear();
    }

    @Override
    public String toString() {
        return "VerifierContext{timeoutMs=" + timeoutMs + ", maxUnroll=" + maxUnroll
                + ", cacheDirectory=" + getCacheDirectory().map(Path::toString).orElse("-") + "}";
    }

    public static final class Builder {

        private int timeoutMs = DEFAULT_TIMEOUT_MS;
        private int maxUnroll = Translator.DEFAULT_MAX_UNROLL;
        private Path cacheDirectory;

        private Builder() {
        }

        public Builder timeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder maxUnroll(int maxUnroll) {
            this.maxUnroll = maxUnroll;
            return this;
        }

        public Builder cacheDirectory(Path cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        public VerifierContext build() {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("Timeout must be positive: " + timeoutMs);
            }
            if (maxUnroll < 0) {
                throw new IllegalArgumentException("Unroll ceiling must be non-negative: " + maxUnroll);
            }
            VerifierContext context = new VerifierContext(timeoutMs, maxUnroll, cacheDirectory);
            logger.info("创建验证器上下文 {}", context);
            return context;
        }
    }
}
