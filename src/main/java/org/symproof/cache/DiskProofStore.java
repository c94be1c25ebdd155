package org.symproof.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symproof.engine.ProofCertificate;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * 持久缓存层：每个缓存键一个 JSON 文件 {@code <key>.json}。
 * 读失败（文件缺失、损坏、无法解析）一律视为未命中，写失败只记录警告。
 * 写入先落到临时文件再原子移动，同一实例内的写入串行化。
 */
public class DiskProofStore {

    private static final Logger logger = LoggerFactory.getLogger(DiskProofStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String SUFFIX = ".json";

    @Getter
    private final Path directory;

    public DiskProofStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Cache directory cannot be null");
    }

    public Path pathFor(String key) {
        return directory.resolve(key + SUFFIX);
    }

    public Optional<ProofCertificate> load(String key) {
        Path path = pathFor(key);
        if (!Files.isRegularFile(path)) {
            logger.debug("持久缓存未命中: {}", key);
            return Optional.empty();
        }
        try {
            ProofCertificate certificate = MAPPER.readValue(path.toFile(), ProofCertificate.class);
            logger.debug("持久缓存命中: {}", key);
            return Optional.of(certificate);
        } catch (IOException | RuntimeException e) {
            logger.warn("持久缓存记录 {} 无法读取，按未命中处理: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public synchronized void store(String key, ProofCertificate certificate) {
        Path target = pathFor(key);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, key, ".tmp");
            MAPPER.writeValue(temp.toFile(), certificate);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("文件系统不支持原子移动，退化为普通替换: {}", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("写入持久缓存: {}", target);
        } catch (IOException | RuntimeException e) {
            logger.warn("写入持久缓存 {} 失败，忽略: {}", target, e.getMessage());
            deleteQuietly(temp);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("无法删除临时文件 {}: {}", temp, e.getMessage());
        }
    }
}
