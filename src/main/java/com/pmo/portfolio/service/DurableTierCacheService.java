package com.pmo.portfolio.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.pmo.portfolio.config.CacheProperties;
import com.pmo.portfolio.config.JacksonConfig;
import com.pmo.portfolio.constant.CacheConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * 持久层缓存服务（本地磁盘）
 * <p>
 * 每个条目一个 JSON 文件，内存中用 Caffeine 维护索引：
 * <ul>
 *   <li>按文件字节数加权，总量超过上限时淘汰并删除文件</li>
 *   <li>按条目自身过期时间失效，过期即删除文件</li>
 *   <li>启动时扫描目录重建索引，已过期文件直接删除</li>
 * </ul>
 * 运行期 IO 异常只记日志，读返回未命中，写返回 false
 */
@Service
public class DurableTierCacheService {

    private static final Logger log = LoggerFactory.getLogger(DurableTierCacheService.class);

    private static final String TEMP_SUFFIX = ".part";

    private final Path directory;
    private final long maxBytes;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile Cache<String, EntryMeta> index;

    /**
     * 索引项：文件位置、大小、过期时间
     */
    record EntryMeta(Path file, int sizeBytes, long expiresAtMillis) {
    }

    /**
     * 磁盘文件格式
     */
    record StoredEntry(String key, long expiresAtMillis, JsonNode payload) {
    }

    /**
     * 持久层命中：值 + 剩余 TTL
     */
    public record DurableHit<T>(T value, Duration remainingTtl) {
    }

    public DurableTierCacheService(CacheProperties cacheProperties, ObjectMapper objectMapper, Clock cacheClock) {
        this.directory = Paths.get(cacheProperties.getDurable().getDirectory());
        this.maxBytes = cacheProperties.getDurable().getMaxBytes();
        this.objectMapper = JacksonConfig.exactDecimals(objectMapper);
        this.clock = cacheClock;
    }

    /**
     * 创建目录并从已有文件重建索引，重复调用无副作用
     */
    public synchronized void open() {
        if (index != null) {
            return;
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create durable cache directory " + directory, e);
        }

        Cache<String, EntryMeta> cache = buildIndex();
        int restored = 0;
        int expired = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    deleteQuietly(file);
                } else if (name.endsWith(CacheConstants.DURABLE_FILE_SUFFIX)) {
                    if (restore(cache, file)) {
                        restored++;
                    } else {
                        expired++;
                    }
                }
            }
        } catch (IOException e) {
            log.error("Durable cache directory scan failed: {}", directory, e);
        }
        index = cache;
        log.info("Durable tier opened at {}, restored {} entries, dropped {} stale files",
            directory.toAbsolutePath(), restored, expired);
    }

    /**
     * 读取缓存，过期条目视为未命中
     */
    public <T> Optional<DurableHit<T>> get(String key, TypeReference<T> type) {
        Cache<String, EntryMeta> cache = index;
        if (cache == null) {
            return Optional.empty();
        }
        EntryMeta meta = cache.getIfPresent(key);
        if (meta == null) {
            return Optional.empty();
        }
        long remaining = meta.expiresAtMillis() - clock.millis();
        if (remaining <= 0) {
            cache.asMap().remove(key, meta);
            return Optional.empty();
        }
        try {
            StoredEntry entry = objectMapper.readValue(meta.file().toFile(), StoredEntry.class);
            T value = objectMapper.convertValue(entry.payload(), type);
            return Optional.of(new DurableHit<>(value, Duration.ofMillis(remaining)));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Durable tier entry unreadable, key: {}, file: {}", key, meta.file(), e);
            cache.asMap().remove(key, meta);
            return Optional.empty();
        }
    }

    /**
     * 写入缓存：先写临时文件再原子替换，最后更新索引
     */
    public boolean set(String key, Object value, Duration ttl) {
        Cache<String, EntryMeta> cache = index;
        if (cache == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        long expiresAt = clock.millis() + ttl.toMillis();
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(new StoredEntry(key, expiresAt, objectMapper.valueToTree(value)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Value not serializable for durable tier, key: {}", key, e);
            return false;
        }

        // 每次写入用新文件名，被替换的旧文件由索引的移除回调删除
        Path target = directory.resolve(fileName(key));
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, "entry-", TEMP_SUFFIX);
            Files.write(temp, bytes);
            move(temp, target);
        } catch (IOException e) {
            log.error("Durable tier write error, key: {}", key, e);
            if (temp != null) {
                deleteQuietly(temp);
            }
            return false;
        }
        cache.put(key, new EntryMeta(target, bytes.length, expiresAt));
        return true;
    }

    /**
     * 删除 Key 中包含 pattern 子串的条目
     */
    public int deleteMatching(String pattern) {
        Cache<String, EntryMeta> cache = index;
        if (cache == null) {
            return 0;
        }
        int removed = 0;
        for (String key : cache.asMap().keySet()) {
            if (key.contains(pattern)) {
                cache.invalidate(key);
                removed++;
            }
        }
        return removed;
    }

    /**
     * 清空全部条目及目录中残留的条目文件
     */
    public boolean clear() {
        Cache<String, EntryMeta> cache = index;
        if (cache == null) {
            return false;
        }
        cache.invalidateAll();
        cache.cleanUp();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory,
            "*{" + CacheConstants.DURABLE_FILE_SUFFIX + "," + TEMP_SUFFIX + "}")) {
            for (Path file : files) {
                deleteQuietly(file);
            }
            return true;
        } catch (IOException e) {
            log.error("Durable tier clear failed: {}", directory, e);
            return false;
        }
    }

    /**
     * 有效条目数
     */
    public long size() {
        Cache<String, EntryMeta> cache = index;
        if (cache == null) {
            return 0;
        }
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void close() {
        Cache<String, EntryMeta> cache = index;
        if (cache != null) {
            cache.cleanUp();
            log.info("Durable tier closed, {} entries on disk", cache.estimatedSize());
        }
    }

    private Cache<String, EntryMeta> buildIndex() {
        return Caffeine.newBuilder()
            .maximumWeight(maxBytes)
            .weigher((String key, EntryMeta meta) -> meta.sizeBytes())
            .expireAfter(new Expiry<String, EntryMeta>() {
                @Override
                public long expireAfterCreate(String key, EntryMeta meta, long currentTime) {
                    return Math.max(0, TimeUnit.MILLISECONDS.toNanos(meta.expiresAtMillis()) - currentTime);
                }

                @Override
                public long expireAfterUpdate(String key, EntryMeta meta, long currentTime, long currentDuration) {
                    return Math.max(0, TimeUnit.MILLISECONDS.toNanos(meta.expiresAtMillis()) - currentTime);
                }

                @Override
                public long expireAfterRead(String key, EntryMeta meta, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .removalListener((String key, EntryMeta meta, RemovalCause cause) -> {
                if (meta != null) {
                    deleteQuietly(meta.file());
                }
                if (cause == RemovalCause.SIZE) {
                    log.debug("Durable tier evicted by size: {}", key);
                }
            })
            .build();
    }

    private boolean restore(Cache<String, EntryMeta> cache, Path file) {
        try {
            StoredEntry entry = objectMapper.readValue(file.toFile(), StoredEntry.class);
            if (entry.key() == null || entry.expiresAtMillis() <= clock.millis()) {
                deleteQuietly(file);
                return false;
            }
            EntryMeta existing = cache.getIfPresent(entry.key());
            if (existing != null && existing.expiresAtMillis() >= entry.expiresAtMillis()) {
                deleteQuietly(file);
                return false;
            }
            cache.put(entry.key(), new EntryMeta(file, (int) Math.min(Files.size(file), Integer.MAX_VALUE),
                entry.expiresAtMillis()));
            return true;
        } catch (IOException e) {
            log.warn("Dropping unreadable durable cache file: {}", file, e);
            deleteQuietly(file);
            return false;
        }
    }

    private static String fileName(String key) {
        return CacheKeyDeriver.sha256Hex(key) + "-" + UUID.randomUUID() + CacheConstants.DURABLE_FILE_SUFFIX;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete durable cache file: {}", file, e);
        }
    }
}
