package xyz.firestige.netdeploy.infrastructure.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.netdeploy.domain.config.Backup;
import xyz.firestige.netdeploy.domain.config.BackupHandle;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.domain.shared.exception.BackupFailureException;
import xyz.firestige.netdeploy.domain.shared.exception.ConfigurationException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis 配置存储（Spring Data Redis）
 * <pre>
 * {namespace}:generated:{device}            当前渲染结果
 * {namespace}:backup:{device}:{member}       备份内容（JSON），SETNX 写入，永不覆盖
 * {namespace}:backups:{device}              ZSET 索引，member = epochMillis[-序号]，score = epochMillis
 * </pre>
 * 同一毫秒内的后续备份追加序号；分数相同的成员按字典序排列，序号定宽保证顺序正确。
 */
public class RedisConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(RedisConfigStore.class);

    private static final String DEFAULT_NAMESPACE = "netdeploy";
    private static final int MAX_COLLISIONS = 1000;

    private final StringRedisTemplate redisTemplate;
    private final String namespace;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public RedisConfigStore(StringRedisTemplate redisTemplate, Clock clock) {
        this(redisTemplate, DEFAULT_NAMESPACE, clock);
    }

    public RedisConfigStore(StringRedisTemplate redisTemplate, String namespace, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.namespace = Objects.requireNonNullElse(namespace, DEFAULT_NAMESPACE);
        this.clock = clock;
    }

    private String generatedKey(String device) {
        return namespace + ":generated:" + DeviceNames.requireSafe(device);
    }

    private String backupKey(String device, String member) {
        return namespace + ":backup:" + DeviceNames.requireSafe(device) + ":" + member;
    }

    private String indexKey(String device) {
        return namespace + ":backups:" + DeviceNames.requireSafe(device);
    }

    @Override
    public void save(String device, String text) {
        String key = generatedKey(device);
        try {
            redisTemplate.opsForValue().set(key, text);
        } catch (DataAccessException e) {
            throw new ConfigurationException("Cannot write generated config " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> readCurrent(String device) {
        String key = generatedKey(device);
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new ConfigurationException("Cannot read generated config " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public BackupHandle backup(String device, String text) {
        Instant capturedAt = BackupTimestamps.truncate(clock.instant());
        try {
            String json = mapper.writeValueAsString(new StoredBackup(device, text, capturedAt));
            for (int sequence = 0; sequence < MAX_COLLISIONS; sequence++) {
                String member = new BackupTimestamps.Stamp(capturedAt, sequence).member();
                String key = backupKey(device, member);
                Boolean created = redisTemplate.opsForValue().setIfAbsent(key, json);
                if (Boolean.TRUE.equals(created)) {
                    redisTemplate.opsForZSet().add(indexKey(device), member, capturedAt.toEpochMilli());
                    log.info("Backup written for {} -> {} ({} chars)", device, key, text.length());
                    return new BackupHandle(device, capturedAt, key);
                }
                if (created == null) {
                    throw new BackupFailureException(device, "Redis returned no result for SETNX " + key);
                }
            }
        } catch (JsonProcessingException e) {
            throw new BackupFailureException(device, "Cannot serialize backup for " + device, e);
        } catch (BackupFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackupFailureException(device, "Redis backup write failed for " + device + ": " + e.getMessage(), e);
        }
        throw new BackupFailureException(device, "Too many backup timestamp collisions for " + device);
    }

    @Override
    public Optional<Backup> latestBackup(String device) {
        Set<String> members = indexQuery(device, () -> redisTemplate.opsForZSet().reverseRange(indexKey(device), 0, 0));
        return firstBackup(device, members);
    }

    @Override
    public Optional<Backup> latestBackupBefore(String device, Instant instant) {
        long upper = BackupTimestamps.lastMillisBefore(instant);
        Set<String> members = indexQuery(device, () -> redisTemplate.opsForZSet()
                .reverseRangeByScore(indexKey(device), Double.NEGATIVE_INFINITY, upper, 0, 1));
        return firstBackup(device, members);
    }

    @Override
    public List<BackupHandle> listBackups(String device) {
        Set<String> members = indexQuery(device, () -> redisTemplate.opsForZSet().range(indexKey(device), 0, -1));
        if (members == null) {
            return List.of();
        }
        List<BackupHandle> handles = new ArrayList<>();
        for (String member : members) {
            BackupTimestamps.Stamp stamp = BackupTimestamps.parseMember(member);
            handles.add(new BackupHandle(device, stamp.capturedAt(), backupKey(device, member)));
        }
        return handles;
    }

    private Set<String> indexQuery(String device, Supplier<Set<String>> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new ConfigurationException("Cannot read backup index for " + device + ": " + e.getMessage(), e);
        }
    }

    private Optional<Backup> firstBackup(String device, Set<String> members) {
        if (members == null || members.isEmpty()) {
            return Optional.empty();
        }
        String key = backupKey(device, members.iterator().next());
        String json;
        try {
            json = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw new ConfigurationException("Cannot read backup " + key + ": " + e.getMessage(), e);
        }
        if (json == null) {
            throw new ConfigurationException("Backup index for " + device + " points to missing key " + key);
        }
        try {
            StoredBackup stored = mapper.readValue(json, StoredBackup.class);
            return Optional.of(new Backup(device, stored.text(), stored.capturedAt(),
                    new BackupHandle(device, stored.capturedAt(), key)));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Corrupt backup value at " + key, e);
        }
    }

    /**
     * Redis 中保存的备份值
     */
    record StoredBackup(String device, String text, Instant capturedAt) {
    }
}
