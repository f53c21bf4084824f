package xyz.firestige.netdeploy.infrastructure.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;
import xyz.firestige.netdeploy.domain.config.Backup;
import xyz.firestige.netdeploy.domain.config.BackupHandle;
import xyz.firestige.netdeploy.domain.shared.exception.BackupFailureException;
import xyz.firestige.netdeploy.domain.shared.exception.ConfigurationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Redis 配置存储测试（Mockito 模拟 StringRedisTemplate）
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Redis 配置存储 测试")
class RedisConfigStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00.250Z");

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOps;
    @Mock
    private ZSetOperations<String, String> zSetOps;

    private RedisConfigStore store;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        store = new RedisConfigStore(redisTemplate, "nd", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("场景 - 备份用 SETNX 写入并登记到索引")
    void backupWritesWithSetIfAbsentAndIndexes() {
        // Given
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        when(valueOps.setIfAbsent(anyString(), anyString())).thenReturn(true);

        // When
        BackupHandle handle = store.backup("R1", "hostname R1\n");

        // Then
        long millis = NOW.toEpochMilli();
        assertThat(handle.location()).isEqualTo("nd:backup:R1:" + millis);
        verify(zSetOps).add("nd:backups:R1", String.valueOf(millis), millis);
    }

    @Test
    @DisplayName("场景 - 键已存在时追加序号，采集时间与分数保持不变")
    void collisionAppendsSequence() {
        // Given
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        long millis = NOW.toEpochMilli();
        when(valueOps.setIfAbsent(eq("nd:backup:R1:" + millis), anyString())).thenReturn(false);
        when(valueOps.setIfAbsent(eq("nd:backup:R1:" + millis + "-0001"), anyString())).thenReturn(true);

        // When
        BackupHandle handle = store.backup("R1", "v2");

        // Then
        assertThat(handle.capturedAt()).isEqualTo(NOW);
        assertThat(handle.location()).isEqualTo("nd:backup:R1:" + millis + "-0001");
        verify(zSetOps).add("nd:backups:R1", millis + "-0001", millis);
    }

    @Test
    @DisplayName("场景 - 读取生成配置时的 Redis 异常转换为 ConfigurationException")
    void redisErrorOnGeneratedConfigBecomesConfigurationError() {
        // Given
        doThrow(new RedisConnectionFailureException("redis down")).when(valueOps).set(anyString(), anyString());
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("redis down"));

        // Then
        assertThatThrownBy(() -> store.save("R1", "hostname R1\n"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("redis down");
        assertThatThrownBy(() -> store.readCurrent("R1"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nd:generated:R1");
    }

    @Test
    @DisplayName("场景 - Redis 异常转换为 BackupFailureException")
    void redisErrorBecomesBackupFailure() {
        // Given
        when(valueOps.setIfAbsent(anyString(), anyString())).thenThrow(new IllegalStateException("connection refused"));

        // Then
        assertThatThrownBy(() -> store.backup("R1", "v1"))
                .isInstanceOf(BackupFailureException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    @DisplayName("场景 - 读取严格早于指定时刻的最新备份")
    void latestBackupBeforeReadsIndexedValue() {
        // Given
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        when(valueOps.setIfAbsent(anyString(), anyString())).thenReturn(true);
        store.backup("R1", "hostname R1\n");
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).setIfAbsent(anyString(), json.capture());

        long millis = NOW.toEpochMilli();
        Set<String> members = new LinkedHashSet<>(Set.of(String.valueOf(millis)));
        Instant later = NOW.plusSeconds(1);
        when(zSetOps.reverseRangeByScore("nd:backups:R1", Double.NEGATIVE_INFINITY, later.toEpochMilli() - 1, 0, 1))
                .thenReturn(members);
        when(valueOps.get("nd:backup:R1:" + millis)).thenReturn(json.getValue());

        // When
        Optional<Backup> backup = store.latestBackupBefore("R1", later);

        // Then
        assertThat(backup).isPresent();
        assertThat(backup.get().text()).isEqualTo("hostname R1\n");
        assertThat(backup.get().capturedAt()).isEqualTo(NOW);
    }
}
