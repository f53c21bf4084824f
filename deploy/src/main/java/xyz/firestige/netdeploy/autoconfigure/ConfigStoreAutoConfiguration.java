package xyz.firestige.netdeploy.autoconfigure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.netdeploy.config.properties.NetDeployProperties;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.infrastructure.store.FileSystemConfigStore;
import xyz.firestige.netdeploy.infrastructure.store.InMemoryConfigStore;
import xyz.firestige.netdeploy.infrastructure.store.RedisConfigStore;

import java.nio.file.Path;
import java.time.Clock;

/**
 * 配置存储自动配置
 *
 * 配置属性：
 * - netdeploy.store.type: file（默认）/ redis / memory
 * - netdeploy.store.base-dir: file 模式根目录
 * - netdeploy.store.redis-namespace: redis 键前缀
 *
 * redis 模式复用 Spring Data Redis 提供的 StringRedisTemplate（spring.data.redis.*）。
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(NetDeployProperties.class)
public class ConfigStoreAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConfigStoreAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock netDeployClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ConfigStore.class)
    @ConditionalOnProperty(name = "netdeploy.store.type", havingValue = "file", matchIfMissing = true)
    public ConfigStore fileSystemConfigStore(NetDeployProperties properties, Clock clock) {
        Path baseDir = Path.of(properties.getStore().getBaseDir()).toAbsolutePath();
        log.info("Configuring FileSystemConfigStore at {}", baseDir);
        return new FileSystemConfigStore(baseDir, clock);
    }

    @Bean
    @ConditionalOnMissingBean(ConfigStore.class)
    @ConditionalOnClass(StringRedisTemplate.class)
    @ConditionalOnBean(StringRedisTemplate.class)
    @ConditionalOnProperty(name = "netdeploy.store.type", havingValue = "redis")
    public ConfigStore redisConfigStore(StringRedisTemplate redisTemplate, NetDeployProperties properties, Clock clock) {
        log.info("Configuring RedisConfigStore with namespace {}", properties.getStore().getRedisNamespace());
        return new RedisConfigStore(redisTemplate, properties.getStore().getRedisNamespace(), clock);
    }

    @Bean
    @ConditionalOnMissingBean(ConfigStore.class)
    @ConditionalOnProperty(name = "netdeploy.store.type", havingValue = "memory")
    public ConfigStore inMemoryConfigStore(Clock clock) {
        log.info("Configuring InMemoryConfigStore (contents are lost on exit)");
        return new InMemoryConfigStore(clock);
    }
}
