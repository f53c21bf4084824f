package xyz.firestige.netdeploy.infrastructure.metrics;

/**
 * 指标门面，核心代码不直接依赖 Micrometer
 */
public interface MetricsRegistry {

    void incrementCounter(String name, String... tags);

    void setGauge(String name, double value);
}
