package xyz.firestige.netdeploy.infrastructure.metrics;

public class NoopMetricsRegistry implements MetricsRegistry {

    @Override
    public void incrementCounter(String name, String... tags) {
    }

    @Override
    public void setGauge(String name, double value) {
    }
}
