package xyz.firestige.netdeploy.domain.diff;

/**
 * 现网配置与期望配置的差异计算，无副作用，可重复调用。
 */
public interface DiffEngine {

    ConfigDiff diff(String liveText, String desiredText);
}
