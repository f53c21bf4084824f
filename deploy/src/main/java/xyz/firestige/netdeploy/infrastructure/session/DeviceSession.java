package xyz.firestige.netdeploy.infrastructure.session;

/**
 * 设备会话
 * <p>
 * 核心流程对设备只做这几件事；厂商相关的行为都藏在实现后面，核心从不探查具体类型。
 * 一台设备同一时刻只有一个会话在使用。
 */
public interface DeviceSession extends AutoCloseable {

    /**
     * 抓取现网运行配置
     *
     * @throws xyz.firestige.netdeploy.domain.shared.exception.SessionException 会话异常
     */
    String capture();

    /**
     * 下发配置文本；设备报错时抛出 ApplyRejectedException
     *
     * @throws xyz.firestige.netdeploy.domain.shared.exception.ApplyRejectedException 设备拒绝
     * @throws xyz.firestige.netdeploy.domain.shared.exception.SessionException       会话异常
     */
    void apply(String text);

    /**
     * 保存到设备自身的启动配置，仅在 {@link #supportsPersist()} 为 true 时调用
     */
    void persist();

    boolean supportsPersist();

    void disconnect();

    @Override
    default void close() {
        disconnect();
    }
}
