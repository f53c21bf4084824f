package xyz.firestige.netdeploy.domain.shared.event;

import java.util.List;

/**
 * 领域事件发布器接口
 * <p>
 * 领域层只依赖该接口，具体传输机制（Spring 本地事件总线等）由基础设施层实现。
 */
public interface DomainEventPublisher {

    /**
     * 发布单个领域事件
     *
     * @param event 领域事件对象
     */
    void publish(Object event);

    default void publishAll(List<?> events) {
        if (events != null) {
            events.forEach(this::publish);
        }
    }
}
