package xyz.firestige.netdeploy.infrastructure.event;

import org.springframework.context.ApplicationEventPublisher;
import xyz.firestige.netdeploy.domain.shared.event.DomainEventPublisher;

/**
 * Spring 本地事件总线实现，进程内同步投递
 */
public class SpringDomainEventPublisher implements DomainEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(Object event) {
        if (event != null) {
            applicationEventPublisher.publishEvent(event);
        }
    }
}
