package xyz.firestige.netdeploy.domain.pipeline.event;

import xyz.firestige.netdeploy.domain.shared.event.DomainEvent;

/**
 * 流水线事件基类
 */
public abstract class PipelineEvent extends DomainEvent {

    private final String runId;

    protected PipelineEvent(String runId, String message) {
        super();
        this.runId = runId;
        setMessage(message);
    }

    public String getRunId() {
        return runId;
    }

    @Override
    public String toString() {
        return getEventName() + "{" +
                "eventId='" + getEventId() + '\'' +
                ", runId='" + runId + '\'' +
                ", timestamp=" + getTimestamp() +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
