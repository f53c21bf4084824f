package xyz.firestige.netdeploy.domain.pipeline.event;

import xyz.firestige.netdeploy.domain.pipeline.PipelinePhase;

/**
 * 流水线阶段变更事件
 */
public class PipelinePhaseChangedEvent extends PipelineEvent {

    private final PipelinePhase from;
    private final PipelinePhase to;

    public PipelinePhaseChangedEvent(String runId, PipelinePhase from, PipelinePhase to) {
        super(runId, String.format("%s -> %s", from, to));
        this.from = from;
        this.to = to;
    }

    public PipelinePhase getFrom() {
        return from;
    }

    public PipelinePhase getTo() {
        return to;
    }
}
