package xyz.firestige.netdeploy.domain.pipeline.event;

import xyz.firestige.netdeploy.domain.pipeline.PipelineReport;

/**
 * 流水线结束（REPORT 或 ABORTED）事件，携带最终报告
 */
public class PipelineCompletedEvent extends PipelineEvent {

    private final PipelineReport report;

    public PipelineCompletedEvent(PipelineReport report) {
        super(report.runId(), report.summary());
        this.report = report;
    }

    public PipelineReport getReport() {
        return report;
    }
}
