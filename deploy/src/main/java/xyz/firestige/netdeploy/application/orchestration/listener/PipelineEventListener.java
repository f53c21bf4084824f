package xyz.firestige.netdeploy.application.orchestration.listener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import xyz.firestige.netdeploy.domain.pipeline.PipelinePhase;
import xyz.firestige.netdeploy.domain.pipeline.PipelineReport;
import xyz.firestige.netdeploy.domain.pipeline.event.PipelineCompletedEvent;
import xyz.firestige.netdeploy.domain.pipeline.event.PipelinePhaseChangedEvent;
import xyz.firestige.netdeploy.infrastructure.report.PipelineReportWriter;

/**
 * 流水线事件监听器
 * <p>
 * 职责：
 * 1. 记录阶段变更
 * 2. 流水线结束时落盘 JSON 报告（中止的流水线同样落盘）
 */
public class PipelineEventListener {

    private static final Logger logger = LoggerFactory.getLogger(PipelineEventListener.class);

    private final PipelineReportWriter reportWriter;

    public PipelineEventListener(PipelineReportWriter reportWriter) {
        this.reportWriter = reportWriter;
    }

    @EventListener
    public void onPhaseChanged(PipelinePhaseChangedEvent event) {
        if (event.getTo() == PipelinePhase.ABORTED) {
            logger.warn("[PipelineEventListener] 流水线 {} 在 {} 阶段中止", event.getRunId(), event.getFrom());
        } else {
            logger.info("[PipelineEventListener] 流水线 {} 进入 {} ({})",
                    event.getRunId(), event.getTo(), event.getTo().getDescription());
        }
    }

    @EventListener
    public void onCompleted(PipelineCompletedEvent event) {
        PipelineReport report = event.getReport();
        try {
            reportWriter.write(report);
        } catch (Exception e) {
            logger.error("[PipelineEventListener] 写入流水线 {} 报告失败", report.runId(), e);
        }
    }
}
