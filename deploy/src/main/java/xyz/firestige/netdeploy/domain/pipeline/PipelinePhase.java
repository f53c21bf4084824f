package xyz.firestige.netdeploy.domain.pipeline;

/**
 * 流水线阶段
 */
public enum PipelinePhase {
    GENERATE("生成配置"),
    PRE_VALIDATE("部署前校验"),
    PREVIEW("差异预览"),
    DEPLOY("部署"),
    POST_VALIDATE("部署后校验"),
    REPORT("报告"),
    ABORTED("已中止");

    private final String description;

    PipelinePhase(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == REPORT || this == ABORTED;
    }
}
