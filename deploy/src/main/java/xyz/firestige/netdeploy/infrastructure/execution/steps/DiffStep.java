package xyz.firestige.netdeploy.infrastructure.execution.steps;

import xyz.firestige.netdeploy.domain.diff.DiffEngine;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceRuntimeContext;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceStep;

/**
 * 基于刚抓取的快照计算差异（不复用任何更早的差异）
 */
public class DiffStep implements DeviceStep {

    private final DiffEngine diffEngine;

    public DiffStep(DiffEngine diffEngine) {
        this.diffEngine = diffEngine;
    }

    @Override
    public String getStepName() {
        return "diff";
    }

    @Override
    public void execute(DeviceRuntimeContext ctx) {
        ctx.setDiff(diffEngine.diff(ctx.getLiveText(), ctx.getDesiredText()));
    }
}
