package xyz.firestige.netdeploy.infrastructure.execution.steps;

import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceRuntimeContext;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceStep;

/**
 * 抓取现网配置
 */
public class CaptureStep implements DeviceStep {

    private final DeviceOperationGuard guard;

    public CaptureStep(DeviceOperationGuard guard) {
        this.guard = guard;
    }

    @Override
    public String getStepName() {
        return "capture";
    }

    @Override
    public void execute(DeviceRuntimeContext ctx) {
        String live = guard.call(ctx.getDeviceName(), getStepName(), ctx.getSession()::capture);
        ctx.setLiveText(live != null ? live : "");
    }
}
