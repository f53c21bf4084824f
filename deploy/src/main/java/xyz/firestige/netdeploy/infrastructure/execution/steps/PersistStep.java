package xyz.firestige.netdeploy.infrastructure.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceRuntimeContext;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceStep;

/**
 * 保存设备启动配置（会话不支持时跳过）
 */
public class PersistStep implements DeviceStep {

    private static final Logger log = LoggerFactory.getLogger(PersistStep.class);

    private final DeviceOperationGuard guard;

    public PersistStep(DeviceOperationGuard guard) {
        this.guard = guard;
    }

    @Override
    public String getStepName() {
        return "persist";
    }

    @Override
    public void execute(DeviceRuntimeContext ctx) {
        if (!ctx.getSession().supportsPersist()) {
            log.info("Session for {} cannot persist startup config, skipping", ctx.getDeviceName());
            return;
        }
        guard.run(ctx.getDeviceName(), getStepName(), ctx.getSession()::persist);
    }
}
