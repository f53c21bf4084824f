package xyz.firestige.netdeploy.infrastructure.execution.steps;

import xyz.firestige.netdeploy.domain.config.BackupHandle;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.domain.shared.exception.BackupFailureException;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceRuntimeContext;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceStep;

/**
 * 持久化抓取到的现网配置。失败则整个设备流程终止，后续下发不会发生。
 */
public class BackupStep implements DeviceStep {

    private final ConfigStore store;

    public BackupStep(ConfigStore store) {
        this.store = store;
    }

    @Override
    public String getStepName() {
        return "backup";
    }

    @Override
    public void execute(DeviceRuntimeContext ctx) {
        BackupHandle handle;
        try {
            handle = store.backup(ctx.getDeviceName(), ctx.getLiveText());
        } catch (BackupFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackupFailureException(ctx.getDeviceName(),
                    "Backup store error for " + ctx.getDeviceName() + ": " + e.getMessage(), e);
        }
        if (handle == null) {
            throw new BackupFailureException(ctx.getDeviceName(), "Backup store returned no handle for " + ctx.getDeviceName());
        }
        ctx.setBackup(handle);
    }
}
