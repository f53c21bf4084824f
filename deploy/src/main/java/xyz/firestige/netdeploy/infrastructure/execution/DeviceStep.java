package xyz.firestige.netdeploy.infrastructure.execution;

/**
 * 单设备部署流程中的一个步骤；失败时抛出带 ErrorType 的 NetDeployException
 */
public interface DeviceStep {

    String getStepName();

    void execute(DeviceRuntimeContext ctx);
}
