package xyz.firestige.netdeploy.infrastructure.intent.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 意图文档根对象，映射 intent YAML 的根结构
 * <pre>
 * enterprise: {...}
 * vrfs:
 *   STUDENT-NET: {...}
 * devices:
 *   EUNIV-CORE1: {...}
 * </pre>
 */
public class IntentDocument {

    @Valid
    private EnterpriseDocument enterprise = new EnterpriseDocument();

    @Valid
    private Map<String, VrfDocument> vrfs = new LinkedHashMap<>();

    @NotEmpty(message = "intent document declares no devices")
    @Valid
    private Map<String, DeviceDocument> devices = new LinkedHashMap<>();

    public EnterpriseDocument getEnterprise() {
        return enterprise;
    }

    public void setEnterprise(EnterpriseDocument enterprise) {
        this.enterprise = enterprise;
    }

    public Map<String, VrfDocument> getVrfs() {
        return vrfs;
    }

    public void setVrfs(Map<String, VrfDocument> vrfs) {
        this.vrfs = vrfs != null ? vrfs : new LinkedHashMap<>();
    }

    public Map<String, DeviceDocument> getDevices() {
        return devices;
    }

    public void setDevices(Map<String, DeviceDocument> devices) {
        this.devices = devices != null ? devices : new LinkedHashMap<>();
    }
}
