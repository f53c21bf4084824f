package xyz.firestige.netdeploy.infrastructure.template;

import xyz.firestige.netdeploy.domain.intent.BgpNeighborIntent;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.intent.EnterpriseSettings;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;
import xyz.firestige.netdeploy.domain.intent.InterfaceIntent;
import xyz.firestige.netdeploy.domain.intent.VrfDefinition;
import xyz.firestige.netdeploy.domain.shared.exception.TemplateRenderException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 渲染上下文构建器
 * <p>
 * 职责：把 DeviceIntent + 全网参数 + 设备引用的 VRF 定义展开成只包含 Map / List / String / Boolean 的树。
 * <p>
 * 约定：
 * - 缺省的字符串字段统一为 ""（模板中用 {#if x} 判断），不出现 null
 * - 多值字段保持 DeviceIntent 中已排序的顺序
 * <p>
 * 顶层变量：device / enterprise / vrfs
 */
public class TemplateModelBuilder {

    private final EnterpriseSettings enterprise;
    private final Map<String, VrfDefinition> vrfDefinitions;

    public TemplateModelBuilder(IntentRepository repository) {
        this(repository.enterprise(), repository.vrfs());
    }

    public TemplateModelBuilder(EnterpriseSettings enterprise, Map<String, VrfDefinition> vrfDefinitions) {
        this.enterprise = enterprise;
        this.vrfDefinitions = Map.copyOf(vrfDefinitions);
    }

    public Map<String, Object> build(DeviceIntent intent) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("device", device(intent));
        model.put("enterprise", enterprise());
        model.put("vrfs", vrfs(intent));
        return model;
    }

    private Map<String, Object> device(DeviceIntent intent) {
        Map<String, Object> device = new LinkedHashMap<>();
        device.put("name", intent.getName());
        device.put("role", text(intent.getRole()));
        device.put("tier", String.valueOf(intent.getTier()));
        device.put("mgmtIp", text(intent.getMgmtIp()));
        device.put("loopbackIp", text(intent.getLoopbackIp()));
        device.put("loopbackIpv6", text(intent.getLoopbackIpv6()));
        device.put("bgpAsn", text(intent.getBgpAsn()));
        device.put("routeReflector", intent.isRouteReflector());
        device.put("rrClusterId", text(intent.getRrClusterId()));

        List<Map<String, Object>> interfaces = new ArrayList<>();
        for (InterfaceIntent i : intent.getInterfaces()) {
            Map<String, Object> iface = new LinkedHashMap<>();
            iface.put("name", i.name());
            iface.put("ip", text(i.ip()));
            iface.put("mask", text(i.mask()));
            iface.put("ipv6", text(i.ipv6()));
            iface.put("description", text(i.description()));
            interfaces.add(iface);
        }
        device.put("interfaces", interfaces);

        List<Map<String, Object>> neighbors = new ArrayList<>();
        for (BgpNeighborIntent n : intent.getBgpNeighbors()) {
            Map<String, Object> peer = new LinkedHashMap<>();
            peer.put("ip", n.ip());
            peer.put("ipv6", text(n.ipv6()));
            peer.put("remoteAs", n.remoteAs());
            peer.put("description", text(n.description()));
            neighbors.add(peer);
        }
        device.put("bgpNeighbors", neighbors);
        return device;
    }

    private Map<String, Object> enterprise() {
        Map<String, Object> e = new LinkedHashMap<>();
        e.put("domainName", text(enterprise.domainName()));
        e.put("dnsServers", enterprise.dnsServers());
        e.put("dnsServersV6", enterprise.dnsServersV6());
        e.put("ntpServers", enterprise.ntpServers());
        e.put("snmpCommunity", text(enterprise.snmpCommunity()));
        e.put("snmpLocation", text(enterprise.snmpLocation()));
        e.put("snmpContact", text(enterprise.snmpContact()));
        e.put("defaultGateway", text(enterprise.defaultGateway()));
        e.put("mgmtMask", text(enterprise.mgmtMask()));
        e.put("username", text(enterprise.username()));
        e.put("password", text(enterprise.password()));
        e.put("enableSecret", text(enterprise.enableSecret()));
        e.put("ospfAuthKey", text(enterprise.ospfAuthKey()));
        e.put("bgpAuthKey", text(enterprise.bgpAuthKey()));
        return e;
    }

    private List<Map<String, Object>> vrfs(DeviceIntent intent) {
        List<Map<String, Object>> vrfs = new ArrayList<>();
        for (String name : intent.getVrfs()) {
            VrfDefinition def = vrfDefinitions.get(name);
            if (def == null) {
                throw new TemplateRenderException("Device " + intent.getName() + " references undefined VRF " + name);
            }
            Map<String, Object> vrf = new LinkedHashMap<>();
            vrf.put("name", def.name());
            vrf.put("description", text(def.description()));
            vrf.put("rdSuffix", def.rdSuffix());
            vrf.put("routeTarget", def.routeTarget());
            vrf.put("ipv6Prefix", text(def.ipv6Prefix()));
            vrfs.add(vrf);
        }
        return vrfs;
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }
}
