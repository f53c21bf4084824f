package xyz.firestige.netdeploy.testutil;

import xyz.firestige.netdeploy.domain.intent.BgpNeighborIntent;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.intent.EnterpriseSettings;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;
import xyz.firestige.netdeploy.domain.intent.InterfaceIntent;
import xyz.firestige.netdeploy.domain.intent.VrfDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用设备意图
 */
public final class IntentFixtures {

    private IntentFixtures() {
    }

    public static DeviceIntent device(String name, int tier, String... dependsOn) {
        return DeviceIntent.builder(name)
                .role("core")
                .tier(tier)
                .template("core_router")
                .loopbackIp("10.255.0." + Math.abs(name.hashCode() % 200 + 1))
                .dependsOn(List.of(dependsOn))
                .build();
    }

    public static DeviceIntent core(String name, String loopback) {
        return DeviceIntent.builder(name)
                .role("core")
                .tier(0)
                .template("core_router")
                .mgmtIp("192.168.68.201")
                .loopbackIp(loopback)
                .bgpAsn("65000")
                .addInterface(new InterfaceIntent("GigabitEthernet2", "10.0.0.1", "255.255.255.252", null, "To CORE2"))
                .addInterface(new InterfaceIntent("GigabitEthernet4", null, null, null, "Unused"))
                .addBgpNeighbor(new BgpNeighborIntent("10.255.0.2", null, "65000", "CORE2"))
                .build();
    }

    public static DeviceIntent edge(String name, String loopback, List<String> vrfs) {
        return DeviceIntent.builder(name)
                .role("edge")
                .tier(3)
                .template("pe_router")
                .loopbackIp(loopback)
                .bgpAsn("65000")
                .addInterface(new InterfaceIntent("GigabitEthernet2", "10.0.1.2", "255.255.255.252", null, "Uplink"))
                .addBgpNeighbor(new BgpNeighborIntent("10.255.0.1", null, "65000", "CORE1"))
                .vrfs(vrfs)
                .build();
    }

    public static EnterpriseSettings enterprise() {
        return new EnterpriseSettings("euniv.example.edu", List.of("10.255.255.53"), List.of(),
                List.of("10.255.255.123"), "euniv-ro", "EUNIV Data Center", null,
                null, null, "admin", "changeme", null, null, null);
    }

    public static Map<String, VrfDefinition> vrfs() {
        Map<String, VrfDefinition> vrfs = new LinkedHashMap<>();
        vrfs.put("STUDENT-NET", new VrfDefinition("STUDENT-NET", "Student network", "100", "65000:100", null));
        vrfs.put("STAFF-NET", new VrfDefinition("STAFF-NET", "Staff network", "200", "65000:200", null));
        return vrfs;
    }

    public static IntentRepository repository(DeviceIntent... devices) {
        Map<String, DeviceIntent> byName = new LinkedHashMap<>();
        for (DeviceIntent d : devices) {
            byName.put(d.getName(), d);
        }
        return new IntentRepository(byName, enterprise(), vrfs());
    }
}
