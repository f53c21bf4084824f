package xyz.firestige.netdeploy.domain.intent;

import java.util.List;

/**
 * 全网统一参数，合并进每台设备的渲染上下文。
 * <p>
 * 凭据类字段来自环境变量占位符，可能为空。
 */
public record EnterpriseSettings(
        String domainName,
        List<String> dnsServers,
        List<String> dnsServersV6,
        List<String> ntpServers,
        String snmpCommunity,
        String snmpLocation,
        String snmpContact,
        String defaultGateway,
        String mgmtMask,
        String username,
        String password,
        String enableSecret,
        String ospfAuthKey,
        String bgpAuthKey) {

    public EnterpriseSettings {
        dnsServers = dnsServers == null ? List.of() : List.copyOf(dnsServers);
        dnsServersV6 = dnsServersV6 == null ? List.of() : List.copyOf(dnsServersV6);
        ntpServers = ntpServers == null ? List.of() : List.copyOf(ntpServers);
    }

    public static EnterpriseSettings empty() {
        return new EnterpriseSettings(null, List.of(), List.of(), List.of(), null, null, null,
                null, null, null, null, null, null, null);
    }
}
