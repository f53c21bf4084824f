package xyz.firestige.netdeploy.infrastructure.intent.model;

import jakarta.validation.constraints.NotBlank;

public class BgpNeighborDocument {

    @NotBlank
    private String ip;
    private String ipv6;

    @NotBlank
    private String remoteAs;
    private String description;

    public String getIp() {
        return ip;
    }

    public void setIp(String ip) {
        this.ip = ip;
    }

    public String getIpv6() {
        return ipv6;
    }

    public void setIpv6(String ipv6) {
        this.ipv6 = ipv6;
    }

    public String getRemoteAs() {
        return remoteAs;
    }

    public void setRemoteAs(String remoteAs) {
        this.remoteAs = remoteAs;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
