package xyz.firestige.netdeploy.infrastructure.intent.model;

import jakarta.validation.constraints.NotBlank;

public class VrfDocument {

    private String description;

    @NotBlank
    private String rdSuffix;

    @NotBlank
    private String routeTarget;

    private String ipv6Prefix;

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getRdSuffix() {
        return rdSuffix;
    }

    public void setRdSuffix(String rdSuffix) {
        this.rdSuffix = rdSuffix;
    }

    public String getRouteTarget() {
        return routeTarget;
    }

    public void setRouteTarget(String routeTarget) {
        this.routeTarget = routeTarget;
    }

    public String getIpv6Prefix() {
        return ipv6Prefix;
    }

    public void setIpv6Prefix(String ipv6Prefix) {
        this.ipv6Prefix = ipv6Prefix;
    }
}
