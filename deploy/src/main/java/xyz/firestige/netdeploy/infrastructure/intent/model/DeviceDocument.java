package xyz.firestige.netdeploy.infrastructure.intent.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.ArrayList;
import java.util.List;

/**
 * 单台设备的意图声明。tier 可省略，此时由 role 映射得到。
 */
public class DeviceDocument {

    @NotBlank
    private String role;

    @PositiveOrZero
    private Integer tier;

    @NotBlank
    private String template;

    private String mgmtIp;
    private String loopbackIp;
    private String loopbackIpv6;
    private String bgpAsn;
    private boolean routeReflector;
    private String rrClusterId;

    @Valid
    private List<InterfaceDocument> interfaces = new ArrayList<>();

    @Valid
    private List<BgpNeighborDocument> bgpNeighbors = new ArrayList<>();

    private List<String> vrfs = new ArrayList<>();

    private List<String> dependsOn = new ArrayList<>();

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public Integer getTier() {
        return tier;
    }

    public void setTier(Integer tier) {
        this.tier = tier;
    }

    public String getTemplate() {
        return template;
    }

    public void setTemplate(String template) {
        this.template = template;
    }

    public String getMgmtIp() {
        return mgmtIp;
    }

    public void setMgmtIp(String mgmtIp) {
        this.mgmtIp = mgmtIp;
    }

    public String getLoopbackIp() {
        return loopbackIp;
    }

    public void setLoopbackIp(String loopbackIp) {
        this.loopbackIp = loopbackIp;
    }

    public String getLoopbackIpv6() {
        return loopbackIpv6;
    }

    public void setLoopbackIpv6(String loopbackIpv6) {
        this.loopbackIpv6 = loopbackIpv6;
    }

    public String getBgpAsn() {
        return bgpAsn;
    }

    public void setBgpAsn(String bgpAsn) {
        this.bgpAsn = bgpAsn;
    }

    public boolean isRouteReflector() {
        return routeReflector;
    }

    public void setRouteReflector(boolean routeReflector) {
        this.routeReflector = routeReflector;
    }

    public String getRrClusterId() {
        return rrClusterId;
    }

    public void setRrClusterId(String rrClusterId) {
        this.rrClusterId = rrClusterId;
    }

    public List<InterfaceDocument> getInterfaces() {
        return interfaces;
    }

    public void setInterfaces(List<InterfaceDocument> interfaces) {
        this.interfaces = interfaces != null ? interfaces : new ArrayList<>();
    }

    public List<BgpNeighborDocument> getBgpNeighbors() {
        return bgpNeighbors;
    }

    public void setBgpNeighbors(List<BgpNeighborDocument> bgpNeighbors) {
        this.bgpNeighbors = bgpNeighbors != null ? bgpNeighbors : new ArrayList<>();
    }

    public List<String> getVrfs() {
        return vrfs;
    }

    public void setVrfs(List<String> vrfs) {
        this.vrfs = vrfs != null ? vrfs : new ArrayList<>();
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public void setDependsOn(List<String> dependsOn) {
        this.dependsOn = dependsOn != null ? dependsOn : new ArrayList<>();
    }
}
