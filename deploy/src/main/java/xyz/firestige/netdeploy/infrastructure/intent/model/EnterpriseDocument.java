package xyz.firestige.netdeploy.infrastructure.intent.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 全网参数。凭据字段通常写成 {$DEVICE_PASSWORD} 之类的环境变量占位符。
 */
public class EnterpriseDocument {

    private String domainName;
    private List<String> dnsServers = new ArrayList<>();
    private List<String> dnsServersV6 = new ArrayList<>();
    private List<String> ntpServers = new ArrayList<>();
    private String snmpCommunity;
    private String snmpLocation;
    private String snmpContact;
    private String defaultGateway;
    private String mgmtMask;
    private String username;
    private String password;
    private String enableSecret;
    private String ospfAuthKey;
    private String bgpAuthKey;

    public String getDomainName() {
        return domainName;
    }

    public void setDomainName(String domainName) {
        this.domainName = domainName;
    }

    public List<String> getDnsServers() {
        return dnsServers;
    }

    public void setDnsServers(List<String> dnsServers) {
        this.dnsServers = dnsServers != null ? dnsServers : new ArrayList<>();
    }

    public List<String> getDnsServersV6() {
        return dnsServersV6;
    }

    public void setDnsServersV6(List<String> dnsServersV6) {
        this.dnsServersV6 = dnsServersV6 != null ? dnsServersV6 : new ArrayList<>();
    }

    public List<String> getNtpServers() {
        return ntpServers;
    }

    public void setNtpServers(List<String> ntpServers) {
        this.ntpServers = ntpServers != null ? ntpServers : new ArrayList<>();
    }

    public String getSnmpCommunity() {
        return snmpCommunity;
    }

    public void setSnmpCommunity(String snmpCommunity) {
        this.snmpCommunity = snmpCommunity;
    }

    public String getSnmpLocation() {
        return snmpLocation;
    }

    public void setSnmpLocation(String snmpLocation) {
        this.snmpLocation = snmpLocation;
    }

    public String getSnmpContact() {
        return snmpContact;
    }

    public void setSnmpContact(String snmpContact) {
        this.snmpContact = snmpContact;
    }

    public String getDefaultGateway() {
        return defaultGateway;
    }

    public void setDefaultGateway(String defaultGateway) {
        this.defaultGateway = defaultGateway;
    }

    public String getMgmtMask() {
        return mgmtMask;
    }

    public void setMgmtMask(String mgmtMask) {
        this.mgmtMask = mgmtMask;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getEnableSecret() {
        return enableSecret;
    }

    public void setEnableSecret(String enableSecret) {
        this.enableSecret = enableSecret;
    }

    public String getOspfAuthKey() {
        return ospfAuthKey;
    }

    public void setOspfAuthKey(String ospfAuthKey) {
        this.ospfAuthKey = ospfAuthKey;
    }

    public String getBgpAuthKey() {
        return bgpAuthKey;
    }

    public void setBgpAuthKey(String bgpAuthKey) {
        this.bgpAuthKey = bgpAuthKey;
    }
}
