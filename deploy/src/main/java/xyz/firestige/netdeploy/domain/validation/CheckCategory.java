package xyz.firestige.netdeploy.domain.validation;

/**
 * 校验类别，同时也是向输出解析器请求的状态类别
 */
public enum CheckCategory {
    REACHABILITY("可达性"),
    INTERFACES("接口状态"),
    OSPF("OSPF 邻接"),
    BGP("BGP 会话"),
    MPLS_LDP("LDP 邻居"),
    VRF("VRF 存在性");

    private final String description;

    CheckCategory(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
