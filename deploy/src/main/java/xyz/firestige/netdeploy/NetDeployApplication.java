package xyz.firestige.netdeploy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 网络配置部署工具入口
 */
@SpringBootApplication
public class NetDeployApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(NetDeployApplication.class, args)));
    }
}
