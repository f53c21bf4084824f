package xyz.firestige.netdeploy.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.netdeploy.cli.NetDeployCommandLineRunner;
import xyz.firestige.netdeploy.cli.SpringCommandFactory;

/**
 * 命令行装配，netdeploy.cli.enabled=false 时不注册（测试）
 */
@Configuration
@ConditionalOnProperty(name = "netdeploy.cli.enabled", havingValue = "true", matchIfMissing = true)
public class CliConfiguration {

    @Bean
    public SpringCommandFactory springCommandFactory(ApplicationContext applicationContext) {
        return new SpringCommandFactory(applicationContext.getAutowireCapableBeanFactory());
    }

    @Bean
    public NetDeployCommandLineRunner netDeployCommandLineRunner(SpringCommandFactory factory) {
        return new NetDeployCommandLineRunner(factory);
    }
}
