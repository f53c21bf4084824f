package xyz.firestige.netdeploy.cli;

import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;
import picocli.CommandLine;

/**
 * 让 picocli 通过 Spring 创建命令对象，命令可以构造器注入服务
 */
public class SpringCommandFactory implements CommandLine.IFactory {

    private final AutowireCapableBeanFactory beanFactory;

    public SpringCommandFactory(AutowireCapableBeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        try {
            return beanFactory.createBean(cls);
        } catch (BeansException e) {
            // picocli 内部类型（转换器、帮助等）交给默认工厂
            return CommandLine.defaultFactory().create(cls);
        }
    }
}
