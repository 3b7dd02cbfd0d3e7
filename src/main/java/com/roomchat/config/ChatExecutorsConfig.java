package com.roomchat.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties({
        ChatDbExecutorProperties.class,
        ChatNotifyExecutorProperties.class
})
public class ChatExecutorsConfig {

    @Bean("chatDbExecutor")
    @Primary
    public Executor chatDbExecutor(ChatDbExecutorProperties props) {
        int core = props == null ? 8 : props.corePoolSizeEffective();
        int max = props == null ? 32 : props.maxPoolSizeEffective();
        int queue = props == null ? 10_000 : props.queueCapacityEffective();
        return build("chat-db-", core, max, queue);
    }

    @Bean("chatNotifyExecutor")
    public Executor chatNotifyExecutor(ChatNotifyExecutorProperties props) {
        int core = props == null ? 2 : props.corePoolSizeEffective();
        int max = props == null ? 4 : props.maxPoolSizeEffective();
        int queue = props == null ? 5_000 : props.queueCapacityEffective();
        return build("chat-notify-", core, max, queue);
    }

    private static Executor build(String prefix, int core, int max, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        if (max < core) {
            max = core;
        }
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
