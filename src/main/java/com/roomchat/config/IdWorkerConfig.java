package com.roomchat.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 雪花 id：消息 id 在落库前由网关预分配（IdWorker.getId()），与 ASSIGN_ID 共用同一组 worker/datacenter。
 */
@Slf4j
@Configuration
public class IdWorkerConfig {

    private final long datacenterId;
    private final long workerId;

    public IdWorkerConfig(
            @Value("${chat.id.datacenter-id:1}") long datacenterId,
            @Value("${chat.id.worker-id:-1}") long workerId
    ) {
        this.datacenterId = datacenterId;
        this.workerId = workerId;
    }

    @PostConstruct
    public void init() {
        if (workerId < 0) {
            log.info("IdWorker: keep default (no chat.id.worker-id)");
            return;
        }
        IdWorker.initSequence(normalize5Bits(workerId), normalize5Bits(datacenterId));
        log.info("IdWorker: initSequence(workerId={}, datacenterId={})", normalize5Bits(workerId), normalize5Bits(datacenterId));
    }

    @Bean
    public IdentifierGenerator identifierGenerator() {
        if (workerId < 0) {
            return DefaultIdentifierGenerator.getInstance();
        }
        return new DefaultIdentifierGenerator(normalize5Bits(workerId), normalize5Bits(datacenterId));
    }

    static long normalize5Bits(long v) {
        long x = v % 32;
        return x < 0 ? x + 32 : x;
    }
}
