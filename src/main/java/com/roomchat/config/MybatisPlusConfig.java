package com.roomchat.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@MapperScan("com.roomchat.**.mapper")
public class MybatisPlusConfig {
}
