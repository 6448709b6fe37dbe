package com.nexus;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Nexus 图文档存储主应用类
 *
 * @author Nexus Graph Store
 * @version 1.0.0
 * @since 2025-10-25
 */
@SpringBootApplication
@MapperScan("com.nexus.repository")
public class NexusApplication {

    public static void main(String[] args) {
        SpringApplication.run(NexusApplication.class, args);
    }
}
