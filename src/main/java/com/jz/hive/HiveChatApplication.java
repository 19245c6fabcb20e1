package com.jz.hive;


import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;


@SpringBootApplication
@MapperScan("com.jz.hive.mapper")
@ConfigurationPropertiesScan(basePackages = "com.jz.hive")
public class HiveChatApplication {
    public static void main(String[] args) {
        SpringApplication.run(HiveChatApplication.class, args);
    }
}
