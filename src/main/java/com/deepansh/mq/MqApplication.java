package com.deepansh.mq;

import com.deepansh.mq.config.MqProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MqProperties.class)
public class MqApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MqApplication.class, args)));
    }
}
