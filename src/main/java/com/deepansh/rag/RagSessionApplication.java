package com.deepansh.rag;

import com.deepansh.rag.config.SessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SessionProperties.class)
public class RagSessionApplication {
    public static void main(String[] args) {
        SpringApplication.run(RagSessionApplication.class, args);
    }
}
