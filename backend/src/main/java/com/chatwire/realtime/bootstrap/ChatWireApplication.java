package com.chatwire.realtime.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.chatwire.realtime")
@EnableScheduling
public class ChatWireApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChatWireApplication.class, args);
    }
}
