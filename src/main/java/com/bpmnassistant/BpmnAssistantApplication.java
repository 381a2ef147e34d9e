package com.bpmnassistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BpmnAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(BpmnAssistantApplication.class, args);
    }
}
