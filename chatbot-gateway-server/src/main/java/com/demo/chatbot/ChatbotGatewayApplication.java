package com.demo.chatbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatbotGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatbotGatewayApplication.class, args);
    }
}
