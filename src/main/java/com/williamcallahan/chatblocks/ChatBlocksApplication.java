package com.williamcallahan.chatblocks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChatBlocksApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatBlocksApplication.class, args);
    }

}
