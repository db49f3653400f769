package com.jreinhal.docqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DocQaApplication {
    public static void main(String[] args) {
        SpringApplication.run(DocQaApplication.class, args);
    }
}
