package com.openforge.convo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConvoApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ConvoApplication.class, args)));
    }
}
