package com.williamcallahan.chatlatex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatLatexApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatLatexApplication.class, args);
    }

}
