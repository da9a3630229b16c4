package com.clout.gameshow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GameshowApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameshowApplication.class, args);
    }
}
