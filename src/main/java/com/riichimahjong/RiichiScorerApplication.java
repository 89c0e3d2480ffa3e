package com.riichimahjong;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 立直麻将计分服务主入口
 */
@SpringBootApplication
public class RiichiScorerApplication {
    public static void main(String[] args) {
        SpringApplication.run(RiichiScorerApplication.class, args);
    }
}
