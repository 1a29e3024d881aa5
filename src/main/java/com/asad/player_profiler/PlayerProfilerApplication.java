package com.asad.player_profiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlayerProfilerApplication {
    public static void main(String[] args) {
        SpringApplication.run(PlayerProfilerApplication.class, args);
    }
}
