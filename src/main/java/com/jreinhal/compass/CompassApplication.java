package com.jreinhal.compass;

import java.time.Clock;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class CompassApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompassApplication.class, args);
    }

    /**
     * Every "now" in the pipeline (period resolution, debounce bookkeeping, run timestamps)
     * reads this clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
