package com.vcc.router.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RouterConfiguration {

    /**
     * Wall clock shared by health windows, cooldowns, budgets and experiments.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
