package com.invoicedesk.backend.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

    // data de emissão das faturas é o dia corrente em UTC
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
