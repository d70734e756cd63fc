package com.bit.attest;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class AttestTestConfig {

    @Bean
    @Primary
    public MutableClock mutableClock() {
        return new MutableClock(1_700_000_000_000L);
    }
}
