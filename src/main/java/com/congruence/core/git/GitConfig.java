package com.congruence.core.git;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class GitConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BranchCache branchCache(Clock clock, GitProperties properties) {
        return new BranchCache(clock, Duration.ofSeconds(properties.getBranchCacheTtlSeconds()));
    }
}
