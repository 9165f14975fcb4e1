package com.distributedsystems.archon.exe;

import com.distributedsystems.archon.client.HostResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ArchonBeans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HostResolver hostResolver() {
        return HostResolver.system();
    }
}
