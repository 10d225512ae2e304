package com.cred.freestyle.enrollment.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time source for all deadline and sweep computations. Tests replace it with a controllable clock.
 *
 * @author Enrollment Team
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
