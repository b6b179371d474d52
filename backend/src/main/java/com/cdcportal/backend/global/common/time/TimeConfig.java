package com.cdcportal.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Clock of the centers' calendar. Ages, attendance dates and academic years are
 * all "today" in {@code app.time-zone}; services read the reference date here
 * and pass it down explicitly.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock cdcClock(@Value("${app.time-zone:Asia/Manila}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
