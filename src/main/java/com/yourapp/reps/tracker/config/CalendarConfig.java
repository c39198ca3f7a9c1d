package com.yourapp.reps.tracker.config;

import com.yourapp.reps.tracker.service.CalendarDays;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CalendarConfig {

    @Bean
    public Clock clock(CalendarProperties properties) {
        return Clock.system(properties.getZoneId());
    }

    @Bean
    public CalendarDays calendarDays(Clock clock, CalendarProperties properties) {
        return new CalendarDays(clock, properties.getWeekStart());
    }
}
