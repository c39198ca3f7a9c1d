package com.yourapp.reps.tracker.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Local calendar settings: the zone that decides where one day ends and the next begins,
 * and the weekday that numbering starts from.
 */
@Component
@ConfigurationProperties(prefix = "tracker.calendar")
public class CalendarProperties {
    private static final Logger logger = LoggerFactory.getLogger(CalendarProperties.class);

    private String zone;                      // e.g. "Europe/Berlin", blank = system zone
    private String firstDayOfWeek = "SUNDAY"; // e.g. "MONDAY"
    private ZoneId zoneId;
    private DayOfWeek weekStart;

    @PostConstruct
    public void init() {
        zoneId = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone.trim());
        weekStart = firstDayOfWeek == null || firstDayOfWeek.isBlank()
                ? DayOfWeek.SUNDAY
                : DayOfWeek.valueOf(firstDayOfWeek.trim().toUpperCase(Locale.ROOT));
        logger.info("Calendar zone {} with weeks starting on {}", zoneId, weekStart);
    }

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }
    public String getFirstDayOfWeek() { return firstDayOfWeek; }
    public void setFirstDayOfWeek(String firstDayOfWeek) { this.firstDayOfWeek = firstDayOfWeek; }
    public ZoneId getZoneId() { return zoneId; }
    public DayOfWeek getWeekStart() { return weekStart; }
}
