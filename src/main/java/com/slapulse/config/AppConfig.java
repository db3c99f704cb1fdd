package com.slapulse.config;

import com.slapulse.calendar.BusinessCalendar;
import com.slapulse.calendar.BusinessDurationCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Value("${sla.time-zone:America/Denver}")
    private String timeZone;

    @Value("${sla.business-hours.start:8}")
    private int businessStartHour;

    @Value("${sla.business-hours.end:17}")
    private int businessEndHour;

    @Value("${sla.thresholds.minutes-to-assignment:120}")
    private long minutesToAssignment;

    @Value("${sla.thresholds.hours-to-first-conversation:24}")
    private long hoursToFirstConversation;

    @Value("${sla.thresholds.days-without-touch-point:3}")
    private long daysWithoutTouchPoint;

    @Value("${sla.thresholds.days-to-under-contract:14}")
    private long daysToUnderContract;

    @Value("${sla.thresholds.days-to-close:45}")
    private long daysToClose;

    @Value("${sla.thresholds.days-to-payment-after-close:10}")
    private long daysToPaymentAfterClose;

    @Value("${sla.thresholds.hours-without-note:48}")
    private long hoursWithoutNote;

    @Value("${sla.thresholds.hours-to-termination-reason:24}")
    private long hoursToTerminationReason;

    @Value("${sla.thresholds.hours-to-lender-assignment:1}")
    private long hoursToLenderAssignment;

    @Value("${sla.thresholds.hours-to-borrower-intro:4}")
    private long hoursToBorrowerIntro;

    @Value("${sla.thresholds.hours-communication-stalled:72}")
    private long hoursCommunicationStalled;

    @Bean
    public BusinessHours businessHours() {
        if (businessStartHour < 0 || businessEndHour > 23 || businessEndHour <= businessStartHour) {
            throw new IllegalStateException("Invalid business window " + businessStartHour + "-" + businessEndHour);
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("Unknown sla.time-zone: " + timeZone, e);
        }
        BusinessHours hours = new BusinessHours(zone, LocalTime.of(businessStartHour, 0),
            LocalTime.of(businessEndHour, 0));
        log.info("Business window {}-{} in {}", hours.start(), hours.end(), hours.zone());
        return hours;
    }

    @Bean
    public SlaThresholds slaThresholds() {
        return new SlaThresholds(minutesToAssignment, hoursToFirstConversation, daysWithoutTouchPoint,
            daysToUnderContract, daysToClose, daysToPaymentAfterClose, hoursWithoutNote,
            hoursToTerminationReason, hoursToLenderAssignment, hoursToBorrowerIntro,
            hoursCommunicationStalled);
    }

    @Bean
    public BusinessCalendar businessCalendar(BusinessHours businessHours) {
        return new BusinessCalendar(businessHours.zone());
    }

    @Bean
    public BusinessDurationCalculator businessDurationCalculator(BusinessCalendar businessCalendar,
                                                                 BusinessHours businessHours) {
        return new BusinessDurationCalculator(businessCalendar, businessHours);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
