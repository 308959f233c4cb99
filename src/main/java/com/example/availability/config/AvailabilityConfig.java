package com.example.availability.config;

import com.example.availability.dto.OperatingWindow;
import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.LocalTime;

@Configuration
@Data
@PropertySource("classpath:application.properties")
public class AvailabilityConfig {

    @Value("${availability.hours.open:08:00}")
    String openTime = "08:00";

    @Value("${availability.hours.close:22:00}")
    String closeTime = "22:00";

    /** Minutes after slot start during which the slot can still be booked */
    @Value("${availability.past-grace-minutes:10}")
    int pastGraceMinutes = 10;

    @Value("${availability.zone:Europe/Berlin}")
    String zone = "Europe/Berlin";

    @Value("${availability.session.ttl-minutes:30}")
    long sessionTtlMinutes = 30;

    public OperatingWindow defaultWindow() {
        return new OperatingWindow(toMinutes(openTime), toMinutes(closeTime));
    }

    private static int toMinutes(String time) {
        LocalTime parsed = LocalTime.parse(time.trim());
        return parsed.getHour() * 60 + parsed.getMinute();
    }
}
