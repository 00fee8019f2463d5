package com.signalflow.engine.service.risk;

import com.signalflow.engine.config.EngineProperties;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

@Service
public class TradingWindowService {

    public record WindowDecision(boolean allowed, String reason) {}

    public WindowDecision evaluate(Instant nowUtc, EngineProperties.TradingHours config) {
        if (!config.isEnabled()) {
            return new WindowDecision(true, "Trading hours not enforced");
        }
        ZonedDateTime now = nowUtc.atZone(ZoneId.of(config.getTimezone()));
        if (config.isWeekdaysOnly() && isWeekend(now.getDayOfWeek())) {
            return new WindowDecision(false, "Weekend");
        }
        LocalTime time = now.toLocalTime();
        boolean open = config.getWindows() != null
                && config.getWindows().stream().anyMatch(window -> window.contains(time));
        return open
                ? new WindowDecision(true, "Within trading window")
                : new WindowDecision(false, "Outside trading window");
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
