package com.signalflow.engine.config;

import com.signalflow.engine.model.Venue;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@ConfigurationProperties(prefix = "engine")
@Data
@Validated
public class EngineProperties {

    @Valid
    private VenueProperties alpaca = VenueProperties.equityDefaults();

    @Valid
    private VenueProperties binance = VenueProperties.cryptoDefaults();

    @Valid
    private Classification classification = new Classification();

    @Valid
    private Execution execution = new Execution();

    @Valid
    private Signals signals = new Signals();

    @Valid
    private Metrics metrics = new Metrics();

    @Valid
    private Scheduler scheduler = new Scheduler();

    /** Timezone used to decide which trades count towards "today" for the daily loss check. */
    @NotBlank
    private String accountingTimezone = "UTC";

    public VenueProperties venue(Venue venue) {
        return venue == Venue.BINANCE ? binance : alpaca;
    }

    @Data
    public static class VenueProperties {
        private boolean enabled = true;

        @Positive
        private double initialCash = 100_000.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.6;

        @NotNull
        private Duration maxSignalAge = Duration.ofMinutes(30);

        @Positive
        private double maxPortfolioRiskPct = 50.0;

        @Positive
        private double maxDailyLossPct = 5.0;

        @PositiveOrZero
        private double defaultStopLossPct = 2.0;

        @PositiveOrZero
        private double defaultTakeProfitPct = 6.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double kellyFraction = 0.25;

        @Positive
        private double maxPositionSizePct = 10.0;

        @PositiveOrZero
        private double slippageBps = 0.0;

        @PositiveOrZero
        private double minNotional = 1.0;

        @Valid
        private TradingHours tradingHours = new TradingHours();

        static VenueProperties equityDefaults() {
            VenueProperties props = new VenueProperties();
            props.getTradingHours().setEnabled(true);
            return props;
        }

        static VenueProperties cryptoDefaults() {
            VenueProperties props = new VenueProperties();
            props.setInitialCash(10_000.0);
            props.setMinNotional(10.0);
            props.getTradingHours().setEnabled(false);
            return props;
        }
    }

    @Data
    public static class TradingHours {
        private boolean enabled = true;

        @NotBlank
        private String timezone = "America/New_York";

        /** {@code HH:mm-HH:mm} ranges in the venue's timezone; an end before the start wraps past midnight. */
        private List<TradingWindow> windows = new ArrayList<>(List.of(TradingWindow.valueOf("09:30-16:00")));

        private boolean weekdaysOnly = true;
    }

    /**
     * One trading session, parsed when the properties are bound so a malformed entry
     * fails at startup.
     */
    public record TradingWindow(LocalTime start, LocalTime end) {

        private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("HH:mm");

        public TradingWindow {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
        }

        public static TradingWindow valueOf(String range) {
            String[] parts = range == null ? new String[0] : range.split("-");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Trading window must look like HH:mm-HH:mm: '" + range + "'");
            }
            try {
                return new TradingWindow(LocalTime.parse(parts[0].trim(), FORMAT), LocalTime.parse(parts[1].trim(), FORMAT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid trading window '" + range + "'", e);
            }
        }

        public boolean contains(LocalTime time) {
            if (!end.isBefore(start)) {
                return !time.isBefore(start) && !time.isAfter(end);
            }
            return !time.isBefore(start) || !time.isAfter(end);
        }

        @Override
        public String toString() {
            return FORMAT.format(start) + "-" + FORMAT.format(end);
        }
    }

    @Data
    public static class Classification {
        /** Quote currencies that mark a symbol as crypto, matched as a suffix. */
        private List<String> cryptoQuoteSuffixes = new ArrayList<>(List.of("USDT", "USDC", "BUSD"));

        /** Explicit crypto pairs, e.g. BTC/USDT, always routed to the crypto venue. */
        private List<String> cryptoPairs = new ArrayList<>();
    }

    @Data
    public static class Execution {
        /** Re-read the venue portfolio and repeat the exposure checks right before submitting. */
        private boolean revalidateBeforeSubmit = false;
    }

    @Data
    public static class Signals {
        /** Active signals older than this are swept to EXPIRED. */
        @NotNull
        private Duration staleAfter = Duration.ofHours(24);
    }

    @Data
    public static class Metrics {
        @NotNull
        private Duration window = Duration.ofDays(30);
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;

        // Also read by @Scheduled placeholders, so set these in ISO-8601 form (PT2M)

        @NotNull
        private Duration executionInterval = Duration.ofMinutes(2);

        @NotNull
        private Duration exitInterval = Duration.ofMinutes(15);

        @NotNull
        private Duration expiryInterval = Duration.ofHours(1);

        @Positive
        private int poolSize = 2;
    }
}
