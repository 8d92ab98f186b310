package com.flagship.revenue_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

/**
 * Ledger configuration bound from {@code ledger.*}.
 *
 * Defaults mirror the platform's production values so that a bare
 * {@code new LedgerProperties()} is usable in tests.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    /** Zone that defines a calendar day for reconciliation, volume stats and schedules. */
    @NotNull
    private ZoneId zone = ZoneId.of("Asia/Dhaka");

    /** Owner of the single platform (service charge) account. */
    @NotBlank
    private String platformOwnerId = "platform-admin";

    /** Rounding tolerance applied to every balance comparison. */
    @NotNull
    @DecimalMin("0.00")
    private BigDecimal tolerance = new BigDecimal("0.01");

    @Valid
    private Distribution distribution = new Distribution();
    @Valid
    private Reconciliation reconciliation = new Reconciliation();
    @Valid
    private Health health = new Health();
    @Valid
    private Integrity integrity = new Integrity();

    @Getter
    @Setter
    public static class Distribution {
        private BigDecimal defaultRate = new BigDecimal("0.05");
        private BigDecimal maxRate = new BigDecimal("0.5");
        private BigDecimal minAmount = new BigDecimal("1.00");
        private BigDecimal maxAmount = new BigDecimal("1000000.00");
        /** Payee-scope specific service charge rates, keyed by scope id. */
        private Map<String, BigDecimal> rates = new HashMap<>();
    }

    @Getter
    @Setter
    public static class Reconciliation {
        /** Absolute difference above which a discrepancy is HIGH severity. */
        private BigDecimal highSeverityThreshold = new BigDecimal("1000.00");
    }

    @Getter
    @Setter
    public static class Health {
        private BigDecimal maxBalance = new BigDecimal("1000000.00");
        private BigDecimal lowBalanceThreshold = new BigDecimal("100.00");
        private long maxDailyTransactionCount = 1000;
        private BigDecimal maxDailyVolume = new BigDecimal("500000.00");
        @Positive
        private int volumeLookbackDays = 7;
    }

    @Getter
    @Setter
    public static class Integrity {
        @Positive
        private int windowMinutes = 30;
        @Positive
        private int duplicateWindowMinutes = 5;
    }
}
