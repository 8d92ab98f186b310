package com.flagship.revenue_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core ledger beans.
 *
 * The {@link Clock} is the only time source used by the ledger, so tests can pin
 * "now" and reconciliation windows deterministically.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock ledgerClock(LedgerProperties properties) {
        return Clock.system(properties.getZone());
    }
}
