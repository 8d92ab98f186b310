package com.flagship.revenue_ledger.distribution;

import com.flagship.revenue_ledger.config.LedgerProperties;
import com.flagship.revenue_ledger.exception.ConfigurationException;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Rates from {@code ledger.distribution.rates}, falling back to the platform default.
 *
 * A scope-specific rate outside [0, max rate] is a configuration error. It is
 * logged as a warning and the default rate is used instead, so distribution
 * carries on. An invalid default rate fails startup.
 */
@Component
@Slf4j
public class ConfiguredServiceChargeRateProvider implements ServiceChargeRateProvider {

    private final LedgerProperties.Distribution config;
    private final LedgerMetrics metrics;

    public ConfiguredServiceChargeRateProvider(LedgerProperties properties, LedgerMetrics metrics) {
        this.config = properties.getDistribution();
        this.metrics = metrics;
        validate(config.getDefaultRate(), "default");
    }

    @Override
    public BigDecimal rateFor(String payeeScopeId) {
        BigDecimal configured = payeeScopeId != null ? config.getRates().get(payeeScopeId) : null;
        if (configured == null) {
            return config.getDefaultRate();
        }

        try {
            validate(configured, payeeScopeId);
            return configured;
        } catch (ConfigurationException e) {
            metrics.recordConfigFallback();
            log.warn("{}; using default rate {}", e.getMessage(), config.getDefaultRate());
            return config.getDefaultRate();
        }
    }

    private void validate(BigDecimal rate, String source) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(config.getMaxRate()) > 0) {
            throw new ConfigurationException(String.format(
                "Service charge rate %s for %s is outside [0, %s]", rate, source, config.getMaxRate()));
        }
    }
}
