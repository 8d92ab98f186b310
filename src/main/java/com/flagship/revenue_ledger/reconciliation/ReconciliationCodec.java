package com.flagship.revenue_ledger.reconciliation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.revenue_ledger.money.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The single place where reconciliation maps and discrepancy lists are turned
 * into text columns and back. Balance maps are written with sorted keys, so equal
 * content always produces equal text.
 */
@Component
public class ReconciliationCodec {

    private static final TypeReference<LinkedHashMap<String, BigDecimal>> BALANCES_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<DiscrepancyRow>> DISCREPANCIES_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ReconciliationCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encodeBalances(Map<String, Money> balances) {
        Map<String, BigDecimal> plain = new TreeMap<>();
        balances.forEach((account, amount) -> plain.put(account, amount.toBigDecimal()));
        return write(plain);
    }

    public Map<String, Money> decodeBalances(String json) {
        Map<String, Money> balances = new TreeMap<>();
        read(json, BALANCES_TYPE).forEach((account, amount) -> balances.put(account, Money.of(amount)));
        return balances;
    }

    public String encodeDiscrepancies(List<Discrepancy> discrepancies) {
        return write(discrepancies.stream()
                .map(d -> new DiscrepancyRow(d.getAccountKey(), d.getExpectedAmount().toBigDecimal(),
                        d.getActualAmount().toBigDecimal(), d.getDifferenceAmount().toBigDecimal(),
                        d.getSeverity().name()))
                .toList());
    }

    public List<Discrepancy> decodeDiscrepancies(String json) {
        return read(json, DISCREPANCIES_TYPE).stream()
                .map(row -> new Discrepancy(row.account(), Money.of(row.expected()), Money.of(row.actual()),
                        Money.of(row.difference()), DiscrepancySeverity.valueOf(row.severity())))
                .toList();
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode reconciliation data", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt reconciliation column: " + e.getMessage(), e);
        }
    }

    /**
     * Storage shape of one discrepancy.
     */
    private record DiscrepancyRow(String account, BigDecimal expected, BigDecimal actual,
                                  BigDecimal difference, String severity) {}
}
