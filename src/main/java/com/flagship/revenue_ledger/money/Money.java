package com.flagship.revenue_ledger.money;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.revenue_ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fixed-precision monetary amount in Bangladeshi Taka (BDT).
 *
 * Key properties:
 * - Always scale 2, rounded HALF_UP
 * - Every arithmetic result is routed back through {@link #round(BigDecimal)},
 *   so repeated postings never accumulate sub-paisa drift
 * - May be negative (balances, differences); postings use positive amounts only
 * - Serialized to JSON as a plain decimal number
 */
public final class Money implements Comparable<Money> {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final String CURRENCY_CODE = "BDT";
    public static final String CURRENCY_SYMBOL = "৳";

    public static final Money ZERO = new Money(BigDecimal.ZERO.setScale(SCALE));
    public static final Money DEFAULT_TOLERANCE = new Money(new BigDecimal("0.01"));

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");
    private static final Pattern DECORATION = Pattern.compile("(?i)BDT|TK|[৳$,_\\s]");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount;
    }

    @JsonCreator
    public static Money of(BigDecimal value) {
        return round(value);
    }

    public static Money of(String value) {
        if (value == null) {
            throw new ValidationException("Amount is required");
        }
        try {
            return round(new BigDecimal(value.trim()));
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid amount: '" + value + "'");
        }
    }

    public static Money of(long units) {
        return round(BigDecimal.valueOf(units));
    }

    /**
     * Rounds an arbitrary decimal to two places, HALF_UP.
     */
    public static Money round(BigDecimal value) {
        if (value == null) {
            throw new ValidationException("Amount is required");
        }
        return new Money(value.setScale(SCALE, ROUNDING));
    }

    /**
     * Parses user or upstream text such as {@code "৳1,234.50"}, {@code "BDT 900"} or
     * {@code "-৳50.00"}. Currency markers, thousands separators and whitespace are
     * stripped; anything else that is not a decimal number is rejected.
     *
     * @throws ValidationException if the remainder is not numeric
     */
    public static Money parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Amount text is empty");
        }
        String cleaned = DECORATION.matcher(text).replaceAll("");
        if (!DECIMAL.matcher(cleaned).matches()) {
            throw new ValidationException("Not a monetary amount: '" + text + "'");
        }
        return round(new BigDecimal(cleaned));
    }

    /**
     * Formats as {@code ৳1,234.50}; negative amounts are prefixed with a minus sign.
     */
    public String format() {
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.ROOT));
        format.setRoundingMode(ROUNDING);
        String digits = format.format(amount.abs());
        return (isNegative() ? "-" : "") + CURRENCY_SYMBOL + digits;
    }

    public Money add(Money other) {
        return round(amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return round(amount.subtract(other.amount));
    }

    public Money multiply(BigDecimal factor) {
        return round(amount.multiply(factor));
    }

    /**
     * Returns {@code percent}% of this amount, e.g. {@code of(1000).percentageOf(5) == 50.00}.
     */
    public Money percentageOf(BigDecimal percent) {
        return round(amount.multiply(percent).divide(HUNDRED, SCALE + 4, ROUNDING));
    }

    public Money negate() {
        return new Money(amount.negate());
    }

    public Money abs() {
        return isNegative() ? negate() : this;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    public boolean equalsWithinTolerance(Money other) {
        return equalsWithinTolerance(this, other, DEFAULT_TOLERANCE);
    }

    public static boolean equalsWithinTolerance(Money a, Money b) {
        return equalsWithinTolerance(a, b, DEFAULT_TOLERANCE);
    }

    /**
     * Balance comparison used everywhere two amounts are checked against each other.
     */
    public static boolean equalsWithinTolerance(Money a, Money b, Money tolerance) {
        return a.subtract(b).abs().compareTo(tolerance) <= 0;
    }

    @JsonValue
    public BigDecimal toBigDecimal() {
        return amount;
    }

    @Override
    public int compareTo(Money other) {
        return amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money)) {
            return false;
        }
        return amount.equals(((Money) o).amount);
    }

    @Override
    public int hashCode() {
        return amount.hashCode();
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
