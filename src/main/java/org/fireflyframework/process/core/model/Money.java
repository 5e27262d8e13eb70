/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.process.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Non-negative exact decimal amount with an ISO-4217 style currency code.
 *
 * <p>Equality compares amounts numerically, so {@code 1.5 USD} equals {@code 1.50 USD}.
 */
public record Money(BigDecimal amount, String currency) {

    public static final String DEFAULT_CURRENCY = "USD";
    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");

    public Money {
        Objects.requireNonNull(amount, "amount");
        currency = currency == null ? DEFAULT_CURRENCY : currency;
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Money amount must not be negative, got: " + amount);
        }
        if (!CURRENCY.matcher(currency).matches()) {
            throw new IllegalArgumentException("Currency must be a 3-letter uppercase code, got: " + currency);
        }
    }

    public static Money zero() {
        return new Money(BigDecimal.ZERO, DEFAULT_CURRENCY);
    }

    public static Money zero(String currency) {
        return new Money(BigDecimal.ZERO, currency);
    }

    public static Money of(String amount) {
        return new Money(new BigDecimal(amount), DEFAULT_CURRENCY);
    }

    public static Money of(BigDecimal amount, String currency) {
        return new Money(amount, currency);
    }

    /**
     * Parses {@code "1.50"}, {@code "$1.50"} or {@code "1.50 EUR"}.
     */
    public static Money fromString(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        String currency = DEFAULT_CURRENCY;
        int space = trimmed.indexOf(' ');
        if (space > 0) {
            currency = trimmed.substring(space + 1).trim();
            trimmed = trimmed.substring(0, space);
        }
        if (trimmed.startsWith("$")) {
            trimmed = trimmed.substring(1);
        }
        try {
            return new Money(new BigDecimal(trimmed), currency);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid money value: '" + text + "'", e);
        }
    }

    public static Money sum(Collection<Money> values, String currency) {
        Money total = zero(currency);
        for (Money value : values) {
            total = total.add(value);
        }
        return total;
    }

    public Money add(Money other) {
        Objects.requireNonNull(other, "other");
        if (!currency.equals(other.currency)) {
            throw new IllegalArgumentException("Cannot add " + other.currency + " to " + currency);
        }
        return new Money(amount.add(other.amount), currency);
    }

    @JsonIgnore
    public boolean isZero() {
        return amount.signum() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Money other)) return false;
        return currency.equals(other.currency) && amount.compareTo(other.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros(), currency);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
