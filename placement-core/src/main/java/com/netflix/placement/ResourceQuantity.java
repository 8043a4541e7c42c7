/*
 * Copyright 2015 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.placement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses resource quantities written in the Kubernetes quantity notation into exact milli-units.
 * <p>
 * A quantity is a non-negative decimal number followed by an optional suffix: a decimal SI suffix
 * ({@code n, u, m, k, M, G, T, P, E}), a binary SI suffix ({@code Ki, Mi, Gi, Ti, Pi, Ei}) or a decimal
 * exponent ({@code e3}, {@code E-2}). So {@code "500m"} CPU is {@code 500} milli-cores, {@code "2"} CPU is
 * {@code 2000} and {@code "1Ki"} of memory is {@code 1024000} milli-bytes. Values finer than one milli-unit
 * are rounded up.
 * <p>
 * The result must fit in a {@code long}, which bounds a quantity at about 9.2 quadrillion whole units. For
 * memory that is a little over 8 PiB ({@code "8Pi"} parses, {@code "9Pi"} does not); larger quantities are
 * rejected with a {@link ResourceQuantityException}.
 */
public final class ResourceQuantity {

    private static final Pattern QUANTITY_PATTERN =
            Pattern.compile("^([+-]?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+))([eE][+-]?[0-9]+|[a-zA-Z]*)$");
    private static final Pattern EXPONENT_PATTERN = Pattern.compile("^[eE][+-]?[0-9]+$");
    private static final BigDecimal MILLIS = BigDecimal.valueOf(1000L);
    private static final Map<String, BigDecimal> suffixMultipliers = new HashMap<>();

    static {
        suffixMultipliers.put("", BigDecimal.ONE);
        suffixMultipliers.put("n", BigDecimal.ONE.scaleByPowerOfTen(-9));
        suffixMultipliers.put("u", BigDecimal.ONE.scaleByPowerOfTen(-6));
        suffixMultipliers.put("m", BigDecimal.ONE.scaleByPowerOfTen(-3));
        suffixMultipliers.put("k", BigDecimal.ONE.scaleByPowerOfTen(3));
        suffixMultipliers.put("M", BigDecimal.ONE.scaleByPowerOfTen(6));
        suffixMultipliers.put("G", BigDecimal.ONE.scaleByPowerOfTen(9));
        suffixMultipliers.put("T", BigDecimal.ONE.scaleByPowerOfTen(12));
        suffixMultipliers.put("P", BigDecimal.ONE.scaleByPowerOfTen(15));
        suffixMultipliers.put("E", BigDecimal.ONE.scaleByPowerOfTen(18));
        suffixMultipliers.put("Ki", BigDecimal.valueOf(2L).pow(10));
        suffixMultipliers.put("Mi", BigDecimal.valueOf(2L).pow(20));
        suffixMultipliers.put("Gi", BigDecimal.valueOf(2L).pow(30));
        suffixMultipliers.put("Ti", BigDecimal.valueOf(2L).pow(40));
        suffixMultipliers.put("Pi", BigDecimal.valueOf(2L).pow(50));
        suffixMultipliers.put("Ei", BigDecimal.valueOf(2L).pow(60));
    }

    private ResourceQuantity() {
    }

    /**
     * Parse the given quantity into milli-units.
     *
     * @param quantity the quantity string, for example {@code "250m"} or {@code "1Gi"}
     * @return the quantity in milli-units
     * @throws ResourceQuantityException if the quantity is missing, malformed, negative, or does not fit in a
     *         {@code long} once expressed in milli-units
     */
    public static long parseMillis(String quantity) throws ResourceQuantityException {
        if (quantity == null)
            throw new ResourceQuantityException(null, "quantity is missing");
        final String trimmed = quantity.trim();
        final Matcher matcher = QUANTITY_PATTERN.matcher(trimmed);
        if (!matcher.matches())
            throw new ResourceQuantityException(quantity, "not a quantity");
        final BigDecimal number = new BigDecimal(matcher.group(1));
        if (number.signum() < 0)
            throw new ResourceQuantityException(quantity, "quantity must not be negative");
        final BigDecimal value;
        try {
            value = number.multiply(multiplierOf(quantity, matcher.group(2)));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ResourceQuantityException(quantity, "exponent out of range", e);
        }
        try {
            return value.multiply(MILLIS).setScale(0, RoundingMode.CEILING).longValueExact();
        } catch (ArithmeticException e) {
            throw new ResourceQuantityException(quantity, "quantity too large", e);
        }
    }

    private static BigDecimal multiplierOf(String quantity, String suffix) throws ResourceQuantityException {
        if (EXPONENT_PATTERN.matcher(suffix).matches()) {
            return BigDecimal.ONE.scaleByPowerOfTen(Integer.parseInt(suffix.substring(1)));
        }
        final BigDecimal multiplier = suffixMultipliers.get(suffix);
        if (multiplier == null)
            throw new ResourceQuantityException(quantity, "unknown suffix '" + suffix + "'");
        return multiplier;
    }
}
