/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.geom;

import java.math.BigDecimal;

/**
 * Number formatting shared by style values and geometry attributes.
 * Integral values are written without a fractional part ({@code 120}, not
 * {@code 120.0}), as draw.io does.  Negative zero is kept as {@code -0}.
 */
public final class Numbers {

    private Numbers() {/* no instances */}

    public static String format(double value) {
        if (!Double.isFinite(value))
            throw new IllegalArgumentException("Not a finite number: " + value);

        if (value == 0) {
            return Double.doubleToRawLongBits(value) == 0 ? "0" : "-0";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * @param   text  the literal to parse
     * @return  the parsed value
     * @throws  NumberFormatException  if the literal is not a finite number
     */
    public static double parse(String text) {
        double value = Double.parseDouble(text.trim());
        if (!Double.isFinite(value))
            throw new NumberFormatException("Not a finite number: " + text);

        return value;
    }

    static double requireFinite(double value, String name) {
        if (!Double.isFinite(value))
            throw new IllegalArgumentException(name + " is not finite: " + value);

        return value;
    }

}
