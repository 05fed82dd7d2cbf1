package com.example.AusFin.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Currency rendering shared by prompt building and answer post-processing.
 * Amounts are written as {@code $<digits>.<cents>} without grouping separators.
 */
public final class AmountFormatter {

    private AmountFormatter() {
    }

    private static final Pattern DOLLAR_AMOUNT = Pattern.compile(
            "\\$\\s?(\\d{1,3}(?:,\\d{3})+|\\d+)(\\.\\d+)?(?![\\d,]*\\d)"
                    + "(\\s?(?i:k|m|bn|b|thousand|million|billion)\\b)?"
    );

    private static final int CENTS_DIGITS = 2;

    public static String currency(BigDecimal amount) {
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    public static String percent(BigDecimal fraction) {
        return fraction.movePointRight(2).setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
    }

    public static String normaliseCurrency(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher matcher = DOLLAR_AMOUNT.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String fraction = matcher.group(2) == null ? "" : matcher.group(2);
            // "$1.5m" and "$3.456" are left as written; rounding them would change the figure
            if (matcher.group(3) != null || fraction.length() - 1 > CENTS_DIGITS) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            String digits = matcher.group(1).replace(",", "");
            BigDecimal amount = new BigDecimal(digits + fraction);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(currency(amount)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * True when the figure appears in the text either with cents ("18000.00") or,
     * for whole amounts, without them ("18000").
     */
    public static boolean mentions(String text, BigDecimal figure) {
        if (text == null || figure == null) {
            return false;
        }
        String plain = figure.setScale(2, RoundingMode.HALF_UP).toPlainString();
        if (text.contains(plain)) {
            return true;
        }
        BigDecimal stripped = figure.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return Pattern.compile("(?<![\\d.])" + Pattern.quote(stripped.toPlainString()) + "(?![\\d,])")
                    .matcher(text.replace(",", ""))
                    .find();
        }
        return false;
    }
}
