package com.eainde.forecast.extraction;

import com.eainde.forecast.extraction.ParsedNumber.Scale;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Indian-format financial numbers: {@code ₹ 64,259 Cr}, {@code Rs. 1,23,456},
 * {@code INR 7.6 billion}, {@code 24.1%}, {@code (1,234)}.
 */
public final class FinancialNumberParser {

    private static final String NUMBER = "\\d{1,3}(?:,\\d{2,3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?";
    private static final String SCALE = "crores?|cr\\.?(?![a-z])|lakhs?|lacs?|million|mn(?![a-z])|billion|bn(?![a-z])";

    private static final Pattern TOKEN = Pattern.compile(
            "(?i)(?<![a-z0-9.,\\-/'])(?<cur>₹|rs\\.?|inr)?\\s*(?<neg>-)?(?<num>" + NUMBER + ")(?![0-9])"
                    + "(?:\\s*(?<pct>%|per\\s?cent)|\\s*(?<scale>" + SCALE + "))?");

    private static final Pattern CELL = Pattern.compile(
            "(?i)^\\s*(?<open>\\()?\\s*(?<cur>₹|rs\\.?|inr)?\\s*(?<neg>-)?(?<num>" + NUMBER + ")\\s*"
                    + "(?:(?<pct>%|per\\s?cent)|(?<scale>" + SCALE + "))?\\s*(?<close>\\))?\\s*[x×]?\\s*$");

    private static final Pattern SCALE_WORD = Pattern.compile("(?i)(?<![a-z])(" + SCALE + ")");

    private FinancialNumberParser() {
    }

    /**
     * Every number token in {@code text}, skipping numbers glued to letters (Q2, FY2025)
     * and bare calendar years.
     */
    public static List<ParsedNumber> findAll(String text) {
        List<ParsedNumber> out = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return out;
        }
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            ParsedNumber n = toNumber(m);
            if (n != null && !isBareYear(m, n)) {
                out.add(n);
            }
        }
        return out;
    }

    /**
     * Parses a table cell that holds exactly one number. Parenthesised values are negative.
     */
    public static Optional<ParsedNumber> parseCell(String cell) {
        if (cell == null || cell.isBlank()) {
            return Optional.empty();
        }
        Matcher m = CELL.matcher(cell);
        if (!m.matches()) {
            return Optional.empty();
        }
        boolean parenthesised = m.group("open") != null && m.group("close") != null;
        if ((m.group("open") != null) != (m.group("close") != null)) {
            return Optional.empty();
        }
        ParsedNumber n = toNumber(m);
        if (n == null) {
            return Optional.empty();
        }
        return Optional.of(parenthesised ? negate(n) : n);
    }

    /**
     * First number in {@code text}, or empty.
     */
    public static Optional<Double> parseInrNumber(String text) {
        List<ParsedNumber> all = findAll(text);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0).value());
    }

    /**
     * Scale word mentioned in a label such as {@code Revenue (₹ million)}.
     */
    public static Scale scaleIn(String label) {
        if (label == null) {
            return Scale.NONE;
        }
        Matcher m = SCALE_WORD.matcher(label);
        return m.find() ? scaleOf(m.group(1)) : Scale.NONE;
    }

    static Scale scaleOf(String word) {
        if (word == null) {
            return Scale.NONE;
        }
        String w = word.toLowerCase(Locale.ROOT);
        if (w.startsWith("cr")) return Scale.CRORE;
        if (w.startsWith("lakh") || w.startsWith("lac")) return Scale.LAKH;
        if (w.startsWith("million") || w.equals("mn")) return Scale.MILLION;
        if (w.startsWith("billion") || w.equals("bn")) return Scale.BILLION;
        return Scale.NONE;
    }

    private static ParsedNumber toNumber(Matcher m) {
        double value;
        try {
            value = Double.parseDouble(m.group("num").replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
        if (m.group("neg") != null) {
            value = -value;
        }
        return new ParsedNumber(value, scaleOf(m.group("scale")), m.group("pct") != null,
                m.group("cur") != null, m.start(), m.end());
    }

    private static ParsedNumber negate(ParsedNumber n) {
        return new ParsedNumber(-n.value(), n.scale(), n.percent(), n.currency(), n.start(), n.end());
    }

    private static boolean isBareYear(Matcher m, ParsedNumber n) {
        String raw = m.group("num");
        return !n.currency() && !n.percent() && n.scale() == Scale.NONE
                && raw.length() == 4 && raw.indexOf(',') < 0
                && n.value() >= 1990 && n.value() <= 2100;
    }
}
