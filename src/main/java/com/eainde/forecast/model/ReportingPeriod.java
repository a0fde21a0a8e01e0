package com.eainde.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fiscal reporting period (Indian fiscal year convention: FY2025 runs April 2024 to March 2025).
 *
 * <p>Later periods compare greater. {@link #UNKNOWN} sorts before every known period.</p>
 *
 * @param fiscalYear four-digit fiscal year, 0 when unknown
 * @param quarter    1-4, 0 when unknown
 */
public record ReportingPeriod(int fiscalYear, int quarter) implements Comparable<ReportingPeriod> {

    public static final ReportingPeriod UNKNOWN = new ReportingPeriod(0, 0);

    private static final Pattern QUARTER = Pattern.compile("(?i)(?<![a-z])(?:q|quarter\\s*)([1-4])(?!\\d)");
    private static final Pattern SPLIT_YEAR = Pattern.compile("(?<!\\d)(20\\d{2})\\s*[-_/]\\s*(\\d{2})(?!\\d)");
    private static final Pattern FISCAL_YEAR = Pattern.compile("(?i)(?<![a-z])fy\\s*'?(\\d{4}|\\d{2})(?!\\d)");
    private static final Pattern PLAIN_YEAR = Pattern.compile("(?<!\\d)(20\\d{2})(?!\\d)");

    private static final Comparator<ReportingPeriod> ORDER = Comparator
            .comparingInt(ReportingPeriod::fiscalYear)
            .thenComparingInt(ReportingPeriod::quarter);

    public ReportingPeriod {
        if (quarter < 0 || quarter > 4) {
            throw new IllegalArgumentException("quarter must be within 0..4: " + quarter);
        }
    }

    public static ReportingPeriod of(int fiscalYear, int quarter) {
        return new ReportingPeriod(fiscalYear, quarter);
    }

    /**
     * Parses labels such as {@code Q2 FY2025}, {@code TCS_Q2_FY25}, {@code Q3 2023-24}
     * or {@code quarter 1 2024}. Returns {@link #UNKNOWN} when no quarter or year is found.
     */
    public static ReportingPeriod parse(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        Matcher q = QUARTER.matcher(label);
        if (!q.find()) {
            return UNKNOWN;
        }
        int quarter = Integer.parseInt(q.group(1));
        int year = parseFiscalYear(label);
        if (year == 0) {
            return UNKNOWN;
        }
        return new ReportingPeriod(year, quarter);
    }

    private static int parseFiscalYear(String label) {
        Matcher split = SPLIT_YEAR.matcher(label);
        while (split.find()) {
            int first = Integer.parseInt(split.group(1));
            int second = Integer.parseInt(split.group(2));
            // 2023-24 style: second part must be the year after the first
            if ((first + 1) % 100 == second) {
                return first + 1;
            }
        }
        Matcher fy = FISCAL_YEAR.matcher(label);
        if (fy.find()) {
            int value = Integer.parseInt(fy.group(1));
            return value < 100 ? 2000 + value : value;
        }
        Matcher plain = PLAIN_YEAR.matcher(label);
        if (plain.find()) {
            return Integer.parseInt(plain.group(1));
        }
        return 0;
    }

    @JsonIgnore
    public boolean isKnown() {
        return fiscalYear > 0 && quarter > 0;
    }

    @JsonValue
    public String label() {
        return isKnown() ? "Q" + quarter + " FY" + fiscalYear : "UNKNOWN";
    }

    @Override
    public int compareTo(ReportingPeriod other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return label();
    }
}
