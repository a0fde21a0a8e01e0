package com.eainde.forecast.extraction;

import java.util.List;

/**
 * Metrics the extractors know about, with the labels they appear under in Indian filings.
 */
public enum MetricDefinition {

    TOTAL_REVENUE("total_revenue", "INR_Cr", Kind.MONEY, "total revenue",
            List.of("revenue from operations", "revenue", "total income", "net revenue", "net sales",
                    "sales", "income from operations", "consolidated revenue")),
    NET_PROFIT("net_profit", "INR_Cr", Kind.MONEY, "net profit",
            List.of("profit after tax", "pat", "net income", "profit for the period", "net profit after tax",
                    "consolidated net profit")),
    OPERATING_PROFIT("operating_profit", "INR_Cr", Kind.MONEY, "operating profit",
            List.of("ebit", "operating income", "profit from operations")),
    EBITDA("ebitda", "INR_Cr", Kind.MONEY, "ebitda",
            List.of("earnings before interest tax depreciation and amortisation",
                    "earnings before interest tax depreciation and amortization")),
    EPS("eps", "INR", Kind.PER_SHARE, "eps",
            List.of("earnings per share", "diluted eps", "basic eps")),
    OPERATING_MARGIN("operating_margin", "%", Kind.PERCENT, "operating margin",
            List.of("ebit margin", "operating profit margin")),
    NET_PROFIT_MARGIN("net_profit_margin", "%", Kind.PERCENT, "net profit margin",
            List.of("net margin", "pat margin", "profit margin")),
    ROE("roe", "%", Kind.PERCENT, "return on equity",
            List.of("roe")),
    FREE_CASH_FLOW("free_cash_flow", "INR_Cr", Kind.MONEY, "free cash flow",
            List.of("fcf")),
    DEBT_TO_EQUITY("debt_to_equity", "ratio", Kind.RATIO, "debt to equity",
            List.of("debt to equity ratio", "debt equity ratio", "debt equity", "d e"));

    public enum Kind {
        MONEY,
        PER_SHARE,
        PERCENT,
        RATIO
    }

    private final String metricName;
    private final String unit;
    private final Kind kind;
    private final String canonicalLabel;
    private final List<String> aliases;

    MetricDefinition(String metricName, String unit, Kind kind, String canonicalLabel, List<String> aliases) {
        this.metricName = metricName;
        this.unit = unit;
        this.kind = kind;
        this.canonicalLabel = canonicalLabel;
        this.aliases = aliases;
    }

    public String metricName() {
        return metricName;
    }

    public String unit() {
        return unit;
    }

    public Kind kind() {
        return kind;
    }

    public String canonicalLabel() {
        return canonicalLabel;
    }

    public List<String> aliases() {
        return aliases;
    }

    public boolean isPercentage() {
        return kind == Kind.PERCENT;
    }

    public static MetricDefinition byName(String metricName) {
        for (MetricDefinition d : values()) {
            if (d.metricName.equals(metricName)) {
                return d;
            }
        }
        return null;
    }
}
