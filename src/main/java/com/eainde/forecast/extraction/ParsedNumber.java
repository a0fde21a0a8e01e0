package com.eainde.forecast.extraction;

/**
 * A number found in document text, with the unit markers around it.
 *
 * @param value    numeric value as written, commas removed
 * @param scale    scale word following the number, {@link Scale#NONE} when absent
 * @param percent  followed by {@code %} or "per cent"
 * @param currency preceded by a rupee marker
 * @param start    offset of the match in the searched text
 * @param end      end offset of the match
 */
public record ParsedNumber(double value, Scale scale, boolean percent, boolean currency, int start, int end) {

    public enum Scale {
        NONE(1.0),
        CRORE(1.0),
        LAKH(0.01),
        MILLION(0.1),
        BILLION(100.0);

        private final double toCrore;

        Scale(double toCrore) {
            this.toCrore = toCrore;
        }

        public double toCrore() {
            return toCrore;
        }
    }

    /**
     * Value expressed in crore. Unscaled numbers are taken to be crore already.
     */
    public double inCrore() {
        return value * scale.toCrore();
    }

    public ParsedNumber withScale(Scale newScale) {
        return new ParsedNumber(value, newScale, percent, currency, start, end);
    }
}
