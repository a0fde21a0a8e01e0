package com.eainde.forecast.model;

/**
 * Non-fatal hole in the gathered data. Recorded on the run, surfaced in the forecast evidence.
 *
 * @param stage   where the gap occurred
 * @param subject document id, or source id for fetch gaps
 * @param reason  short description, never a prompt or credential
 */
public record ExtractionGap(Stage stage, String subject, String reason) {

    public enum Stage {
        FETCH,
        GATHERING,
        EXTRACTION,
        ANALYSIS
    }
}
