package com.eainde.forecast.synthesis;

import com.eainde.forecast.model.Citation;
import com.eainde.forecast.model.CitationType;
import com.eainde.forecast.model.ForecastJson;
import com.eainde.forecast.model.ForecastResult;
import com.eainde.forecast.model.QualitativeInsight;
import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.ValidationMessage;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks an assembled forecast before it leaves the run.
 *
 * <ol>
 *   <li>JSON Schema ({@value #RESULT_SCHEMA})</li>
 *   <li>confidence and sentiment ranges</li>
 *   <li>citations: every metric and key theme cited by a document that backs it</li>
 *   <li>every theme the model named matches an extracted insight</li>
 * </ol>
 */
@Log4j2
public class ForecastValidator {

    public static final String RESULT_SCHEMA = "schema/forecast-result.schema.json";

    private final JsonSchema schema;

    public ForecastValidator() {
        this.schema = SynthesisResponseParser.loadSchema(RESULT_SCHEMA);
    }

    public ValidationReport validate(ForecastResult result, ForecastNarrative narrative, List<QualitativeInsight> insights) {
        List<String> issues = new ArrayList<>();
        List<String> anomalies = new ArrayList<>();

        JsonNode node = ForecastJson.mapper().valueToTree(result);
        for (ValidationMessage message : schema.validate(node)) {
            issues.add("schema: " + message.getMessage());
        }

        checkRanges(result, issues);
        checkCitations(result, issues);
        checkModelThemes(narrative, insights, issues);

        for (Citation c : result.evidence()) {
            if (c.type() == CitationType.ANOMALY) {
                anomalies.add(c.subject() + ": " + c.detail());
            }
        }

        if (!issues.isEmpty()) {
            log.warn("Run {} forecast failed validation with {} issue(s)", result.runId(), issues.size());
        }
        return new ValidationReport(issues, anomalies);
    }

    private static void checkRanges(ForecastResult result, List<String> issues) {
        for (Map.Entry<String, ForecastResult.MetricValue> e : result.metrics().entrySet()) {
            double c = e.getValue().confidence();
            if (!(c >= 0.0 && c <= 1.0)) {
                issues.add("metric " + e.getKey() + " confidence " + c + " outside [0,1]");
            }
        }
        ForecastResult.ConfidenceScores scores = result.confidenceScores();
        if (!(scores.metrics() >= 0.0 && scores.metrics() <= 1.0)) {
            issues.add("metrics confidence " + scores.metrics() + " outside [0,1]");
        }
        if (!(scores.analysis() >= 0.0 && scores.analysis() <= 1.0)) {
            issues.add("analysis confidence " + scores.analysis() + " outside [0,1]");
        }
        double sentiment = result.qualitative().sentiment().score();
        if (!(sentiment >= -1.0 && sentiment <= 1.0)) {
            issues.add("sentiment score " + sentiment + " outside [-1,1]");
        }
    }

    private static void checkCitations(ForecastResult result, List<String> issues) {
        Set<String> citedMetrics = new HashSet<>();
        Set<String> citedThemes = new HashSet<>();
        for (Citation c : result.evidence()) {
            if (c.sourceDocumentId() == null || c.sourceDocumentId().isBlank()) {
                issues.add(c.type() + " citation for '" + c.subject() + "' has no source document");
                continue;
            }
            if (c.type() == CitationType.METRIC) {
                citedMetrics.add(c.subject() + "|" + c.sourceDocumentId());
            } else if (c.type() == CitationType.THEME) {
                citedThemes.add(c.subject());
            }
        }
        for (Map.Entry<String, ForecastResult.MetricValue> e : result.metrics().entrySet()) {
            if (!citedMetrics.contains(e.getKey() + "|" + e.getValue().sourceDocumentId())) {
                issues.add("metric " + e.getKey() + " is not cited");
            }
        }
        for (String theme : result.qualitative().keyThemes()) {
            if (!citedThemes.contains(theme)) {
                issues.add("theme '" + theme + "' is not cited");
            }
        }
    }

    private static void checkModelThemes(ForecastNarrative narrative, List<QualitativeInsight> insights,
                                         List<String> issues) {
        if (narrative == null) {
            return;
        }
        for (String named : narrative.keyThemes()) {
            if (!backedByInsight(named, insights)) {
                issues.add("model theme '" + named + "' is not backed by any transcript insight");
            }
        }
    }

    static boolean backedByInsight(String named, List<QualitativeInsight> insights) {
        String lower = named.toLowerCase(Locale.ROOT).strip();
        for (QualitativeInsight i : insights) {
            String theme = i.theme().toLowerCase(Locale.ROOT);
            if (lower.equals(theme)
                    || Pattern.compile("(?<![a-z])" + Pattern.quote(theme) + "(?![a-z])").matcher(lower).find()) {
                return true;
            }
        }
        return false;
    }
}
