package com.eainde.forecast.synthesis;

import com.eainde.forecast.model.ExtractedMetric;
import com.eainde.forecast.model.ExtractionGap;
import com.eainde.forecast.model.QualitativeInsight;
import dev.langchain4j.model.input.PromptTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds synthesis prompts from the templates under {@code prompts/}.
 *
 * <p>{@link PromptTemplate} substitutes variables one at a time, so inserted values have their
 * {@code {{} neutralised first; a quote or echoed reply can never expand another variable.</p>
 */
public class SynthesisPromptBuilder {

    static final int MAX_ECHO = 4000;

    private final PromptTemplate synthesis;
    private final PromptTemplate recovery;
    private final MetricReconciler reconciler;

    public SynthesisPromptBuilder() {
        this.synthesis = PromptTemplate.from(load("prompts/synthesis.txt"));
        this.recovery = PromptTemplate.from(load("prompts/synthesis-recovery.txt"));
        this.reconciler = new MetricReconciler();
    }

    public String synthesisPrompt(String ticker, int quarters, List<ExtractedMetric> metrics,
                                  List<QualitativeInsight> insights, List<ExtractionGap> gaps,
                                  List<String> validationFeedback) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("ticker", inert(ticker));
        vars.put("quarters", quarters);
        vars.put("metrics", inert(metricLines(metrics)));
        vars.put("themes", inert(themeLines(insights)));
        vars.put("gaps", inert(gapLines(gaps)));
        vars.put("feedback", inert(feedback(validationFeedback)));
        return synthesis.apply(vars).text();
    }

    /**
     * Re-issues {@code originalPrompt} followed by the unusable output, truncated to
     * {@value #MAX_ECHO} characters, and the reason it was rejected. The backend is stateless,
     * so the original prompt has to travel with every re-prompt.
     */
    public String recoveryPrompt(String originalPrompt, String previousOutput, String error) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("request", inert(originalPrompt == null ? "" : originalPrompt.strip()));
        vars.put("previous", inert(truncate(previousOutput == null ? "" : previousOutput)));
        vars.put("error", inert(error == null ? "unknown format error" : error));
        return recovery.apply(vars).text();
    }

    private String metricLines(List<ExtractedMetric> metrics) {
        if (metrics.isEmpty()) {
            return "- none";
        }
        StringBuilder sb = new StringBuilder();
        for (ExtractedMetric m : reconciler.reconcile(metrics).values()) {
            sb.append("- ").append(m.name()).append(": ")
                    .append(String.format(Locale.ROOT, "%.2f", m.value())).append(' ').append(m.unit())
                    .append(" (").append(m.period().label())
                    .append(", confidence ").append(String.format(Locale.ROOT, "%.2f", m.confidence()))
                    .append(")\n");
        }
        return sb.toString().stripTrailing();
    }

    private static String themeLines(List<QualitativeInsight> insights) {
        if (insights.isEmpty()) {
            return "- none";
        }
        StringBuilder sb = new StringBuilder();
        for (QualitativeInsight i : insights) {
            sb.append("- ").append(i.theme())
                    .append(" | ").append(String.format(Locale.ROOT, "%.2f", i.sentiment()))
                    .append(" | ").append(String.format(Locale.ROOT, "%.2f", i.confidence()))
                    .append(" | \"").append(i.supportingQuote()).append("\"\n");
        }
        return sb.toString().stripTrailing();
    }

    private static String gapLines(List<ExtractionGap> gaps) {
        if (gaps.isEmpty()) {
            return "- none";
        }
        StringBuilder sb = new StringBuilder();
        for (ExtractionGap g : gaps) {
            sb.append("- ").append(g.stage()).append(' ').append(g.subject()).append(": ").append(g.reason()).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static String feedback(List<String> issues) {
        if (issues == null || issues.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\nYour previous answer was rejected for these reasons; fix them:\n");
        for (String issue : issues) {
            sb.append("- ").append(issue).append('\n');
        }
        return sb.toString();
    }

    static String inert(String value) {
        return value == null ? "" : value.replace("{{", "{ {");
    }

    static String truncate(String text) {
        return text.length() <= MAX_ECHO ? text : text.substring(0, MAX_ECHO);
    }

    private static String load(String resource) {
        try (InputStream in = SynthesisPromptBuilder.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Prompt template not found: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt template " + resource, e);
        }
    }
}
