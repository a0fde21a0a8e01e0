package com.eainde.forecast.graph.nodes;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.error.ErrorKind;
import com.eainde.forecast.error.ForecastException;
import com.eainde.forecast.fetch.DocumentFetcher;
import com.eainde.forecast.graph.ForecastState;
import com.eainde.forecast.model.DocumentKind;
import com.eainde.forecast.model.ExtractionGap;
import com.eainde.forecast.model.RunRequest;
import com.eainde.forecast.model.RunState;
import com.eainde.forecast.model.SourceDocument;
import com.eainde.forecast.model.TraceEntryType;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fetches reports and transcripts from every source in parallel.
 *
 * <p>Keeps the {@code quarterCount} most recent reports and the {@code max(1, quarterCount - 1)}
 * most recent transcripts. An unavailable source becomes a FETCH gap; a missing kind
 * degrades the run; no documents at all fails it.</p>
 */
@Log4j2
public class GatheringNode extends RunNode {

    private static final Comparator<SourceDocument> MOST_RECENT_FIRST = Comparator
            .comparing(SourceDocument::period).reversed()
            .thenComparing(SourceDocument::id);

    private final DocumentFetcher fetcher;
    private final Executor executor;

    public GatheringNode(RunContext ctx, DocumentFetcher fetcher, Executor executor) {
        super(ctx);
        this.fetcher = fetcher;
        this.executor = executor;
    }

    private record FetchResult(String sourceId, DocumentKind kind, List<SourceDocument> documents, String error) {
    }

    @Override
    protected String step(ForecastState state) {
        ctx.transitionTo(RunState.GATHERING, "validated request for " + ctx.request().sources().size() + " source(s)");
        ctx.checkBudget();
        RunRequest request = ctx.request();

        List<CompletableFuture<FetchResult>> futures = new ArrayList<>();
        for (String sourceId : request.sources()) {
            futures.add(fetchAsync(sourceId, DocumentKind.REPORT, request.reportLimit()));
            futures.add(fetchAsync(sourceId, DocumentKind.TRANSCRIPT, request.transcriptLimit()));
        }
        List<FetchResult> results = Barrier.await(ctx, futures);

        Map<String, SourceDocument> reports = new LinkedHashMap<>();
        Map<String, SourceDocument> transcripts = new LinkedHashMap<>();
        for (FetchResult r : results) {
            if (r.error() != null) {
                ctx.trace().append(TraceEntryType.TOOL_CALL, "fetch", "UNAVAILABLE", r.sourceId() + " " + r.kind());
                ctx.recordGap(new ExtractionGap(ExtractionGap.Stage.FETCH, r.sourceId(), r.error()));
                continue;
            }
            ctx.trace().append(TraceEntryType.TOOL_CALL, "fetch", "OK",
                    r.sourceId() + " " + r.kind() + ": " + r.documents().size() + " document(s)");
            Map<String, SourceDocument> target = r.kind() == DocumentKind.REPORT ? reports : transcripts;
            r.documents().forEach(d -> target.putIfAbsent(d.id(), d));
        }

        List<SourceDocument> keptReports = mostRecent(reports.values(), request.reportLimit());
        List<SourceDocument> keptTranscripts = mostRecent(transcripts.values(), request.transcriptLimit());

        if (keptReports.isEmpty() && keptTranscripts.isEmpty()) {
            throw new ForecastException(ErrorKind.DOCUMENTS_UNAVAILABLE, RunState.GATHERING, 0,
                    "No documents available from " + request.sources());
        }
        if (keptReports.isEmpty()) {
            ctx.recordGap(new ExtractionGap(ExtractionGap.Stage.GATHERING, "reports", "no reports gathered, metrics unavailable"));
        }
        if (keptTranscripts.isEmpty()) {
            ctx.recordGap(new ExtractionGap(ExtractionGap.Stage.GATHERING, "transcripts", "no transcripts gathered, themes unavailable"));
        }

        ctx.addDocuments(keptReports);
        ctx.addDocuments(keptTranscripts);
        log.info("Gathered {} report(s) and {} transcript(s)", keptReports.size(), keptTranscripts.size());
        return RunState.EXTRACTING.nodeId();
    }

    private CompletableFuture<FetchResult> fetchAsync(String sourceId, DocumentKind kind, int limit) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return new FetchResult(sourceId, kind, fetcher.fetch(sourceId, kind, limit), null);
            } catch (RuntimeException e) {
                log.warn("Fetching {} from {} failed: {}", kind, sourceId, e.getMessage());
                return new FetchResult(sourceId, kind, List.of(), e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            }
        }, executor);
    }

    private static List<SourceDocument> mostRecent(Collection<SourceDocument> docs, int limit) {
        return docs.stream().sorted(MOST_RECENT_FIRST).limit(limit).toList();
    }
}
