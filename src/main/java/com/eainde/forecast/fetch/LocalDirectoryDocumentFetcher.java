package com.eainde.forecast.fetch;

import com.eainde.forecast.model.DocumentFormat;
import com.eainde.forecast.model.DocumentKind;
import com.eainde.forecast.model.ReportingPeriod;
import com.eainde.forecast.model.SourceDocument;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads documents from {@code <root>/<sourceId>/<reports|transcripts>/}. The reporting period
 * is parsed from the file name and the format from its extension.
 */
@Log4j2
public class LocalDirectoryDocumentFetcher implements DocumentFetcher {

    private static final Comparator<SourceDocument> MOST_RECENT_FIRST = Comparator
            .comparing(SourceDocument::period).reversed()
            .thenComparing(SourceDocument::id);

    private final Path root;

    public LocalDirectoryDocumentFetcher(Path root) {
        this.root = root;
    }

    @Override
    public List<SourceDocument> fetch(String sourceId, DocumentKind kind, int maxDocuments) {
        Path dir = root.resolve(sourceId).resolve(kind.directoryName()).normalize();
        if (!dir.startsWith(root.normalize()) || !Files.isDirectory(dir)) {
            throw new DocumentUnavailableException(sourceId, kind, "No " + kind.directoryName() + " directory for source " + sourceId);
        }

        List<SourceDocument> documents = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                String name = file.getFileName().toString();
                if (name.startsWith(".")) {
                    continue;
                }
                documents.add(new SourceDocument(
                        sourceId + "/" + kind.directoryName() + "/" + name,
                        kind,
                        sourceId,
                        name,
                        ReportingPeriod.parse(name),
                        DocumentFormat.fromFileName(name),
                        Files.readAllBytes(file)));
            }
        } catch (IOException e) {
            throw new DocumentUnavailableException(sourceId, kind, "Failed to read " + kind.directoryName() + " of " + sourceId, e);
        }

        if (documents.isEmpty()) {
            throw new DocumentUnavailableException(sourceId, kind, "No " + kind.directoryName() + " found for source " + sourceId);
        }
        documents.sort(MOST_RECENT_FIRST);
        List<SourceDocument> limited = documents.subList(0, Math.min(maxDocuments, documents.size()));
        log.info("Fetched {} of {} {} from {}", limited.size(), documents.size(), kind.directoryName(), sourceId);
        return List.copyOf(limited);
    }
}
