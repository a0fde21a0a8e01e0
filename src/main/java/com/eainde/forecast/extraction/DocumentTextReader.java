package com.eainde.forecast.extraction;

import com.eainde.forecast.model.DocumentFormat;
import com.eainde.forecast.model.SourceDocument;
import lombok.extern.log4j.Log4j2;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads the text layer of a {@link SourceDocument}.
 *
 * <ul>
 *   <li>PDF: PDFBox text stripper sorted by position, wide column gaps as tabs, pages
 *       separated by form feeds</li>
 *   <li>HTML: jsoup; table rows become tab separated lines</li>
 *   <li>TEXT: UTF-8</li>
 *   <li>IMAGE: no text layer</li>
 * </ul>
 */
@Log4j2
public class DocumentTextReader {

    /**
     * @throws IOException when a PDF cannot be parsed
     */
    public DocumentText read(SourceDocument document) throws IOException {
        DocumentFormat format = document.format();
        return switch (format) {
            case PDF -> readPdf(document.content());
            case HTML -> DocumentText.of(readHtml(new String(document.content(), StandardCharsets.UTF_8)));
            case IMAGE -> DocumentText.image(1);
            case TEXT -> DocumentText.of(new String(document.content(), StandardCharsets.UTF_8));
        };
    }

    private DocumentText readPdf(byte[] bytes) throws IOException {
        try (PDDocument pdf = PDDocument.load(bytes)) {
            PDFTextStripper stripper = new ColumnAwareTextStripper();
            String text = stripper.getText(pdf);
            int pages = pdf.getNumberOfPages();
            if (text.replace("\f", "").isBlank()) {
                log.debug("PDF with {} page(s) has no text layer", pages);
                return DocumentText.image(pages);
            }
            return new DocumentText(text, false, pages);
        }
    }

    static String readHtml(String html) {
        Document doc = Jsoup.parse(html);
        doc.select("script, style, noscript").remove();

        StringBuilder out = new StringBuilder();
        for (Element row : doc.select("tr")) {
            out.append(String.join("\t", row.select("th, td").eachText())).append('\n');
        }
        doc.select("table").remove();

        int before = out.length();
        for (Element block : doc.select("p, li, h1, h2, h3, h4, h5, h6, pre")) {
            String text = block.text();
            if (!text.isBlank()) {
                out.append(text).append('\n');
            }
        }
        if (out.length() == before) {
            out.append(doc.body() == null ? doc.text() : doc.body().text());
        }
        return out.toString();
    }
}
