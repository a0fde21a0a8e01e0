package com.eainde.forecast.extraction;

import com.eainde.forecast.context.RunContext;
import com.eainde.forecast.llm.ResilientModelClient;
import com.eainde.forecast.model.DocumentFormat;
import com.eainde.forecast.model.SourceDocument;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * OCR through a vision-capable chat model. PDF pages are rendered with PDFBox; raw images
 * are sent as they are. One model call per page, each made through the
 * {@link ResilientModelClient} so it shares the retry bound, backoff and run trace of every
 * other model call.
 */
@Log4j2
public class VisionModelOcrEngine implements OcrEngine {

    public static final int DEFAULT_MAX_PAGES = 5;
    public static final float DEFAULT_DPI = 200f;

    private static final String INSTRUCTION = "Transcribe all text on this page exactly as printed. "
            + "Keep table rows on one line with cells separated by tab characters. Output only the text.";

    private final ChatModel visionModel;
    private final ResilientModelClient modelClient;
    private final int maxPages;
    private final float dpi;

    public VisionModelOcrEngine(ChatModel visionModel, ResilientModelClient modelClient) {
        this(visionModel, modelClient, DEFAULT_MAX_PAGES, DEFAULT_DPI);
    }

    public VisionModelOcrEngine(ChatModel visionModel, ResilientModelClient modelClient, int maxPages, float dpi) {
        this.visionModel = visionModel;
        this.modelClient = modelClient;
        this.maxPages = maxPages;
        this.dpi = dpi;
    }

    @Override
    public String transcribe(RunContext ctx, SourceDocument document) {
        List<ImageContent> pages = document.format() == DocumentFormat.PDF
                ? renderPdf(document)
                : List.of(ImageContent.from(Base64.getEncoder().encodeToString(document.content()),
                        mimeType(document.content())));

        List<String> texts = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            ImageContent page = pages.get(i);
            String text = modelClient.execute(ctx, "ocr:" + document.id() + "#" + (i + 1),
                    modelClient.backendName(), () -> transcribePage(page));
            log.debug("OCR page {}/{} of {} returned {} chars", i + 1, pages.size(), document.id(),
                    text == null ? 0 : text.length());
            if (text != null && !text.isBlank()) {
                texts.add(text.strip());
            }
        }
        return String.join("\f", texts);
    }

    private String transcribePage(ImageContent page) {
        ChatResponse response = visionModel.chat(ChatRequest.builder()
                .messages(UserMessage.from(TextContent.from(INSTRUCTION), page))
                .build());
        AiMessage message = response == null ? null : response.aiMessage();
        return message == null || message.text() == null ? "" : message.text();
    }

    private List<ImageContent> renderPdf(SourceDocument document) {
        try (PDDocument pdf = PDDocument.load(document.content())) {
            PDFRenderer renderer = new PDFRenderer(pdf);
            int pages = Math.min(pdf.getNumberOfPages(), maxPages);
            List<ImageContent> images = new ArrayList<>(pages);
            for (int i = 0; i < pages; i++) {
                BufferedImage image = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
                ByteArrayOutputStream png = new ByteArrayOutputStream();
                ImageIO.write(image, "png", png);
                images.add(ImageContent.from(Base64.getEncoder().encodeToString(png.toByteArray()), "image/png"));
            }
            return images;
        } catch (IOException e) {
            throw new OcrException("Failed to render " + document.id() + " for OCR", e);
        }
    }

    static String mimeType(byte[] bytes) {
        if (bytes.length >= 4 && (bytes[0] & 0xFF) == 0x89 && bytes[1] == 'P' && bytes[2] == 'N' && bytes[3] == 'G') {
            return "image/png";
        }
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xD8) {
            return "image/jpeg";
        }
        if (bytes.length >= 2 && ((bytes[0] == 'I' && bytes[1] == 'I') || (bytes[0] == 'M' && bytes[1] == 'M'))) {
            return "image/tiff";
        }
        return "image/png";
    }
}
