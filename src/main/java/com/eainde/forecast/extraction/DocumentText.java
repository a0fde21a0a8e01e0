package com.eainde.forecast.extraction;

/**
 * Text layer of a document.
 *
 * @param text       extracted text, empty when there is none
 * @param imageBased true when the document has no usable text layer and needs OCR
 * @param pageCount  number of pages, 1 for non-paged formats
 */
public record DocumentText(String text, boolean imageBased, int pageCount) {

    public DocumentText {
        text = text == null ? "" : text;
    }

    public static DocumentText of(String text) {
        return new DocumentText(text, false, 1);
    }

    public static DocumentText image(int pageCount) {
        return new DocumentText("", true, pageCount);
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
