package com.eainde.forecast.model;

import java.util.Locale;

/**
 * Format hint carried by a {@link SourceDocument}. Decides how the text layer is read.
 */
public enum DocumentFormat {
    PDF,
    TEXT,
    HTML,
    IMAGE;

    public static DocumentFormat fromFileName(String fileName) {
        if (fileName == null) {
            return TEXT;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) {
            return PDF;
        }
        if (lower.endsWith(".html") || lower.endsWith(".htm")) {
            return HTML;
        }
        if (lower.endsWith(".png") || lower.endsWith(".jpg") || lower.endsWith(".jpeg")
                || lower.endsWith(".tif") || lower.endsWith(".tiff")) {
            return IMAGE;
        }
        return TEXT;
    }
}
