package com.eainde.forecast.model;

public enum DocumentKind {
    REPORT("reports"),
    TRANSCRIPT("transcripts");

    private final String directoryName;

    DocumentKind(String directoryName) {
        this.directoryName = directoryName;
    }

    public String directoryName() {
        return directoryName;
    }
}
