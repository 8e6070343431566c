package com.example.awardcertificates.model;

public enum ExtractionStatus {
    OK,
    PARTIAL,
    FAILED
}
