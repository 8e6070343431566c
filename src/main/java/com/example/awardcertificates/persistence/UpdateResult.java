package com.example.awardcertificates.persistence;

public enum UpdateResult {
    UPDATED,
    CONFLICT,
    NOT_FOUND
}
