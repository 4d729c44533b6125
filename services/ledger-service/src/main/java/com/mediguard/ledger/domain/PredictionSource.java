package com.mediguard.ledger.domain;

public enum PredictionSource {
    MANUAL,
    PDF,
    CSV,
    IMAGE
}
