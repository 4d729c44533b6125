package com.mediguard.ledger.dto;

public enum DiscrepancyType {
    PREDICTION_NOT_FOUND,
    LINK_MISMATCH,
    HASH_MISMATCH
}
