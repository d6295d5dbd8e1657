package com.meritmarket.model;

public enum ResolutionStatus {
    PENDING,
    APPROVED,
    REJECTED
}
