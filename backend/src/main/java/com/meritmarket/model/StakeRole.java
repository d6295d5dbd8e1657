package com.meritmarket.model;

public enum StakeRole {
    SUPPORT,
    OPPOSITION,
    DISPUTE_SUPPORT
}
