package com.bank.patterns.model;

public enum RefreshMode {
    FULL,
    INCREMENTAL
}
