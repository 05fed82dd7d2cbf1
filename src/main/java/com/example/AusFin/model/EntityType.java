package com.example.AusFin.model;

public enum EntityType {
    AMOUNT,
    AGE,
    DATE,
    TICKER
}
