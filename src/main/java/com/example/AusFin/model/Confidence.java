package com.example.AusFin.model;

public enum Confidence {
    ANSWERABLE,
    UNANSWERABLE
}
