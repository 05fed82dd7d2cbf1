package com.example.AusFin.model;

/**
 * Raw hit returned by the vector index: higher score means more similar.
 */
public record IndexHit(String passageId, double score) {
}
