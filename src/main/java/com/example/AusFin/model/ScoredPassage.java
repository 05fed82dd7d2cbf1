package com.example.AusFin.model;

public record ScoredPassage(Passage passage, double score) {

    public String id() {
        return passage.id();
    }
}
