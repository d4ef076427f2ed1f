package com.verdictrag.model;

public enum DocumentType {
    JUDGMENT,
    STATUTE,
    REGULATION,
    CONTRACT,
    PLEADING,
    OTHER
}
