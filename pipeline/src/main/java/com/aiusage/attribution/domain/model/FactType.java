package com.aiusage.attribution.domain.model;

public enum FactType {
    USAGE,
    COST
}
