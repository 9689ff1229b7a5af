package com.regwatch.core.model;

public enum SourceCategory {
    EUDR,
    FSC
}
