package com.geoledger.core.model;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
