package com.medica.factory.domain;

public enum Severity {
    CRITICAL,
    MAJOR,
    WARNING
}
