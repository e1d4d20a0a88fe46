package com.medica.factory.domain;

public enum ProductLine {
    STANDARD,
    CUSTOM
}
