package com.example.migration.model;

public enum ResultStatus {
    SUCCESS,
    FAILED
}
