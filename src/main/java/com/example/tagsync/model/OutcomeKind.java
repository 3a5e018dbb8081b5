package com.example.tagsync.model;

public enum OutcomeKind {
    SUCCESS,
    FAILURE,
    SKIPPED
}
