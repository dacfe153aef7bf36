package com.norma.orchestration.model;

public enum StepStatus {
    PENDING,
    DONE
}
