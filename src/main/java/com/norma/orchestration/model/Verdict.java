package com.norma.orchestration.model;

public enum Verdict {
    CONTINUE,
    REPLAN,
    FINALIZE,
    HUMAN_REVIEW
}
