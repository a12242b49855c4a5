package com.smurthy.ai.router.execution;

public enum ExecutionStatus {
    SUCCESS,
    ERROR
}
