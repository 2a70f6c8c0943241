package com.coderag;

public enum OperationStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
