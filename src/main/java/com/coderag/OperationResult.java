package com.coderag;

public record OperationResult<T>(OperationStatus status, String message, T value) {

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(OperationStatus.SUCCESS, null, value);
    }

    public static <T> OperationResult<T> success(T value, String message) {
        return new OperationResult<>(OperationStatus.SUCCESS, message, value);
    }

    public static <T> OperationResult<T> partial(T value, String message) {
        return new OperationResult<>(OperationStatus.PARTIAL, message, value);
    }

    public static <T> OperationResult<T> failed(String message) {
        return new OperationResult<>(OperationStatus.FAILED, message, null);
    }

    public static <T> OperationResult<T> failed(T value, String message) {
        return new OperationResult<>(OperationStatus.FAILED, message, value);
    }

    public boolean isSuccess() {
        return status == OperationStatus.SUCCESS;
    }
}
