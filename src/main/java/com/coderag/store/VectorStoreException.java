package com.coderag.store;

import java.io.IOException;

public class VectorStoreException extends IOException {
    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
