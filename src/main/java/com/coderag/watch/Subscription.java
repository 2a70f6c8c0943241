package com.coderag.watch;

public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
