package com.lingwire.core.fixture;

public interface Logger {

    void log(String message);
}
