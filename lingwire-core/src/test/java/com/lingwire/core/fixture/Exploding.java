package com.lingwire.core.fixture;

public class Exploding {

    public Exploding() {
        throw new IllegalStateException("boom");
    }
}
