package com.lingwire.core.fixture;

public class TwoConstructors {

    public TwoConstructors(UserRepository repository) {
    }

    public TwoConstructors(Logger logger) {
    }
}
