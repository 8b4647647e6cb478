package com.lingwire.core.fixture;

import java.util.concurrent.atomic.AtomicInteger;

public class SlowService {

    public static final AtomicInteger CONSTRUCTED = new AtomicInteger();

    public SlowService() throws InterruptedException {
        CONSTRUCTED.incrementAndGet();
        Thread.sleep(100);
    }
}
