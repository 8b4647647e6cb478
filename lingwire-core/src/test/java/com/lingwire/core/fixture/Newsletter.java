package com.lingwire.core.fixture;

import com.lingwire.api.annotation.DefaultValue;
import com.lingwire.api.annotation.Nullable;

public class Newsletter {

    private final Mailer mailer;
    private final Logger logger;
    private final String subject;
    private final int batchSize;

    public Newsletter(@Nullable Mailer mailer, Logger logger,
                      @DefaultValue("Weekly news") String subject,
                      @DefaultValue("50") int batchSize) {
        this.mailer = mailer;
        this.logger = logger;
        this.subject = subject;
        this.batchSize = batchSize;
    }

    public Mailer getMailer() {
        return mailer;
    }

    public Logger getLogger() {
        return logger;
    }

    public String getSubject() {
        return subject;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
