package com.lingwire.example.mail;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 只记录日志的 SMTP 邮件发送器
 */
@Slf4j
public class SmtpMailer implements Mailer {

    @Getter
    private final String host;

    @Getter
    private final int port;

    private final AtomicInteger sent = new AtomicInteger();

    public SmtpMailer(String host, int port) {
        this.host = host;
        this.port = port;
    }

    @Override
    public void send(String to, String subject) {
        sent.incrementAndGet();
        log.info("[smtp://{}:{}] -> {}: {}", host, port, to, subject);
    }

    @Override
    public int getSentCount() {
        return sent.get();
    }
}
