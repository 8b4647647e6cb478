package com.lingwire.example.mail;

import lombok.RequiredArgsConstructor;

/**
 * 按主机创建邮件发送器，通过 [@mailer.factory, create] 工厂使用
 */
@RequiredArgsConstructor
public class MailerFactory {

    private final String host;

    public Mailer create(int port) {
        return new SmtpMailer(host, port);
    }
}
