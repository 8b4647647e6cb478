package com.lingwire.example.mail;

public interface Mailer {

    void send(String to, String subject);

    int getSentCount();
}
