package com.lingwire.example.service;

import com.lingwire.example.mail.Mailer;
import com.lingwire.example.model.User;
import com.lingwire.example.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class UserService {

    private final UserRepository repository;
    private final Mailer mailer;

    private String welcomeSubject = "Welcome";

    // 由方法调用注入
    public void setWelcomeSubject(String welcomeSubject) {
        this.welcomeSubject = welcomeSubject;
    }

    public User register(String name, String email) {
        User user = repository.save(name, email);
        mailer.send(email, welcomeSubject);
        log.debug("Registered user {}", user);
        return user;
    }

    public List<User> list() {
        return repository.findAll();
    }
}
