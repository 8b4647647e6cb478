package com.lingwire.example.repository;

import com.lingwire.example.model.User;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存用户仓库
 */
public class UserRepository {

    private final List<User> users = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public User save(String name, String email) {
        User user = new User(sequence.incrementAndGet(), name, email);
        users.add(user);
        return user;
    }

    public List<User> findAll() {
        return new ArrayList<>(users);
    }
}
