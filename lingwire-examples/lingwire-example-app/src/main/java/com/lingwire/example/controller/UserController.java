package com.lingwire.example.controller;

import com.lingwire.example.model.User;
import com.lingwire.example.report.ReportRegistry;
import com.lingwire.example.service.UserService;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * 用户控制器（自动装配）
 */
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final ReportRegistry reports;

    public User create(String name, String email) {
        return userService.register(name, email);
    }

    public List<User> list() {
        return userService.list();
    }

    public String export(String format) {
        return reports.get(format).generate(userService.list());
    }
}
