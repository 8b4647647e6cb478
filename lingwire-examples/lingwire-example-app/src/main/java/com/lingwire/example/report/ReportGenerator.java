package com.lingwire.example.report;

import com.lingwire.example.model.User;

import java.util.List;

public interface ReportGenerator {

    String generate(List<User> users);
}
