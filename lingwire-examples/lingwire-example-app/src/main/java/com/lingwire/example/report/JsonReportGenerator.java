package com.lingwire.example.report;

import com.lingwire.example.model.User;

import java.util.List;
import java.util.stream.Collectors;

public class JsonReportGenerator implements ReportGenerator {

    @Override
    public String generate(List<User> users) {
        return users.stream()
                .map(u -> String.format("{\"id\":%d,\"name\":\"%s\"}", u.getId(), u.getName()))
                .collect(Collectors.joining(",", "[", "]"));
    }
}
