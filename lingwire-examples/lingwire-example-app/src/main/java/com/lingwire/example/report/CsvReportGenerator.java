package com.lingwire.example.report;

import com.lingwire.example.model.User;

import java.util.List;
import java.util.stream.Collectors;

public class CsvReportGenerator implements ReportGenerator {

    @Override
    public String generate(List<User> users) {
        return users.stream()
                .map(u -> u.getId() + "," + u.getName() + "," + u.getEmail())
                .collect(Collectors.joining("\n", "id,name,email\n", ""));
    }
}
