package com.lingwire.example.model;

import lombok.Value;

@Value
public class User {

    long id;
    String name;
    String email;
}
