package com.homepage.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class ConnectionParams {

    private final String scheme;
    private final String username;

    @ToString.Exclude
    private final String password;

    private final String host;
    private final int port;
    private final String database;

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }
}
