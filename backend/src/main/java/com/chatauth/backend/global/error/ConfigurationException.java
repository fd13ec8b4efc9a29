package com.chatauth.backend.global.error;

import java.util.List;

public class ConfigurationException extends CredentialException {

    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("INVALID_AUTH_CONFIGURATION", "Invalid auth configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
