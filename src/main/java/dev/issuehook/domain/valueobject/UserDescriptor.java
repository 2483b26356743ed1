package dev.issuehook.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UserDescriptor(Long id, String login) {
    public UserDescriptor {
        if (login == null || login.isBlank()) throw new IllegalArgumentException("user login required");
    }

    public static UserDescriptor login(String login) {
        return new UserDescriptor(null, login);
    }
}
