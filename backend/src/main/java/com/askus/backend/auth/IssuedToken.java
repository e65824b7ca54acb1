package com.askus.backend.auth;

public record IssuedToken(String accessToken, long expiresInSeconds) {}
