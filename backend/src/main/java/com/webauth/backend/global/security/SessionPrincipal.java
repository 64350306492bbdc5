package com.webauth.backend.global.security;

public record SessionPrincipal(String username, boolean admin) {
}
