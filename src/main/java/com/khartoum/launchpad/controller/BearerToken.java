package com.khartoum.launchpad.controller;

import com.khartoum.launchpad.exception.NotAuthenticatedException;

final class BearerToken {

    private static final String PREFIX = "Bearer ";

    private BearerToken() {
    }

    /** Token from an {@code Authorization} header, or 401 when there is none. */
    static String from(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            throw new NotAuthenticatedException("Not authenticated");
        }
        String token = authorizationHeader.substring(PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new NotAuthenticatedException("Not authenticated");
        }
        return token;
    }
}
