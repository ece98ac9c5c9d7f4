package com.khartoum.launchpad.exception;

public class SlugConflictException extends RuntimeException {
    public SlugConflictException(String slug) {
        super("This subdomain is already taken: " + slug);
    }
}
