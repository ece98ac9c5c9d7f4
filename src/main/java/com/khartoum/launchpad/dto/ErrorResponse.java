package com.khartoum.launchpad.dto;

public class ErrorResponse {
    public String error;

    public ErrorResponse(String error) {
        this.error = error;
    }
}
