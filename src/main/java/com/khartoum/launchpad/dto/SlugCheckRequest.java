package com.khartoum.launchpad.dto;

import lombok.Data;

@Data
public class SlugCheckRequest {
    private String slug;
}
