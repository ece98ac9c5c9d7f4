package com.khartoum.launchpad.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class FlagMergeResult {
    private List<String> added;
    private List<String> skipped;
    private String error;
}
