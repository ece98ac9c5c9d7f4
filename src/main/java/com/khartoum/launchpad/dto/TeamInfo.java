package com.khartoum.launchpad.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TeamInfo {
    private Long id;
    private String name;
    private String tier;

    @ToString.Exclude
    private String apiToken;
}
