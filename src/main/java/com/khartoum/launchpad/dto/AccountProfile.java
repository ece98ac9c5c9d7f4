package com.khartoum.launchpad.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccountProfile {
    private Long id;
    private String name;
    private String email;
    private Long teamId;
}
