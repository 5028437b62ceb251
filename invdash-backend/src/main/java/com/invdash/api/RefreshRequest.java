package com.invdash.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RefreshRequest {
    @NotBlank(message = "scope is required")
    private String scope;

    @NotEmpty(message = "at least one host is required")
    private List<String> hosts = new ArrayList<>();

    private String level;

    private boolean force = false;
}
