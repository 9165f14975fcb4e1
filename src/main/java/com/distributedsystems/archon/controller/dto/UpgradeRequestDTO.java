package com.distributedsystems.archon.controller.dto;

import lombok.Data;

@Data
public class UpgradeRequestDTO {
    private String targetTier = "governance";
    private long bondSats;
}
