package com.distributedsystems.archon.controller.dto;

import lombok.Data;

@Data
public class PruneRequestDTO {
    private Integer retentionDays;
}
