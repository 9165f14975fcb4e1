package com.distributedsystems.archon.controller.dto;

import lombok.Data;

@Data
public class ProcessOutboxRequestDTO {
    private boolean force = true;
}
