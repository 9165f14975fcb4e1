package com.distributedsystems.archon.controller.dto;

import lombok.Data;

@Data
public class ProvisionRequestDTO {
    private boolean reprovision;
    private boolean force;

    public boolean wantsReprovision() {
        return reprovision || force;
    }
}
