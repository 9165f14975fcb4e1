package com.distributedsystems.archon.controller.dto;

import lombok.Data;

@Data
public class BindRequestDTO {
    private String pubkey;
    private String did;
}
