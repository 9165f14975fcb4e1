package com.distributedsystems.archon.controller.dto;

import lombok.Data;

@Data
public class DidRequestDTO {
    private String did;
}
