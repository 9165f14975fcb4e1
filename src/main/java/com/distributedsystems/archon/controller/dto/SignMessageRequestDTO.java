package com.distributedsystems.archon.controller.dto;

import lombok.Data;

@Data
public class SignMessageRequestDTO {
    private String message;
}
