package com.distributedsystems.archon.controller.dto;

import lombok.Data;

@Data
public class VoteRequestDTO {
    private String pollId;
    private String choice;
    private String reason;
}
