package com.distributedsystems.archon.controller.dto;

import lombok.Data;

@Data
public class PollIdRequestDTO {
    private String pollId;
}
