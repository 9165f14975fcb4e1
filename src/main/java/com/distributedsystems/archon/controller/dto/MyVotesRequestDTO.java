package com.distributedsystems.archon.controller.dto;

import lombok.Data;

@Data
public class MyVotesRequestDTO {
    private Integer limit;
}
