package com.distributedsystems.archon.controller.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class PollCreateRequestDTO {
    private String pollType;
    private String title;
    private List<Object> options;
    private Long deadline;
    private Map<String, Object> metadata;
}
