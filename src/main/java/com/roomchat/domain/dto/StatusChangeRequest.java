package com.roomchat.domain.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StatusChangeRequest {

    @NotBlank(message = "missing_status")
    private String status;
}
