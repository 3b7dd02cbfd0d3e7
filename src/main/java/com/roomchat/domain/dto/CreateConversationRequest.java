package com.roomchat.domain.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class CreateConversationRequest {

    @NotBlank(message = "missing_type")
    private String type;

    @NotEmpty(message = "missing_participants")
    private List<Long> participantIds;

    @Size(max = 100, message = "title_too_long")
    private String title;

    private Long matchId;

    private Long listingId;
}
