package com.ai.concierge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    private String question;

    @JsonProperty("session_id")
    private String sessionId;

    /** Documents to retrieve; the configured default applies when absent. */
    private Integer k;

    @JsonProperty("max_new_tokens")
    private Integer maxNewTokens;
}
