package com.autohedge.backend.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The user plus the clear API key, returned once at registration. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRegistrationResponse {
    @JsonUnwrapped
    private UserResponse user;
    private String apiKey;
}
