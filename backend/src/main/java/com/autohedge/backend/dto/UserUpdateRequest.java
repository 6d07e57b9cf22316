package com.autohedge.backend.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial update: null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateRequest {
    @Email
    @Size(max = 255)
    private String email;
    @Size(min = 3, max = 100)
    private String fundName;
    @Size(max = 500)
    private String fundDescription;
}
