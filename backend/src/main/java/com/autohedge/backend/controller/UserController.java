package com.autohedge.backend.controller;

import com.autohedge.backend.dto.ApiKeyResponse;
import com.autohedge.backend.dto.UserCreateRequest;
import com.autohedge.backend.dto.UserRegistrationResponse;
import com.autohedge.backend.dto.UserResponse;
import com.autohedge.backend.dto.UserUpdateRequest;
import com.autohedge.backend.exception.UnauthorizedException;
import com.autohedge.backend.security.UserPrincipal;
import com.autohedge.backend.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @PostMapping
    @Operation(summary = "Register a user and issue its API key")
    @ApiResponse(responseCode = "201")
    public ResponseEntity<UserRegistrationResponse> register(@Valid @RequestBody UserCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.register(request));
    }

    @GetMapping("/me")
    @Operation(summary = "Get the calling user")
    public UserResponse me(@AuthenticationPrincipal UserPrincipal principal) {
        return userService.getUser(requireUserId(principal));
    }

    @PutMapping("/me")
    @Operation(summary = "Update email or fund details of the calling user")
    public UserResponse update(@AuthenticationPrincipal UserPrincipal principal,
                               @Valid @RequestBody UserUpdateRequest request) {
        return userService.update(requireUserId(principal), request);
    }

    @PostMapping("/me/api-key")
    @Operation(summary = "Revoke the current API key and issue a new one")
    public ApiKeyResponse rotateApiKey(@AuthenticationPrincipal UserPrincipal principal) {
        return userService.rotateApiKey(requireUserId(principal));
    }

    private String requireUserId(UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Missing authentication");
        }
        return principal.getUserId();
    }
}
