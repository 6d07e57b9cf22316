package com.autohedge.backend.service;

import com.autohedge.backend.dto.ApiKeyResponse;
import com.autohedge.backend.dto.UserCreateRequest;
import com.autohedge.backend.dto.UserRegistrationResponse;
import com.autohedge.backend.dto.UserResponse;
import com.autohedge.backend.dto.UserUpdateRequest;
import com.autohedge.backend.exception.DuplicateUserException;
import com.autohedge.backend.exception.NotFoundException;
import com.autohedge.backend.model.User;
import com.autohedge.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final ApiKeyService apiKeyService;

    @Transactional
    public UserRegistrationResponse register(UserCreateRequest request) {
        String username = request.getUsername().trim();
        String email = request.getEmail().trim();
        if (userRepository.existsByUsernameIgnoreCase(username)) {
            throw new DuplicateUserException("Username already registered");
        }
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new DuplicateUserException("Email already registered");
        }
        User user;
        try {
            user = userRepository.saveAndFlush(User.builder()
                    .username(username)
                    .email(email)
                    .fundName(request.getFundName().trim())
                    .fundDescription(request.getFundDescription())
                    .build());
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateUserException("Username or email already registered");
        }
        ApiKeyService.IssuedKey issued = apiKeyService.issue(user.getId());
        log.info("Registered user {} ({})", user.getUsername(), user.getId());
        return UserRegistrationResponse.builder()
                .user(toResponse(user))
                .apiKey(issued.key())
                .build();
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(String userId) {
        return toResponse(load(userId));
    }

    @Transactional
    public UserResponse update(String userId, UserUpdateRequest request) {
        User user = load(userId);
        if (request.getEmail() != null) {
            String email = request.getEmail().trim();
            if (userRepository.existsByEmailIgnoreCaseAndIdNot(email, userId)) {
                throw new DuplicateUserException("Email already registered");
            }
            user.setEmail(email);
        }
        if (request.getFundName() != null) {
            user.setFundName(request.getFundName().trim());
        }
        if (request.getFundDescription() != null) {
            user.setFundDescription(request.getFundDescription());
        }
        try {
            return toResponse(userRepository.saveAndFlush(user));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateUserException("Email already registered");
        }
    }

    @Transactional
    public ApiKeyResponse rotateApiKey(String userId) {
        load(userId);
        ApiKeyService.IssuedKey issued = apiKeyService.issue(userId);
        return ApiKeyResponse.builder()
                .apiKey(issued.key())
                .keyPrefix(issued.stored().getKeyPrefix())
                .createdAt(issued.stored().getCreatedAt())
                .build();
    }

    private User load(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    private UserResponse toResponse(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .fundName(user.getFundName())
                .fundDescription(user.getFundDescription())
                .createdAt(user.getCreatedAt())
                .lastLogin(user.getLastLogin())
                .active(user.isActive())
                .build();
    }
}
