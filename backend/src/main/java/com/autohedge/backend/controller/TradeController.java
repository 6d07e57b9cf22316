package com.autohedge.backend.controller;

import com.autohedge.backend.dto.MessageResponse;
import com.autohedge.backend.dto.TradeRequest;
import com.autohedge.backend.dto.TradeResponse;
import com.autohedge.backend.dto.TradeSubmissionResponse;
import com.autohedge.backend.exception.UnauthorizedException;
import com.autohedge.backend.model.TradeStatus;
import com.autohedge.backend.security.UserPrincipal;
import com.autohedge.backend.service.TradeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequestMapping("/trades")
@RequiredArgsConstructor
public class TradeController {

    private final TradeService tradeService;

    @PostMapping
    @Operation(summary = "Submit a trade; the fund run executes asynchronously")
    @ApiResponse(responseCode = "202")
    public ResponseEntity<TradeSubmissionResponse> submit(@AuthenticationPrincipal UserPrincipal principal,
                                                          @Valid @RequestBody TradeRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(tradeService.submit(requireUserId(principal), request));
    }

    @GetMapping
    @Operation(summary = "List the caller's trades, newest first")
    public List<TradeResponse> list(@AuthenticationPrincipal UserPrincipal principal,
                                    @RequestParam(required = false) TradeStatus status,
                                    @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
                                    @RequestParam(defaultValue = "0") @Min(0) int skip) {
        return tradeService.list(requireUserId(principal), status, limit, skip);
    }

    @GetMapping("/{tradeId}")
    @Operation(summary = "Get one of the caller's trades")
    public TradeResponse get(@AuthenticationPrincipal UserPrincipal principal, @PathVariable String tradeId) {
        return tradeService.get(requireUserId(principal), tradeId);
    }

    @DeleteMapping("/{tradeId}")
    @Operation(summary = "Delete one of the caller's trades")
    public MessageResponse delete(@AuthenticationPrincipal UserPrincipal principal, @PathVariable String tradeId) {
        tradeService.delete(requireUserId(principal), tradeId);
        return new MessageResponse("Trade deleted successfully");
    }

    private String requireUserId(UserPrincipal principal) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Missing authentication");
        }
        return principal.getUserId();
    }
}
