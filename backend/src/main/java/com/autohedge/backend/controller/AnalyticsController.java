package com.autohedge.backend.controller;

import com.autohedge.backend.dto.HistoricalAnalyticsResponse;
import com.autohedge.backend.exception.UnauthorizedException;
import com.autohedge.backend.security.UserPrincipal;
import com.autohedge.backend.service.AnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @GetMapping("/history")
    @Operation(summary = "Trade and stock statistics over the trailing window")
    public HistoricalAnalyticsResponse history(@AuthenticationPrincipal UserPrincipal principal,
                                               @RequestParam(required = false) @Min(1) @Max(365) Integer days) {
        if (principal == null || principal.getUserId() == null) {
            throw new UnauthorizedException("Missing authentication");
        }
        return analyticsService.history(principal.getUserId(), days);
    }
}
