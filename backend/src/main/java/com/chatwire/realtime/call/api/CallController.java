package com.chatwire.realtime.call.api;

import com.chatwire.realtime.auth.service.jwt.JwtService;
import com.chatwire.realtime.call.service.CallService;
import com.chatwire.realtime.common.api.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
public class CallController {

    private final CallService callService;
    private final JwtService jwtService;

    public CallController(CallService callService, JwtService jwtService) {
        this.callService = callService;
        this.jwtService = jwtService;
    }

    @PostMapping("/calls")
    public ApiResponse<CallSessionResponse> initiate(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @Valid @RequestBody InitiateCallRequest req
    ) {
        var token = JwtService.extractBearerToken(authorization)
                .orElseThrow(() -> new IllegalArgumentException("missing_token"));
        var claims = jwtService.parse(token);
        var call = callService.initiate(claims.userId(), claims.label(), req.receiver_id(), req.call_type());
        return ApiResponse.ok(CallSessionResponse.from(call));
    }

    @GetMapping("/calls/{id}")
    public ApiResponse<CallSessionResponse> get(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String callId
    ) {
        var token = JwtService.extractBearerToken(authorization)
                .orElseThrow(() -> new IllegalArgumentException("missing_token"));
        var claims = jwtService.parse(token);
        return ApiResponse.ok(CallSessionResponse.from(callService.get(claims.userId(), callId)));
    }

    @PostMapping("/calls/{id}/status")
    public ApiResponse<CallSessionResponse> updateStatus(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String callId,
            @Valid @RequestBody UpdateCallStatusRequest req
    ) {
        var token = JwtService.extractBearerToken(authorization)
                .orElseThrow(() -> new IllegalArgumentException("missing_token"));
        var claims = jwtService.parse(token);
        return ApiResponse.ok(CallSessionResponse.from(callService.updateStatus(claims.userId(), callId, req.status())));
    }
}
