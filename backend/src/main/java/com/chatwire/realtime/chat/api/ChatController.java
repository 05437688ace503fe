package com.chatwire.realtime.chat.api;

import com.chatwire.realtime.auth.service.jwt.JwtService;
import com.chatwire.realtime.chat.service.ReceiptService;
import com.chatwire.realtime.common.api.ApiResponse;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
public class ChatController {

    private final ReceiptService receiptService;
    private final JwtService jwtService;

    public ChatController(ReceiptService receiptService, JwtService jwtService) {
        this.receiptService = receiptService;
        this.jwtService = jwtService;
    }

    /**
     * Marks everything the caller has not read in the chat as read.
     */
    @PostMapping("/chats/{id}/open")
    public ApiResponse<OpenChatResponse> open(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String chatId,
            @RequestBody(required = false) OpenChatRequest req
    ) {
        var token = JwtService.extractBearerToken(authorization)
                .orElseThrow(() -> new IllegalArgumentException("missing_token"));
        var claims = jwtService.parse(token);
        var before = req == null ? null : req.before_message_id();
        var result = receiptService.openChat(chatId, claims.userId(), before);
        return ApiResponse.ok(new OpenChatResponse(
                result.chatId(),
                result.messageIds(),
                result.messageIds().size(),
                result.readAt().toString()
        ));
    }
}
