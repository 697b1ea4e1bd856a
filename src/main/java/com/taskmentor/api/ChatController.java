package com.taskmentor.api;

import com.taskmentor.tracker.ConversationOrchestrator;
import com.taskmentor.tracker.InboundMessage;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final ConversationOrchestrator orchestrator;

    public ChatController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ChatResponse chat(@Valid @RequestBody ChatRequest request) {
        if (!StringUtils.hasText(request.text()) && !StringUtils.hasText(request.action())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Either text or action is required.");
        }
        var reply = orchestrator.handle(new InboundMessage(request.userId(), request.text(), request.action(),
                request.messageId()));
        return ChatResponse.from(reply);
    }
}
