package com.jumbo.companion.controller;

import com.jumbo.companion.model.ChatReply;
import com.jumbo.companion.model.ChatSubmission;
import com.jumbo.companion.service.ChatService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    // the pipeline blocks on store reads, so it runs off the event loop
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatReply> chat(@Valid @RequestBody ChatSubmission submission) {
        return Mono.fromCallable(() -> chatService.respond(submission.userId(), submission.message(), submission.sessionId()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
