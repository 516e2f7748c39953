package com.jumbo.companion.service;

import com.jumbo.companion.model.ChatReply;

public interface ChatService {

    ChatReply respond(String userId, String message, String sessionId);
}
