package com.newsagent.controller;

import com.newsagent.model.BotResponse;
import com.newsagent.model.UserMessage;
import com.newsagent.service.ChatService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ws")
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping("/chat")
    public BotResponse chat(@Valid @RequestBody UserMessage message) {
        return chatService.reply(message);
    }
}
