package com.esmp.message;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/messages")
public class MessageController {

    private final MessageService messageService;

    public MessageController(MessageService messageService) {
        this.messageService = messageService;
    }

    /** Same pipeline as a TCP line. The body is read raw so the signed bytes are not re-serialised. */
    @PostMapping
    public Mono<Acceptance> submit(@RequestBody byte[] envelope) {
        return messageService.submit(envelope);
    }
}
