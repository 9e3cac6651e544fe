package com.len.directory.api.event;

import com.len.directory.application.credential.AccessGuard;
import com.len.directory.application.credential.ResolvedIdentity;
import com.len.directory.infra.sse.EventStreamHub;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/v1/events")
public class EventStreamController {

    private final EventStreamHub hub;

    public EventStreamController(EventStreamHub hub) {
        this.hub = hub;
    }

    // API 키(일반/관리자) 필요
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestAttribute(ResolvedIdentity.ATTRIBUTE) ResolvedIdentity identity) {
        String keyId = AccessGuard.requireApiKey(identity);
        return hub.subscribe(keyId);
    }
}
