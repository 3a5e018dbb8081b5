package com.example.tagsync.service.progress;

import com.example.tagsync.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans progress events out to every connected server-sent-events client.
 * Subscribers that fail to receive an event are dropped.
 */
@Component
@Slf4j
public class ProgressBroadcaster implements ProgressEmitter {

    static final String EVENT_NAME = "progress";

    private final List<SseEmitter> subscribers = new CopyOnWriteArrayList<>();

    public SseEmitter subscribe(long timeoutMs) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        subscribers.add(emitter);
        emitter.onCompletion(() -> subscribers.remove(emitter));
        emitter.onTimeout(() -> subscribers.remove(emitter));
        emitter.onError(e -> subscribers.remove(emitter));
        log.debug("Progress subscriber added ({} total)", subscribers.size());
        return emitter;
    }

    @Override
    public void emit(ProgressEvent event) {
        for (SseEmitter subscriber : subscribers) {
            try {
                subscriber.send(SseEmitter.event()
                        .name(EVENT_NAME)
                        .data(event, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping progress subscriber: {}", e.getMessage());
                subscribers.remove(subscriber);
                subscriber.completeWithError(e);
            }
        }
    }
}
