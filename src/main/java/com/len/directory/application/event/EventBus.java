package com.len.directory.application.event;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 전역 단일 브로드캐스터 (앱별 채널 없음)
 *
 * publish 는
 * 1) 현재 등록된 모든 구독자 버퍼에 넣고 (반환 전에 모두 반영됨)
 * 2) 리스너(웹훅 등)에 넘긴다. 리스너 예외는 로그만 남기고 호출자에게 올리지 않는다.
 */
@Slf4j
@Component
public class EventBus {

    private final List<EventSubscription> subscribers = new CopyOnWriteArrayList<>();
    private final List<DirectoryEventListener> listeners;
    private final int bufferCapacity;

    public EventBus(List<DirectoryEventListener> listeners,
                    @Value("${directory.events.buffer-capacity:256}") int bufferCapacity,
                    MeterRegistry meterRegistry) {
        this.listeners = List.copyOf(listeners);
        this.bufferCapacity = bufferCapacity;
        Gauge.builder("directory.events.subscribers", subscribers, List::size)
                .register(meterRegistry);
    }

    public EventSubscription subscribe() {
        EventSubscription[] holder = new EventSubscription[1];
        EventSubscription subscription = new EventSubscription(bufferCapacity, () -> subscribers.remove(holder[0]));
        holder[0] = subscription;
        subscribers.add(subscription);
        log.debug("Event subscriber added. subscribers={}", subscribers.size());
        return subscription;
    }

    public void publish(DirectoryEvent event) {
        for (EventSubscription subscription : subscribers) {
            subscription.offer(event);
        }

        for (DirectoryEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Event listener failed. type={}, listener={}",
                        event.type(), listener.getClass().getSimpleName(), e);
            }
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
