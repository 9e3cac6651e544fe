package com.len.directory.application.event;

/**
 * EventBus.publish 직후 호출된다. 구현체는 호출 스레드를 붙잡으면 안 된다.
 */
public interface DirectoryEventListener {

    void onEvent(DirectoryEvent event);
}
