package com.len.directory.domain.store;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 컬렉션 단위 key-document 저장소.
 * 요청 처리 / 스케줄러 / 웹훅 전송은 각자 별도 인스턴스(핸들)를 쓴다.
 */
public interface RecordStore {

    <T> Optional<T> get(StoreCollection collection, String id, Class<T> type);

    /**
     * id 기준 insert or replace
     */
    void upsert(StoreCollection collection, String id, Object document);

    void upsert(StoreCollection collection, String id, String indexKey, Object document);

    /**
     * 새 id 로 추가만 한다 (수정 없는 이력성 데이터)
     * @return 생성된 id
     */
    String append(StoreCollection collection, String indexKey, Object document);

    <T> List<T> list(StoreCollection collection, Class<T> type, RecordQuery<T> query);

    /**
     * 행 잠금을 잡은 상태로 읽고-수정하고-쓴다. 문서가 없으면 empty.
     */
    <T> Optional<T> update(StoreCollection collection, String id, Class<T> type, UnaryOperator<T> mutation);

    boolean delete(StoreCollection collection, String id);
}
