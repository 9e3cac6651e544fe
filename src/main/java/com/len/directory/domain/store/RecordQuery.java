package com.len.directory.domain.store;

import java.util.function.Predicate;

/**
 * list 조회 조건.
 * - indexKey: 저장소 쪽에서 거르는 보조 키 (예: health_results 의 listingId)
 * - filter: 문서를 읽은 뒤 메모리에서 거르는 조건
 * - limit 0 이하 = 제한 없음
 */
public record RecordQuery<T>(
        String indexKey,
        Predicate<? super T> filter,
        boolean newestFirst,
        int limit
) {

    public static <T> RecordQuery<T> all() {
        return new RecordQuery<>(null, null, false, 0);
    }

    public static <T> RecordQuery<T> where(Predicate<? super T> filter) {
        return new RecordQuery<>(null, filter, false, 0);
    }

    public static <T> RecordQuery<T> byIndexKey(String indexKey) {
        return new RecordQuery<>(indexKey, null, false, 0);
    }

    public RecordQuery<T> latestFirst() {
        return new RecordQuery<>(indexKey, filter, true, limit);
    }

    public RecordQuery<T> limit(int limit) {
        return new RecordQuery<>(indexKey, filter, newestFirst, limit);
    }

    public boolean matches(T document) {
        return filter == null || filter.test(document);
    }
}
