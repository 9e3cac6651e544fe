package com.len.directory.infra.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.directory.domain.store.RecordQuery;
import com.len.directory.domain.store.RecordStore;
import com.len.directory.domain.store.StoreCollection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * directory_record 테이블 하나에 컬렉션별 JSON 문서를 저장하는 RecordStore.
 *
 * ✅ 인스턴스 하나 = 핸들 하나
 * - 핸들마다 커넥션 풀(1개)과 락을 따로 가진다.
 * - 같은 핸들 안에서는 호출이 직렬화되고, 다른 핸들끼리는 서로 기다리지 않는다.
 * - update() 는 SELECT ... FOR UPDATE 로 행을 잡기 때문에 핸들이 달라도 lost update 가 없다.
 */
@Slf4j
public class JdbcRecordStore implements RecordStore {

    private final String name;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public JdbcRecordStore(String name, DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.name = name;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String name() {
        return name;
    }

    @Override
    public <T> Optional<T> get(StoreCollection collection, String id, Class<T> type) {
        return locked(() -> selectBody(collection, id, false).map(body -> decode(body, type)));
    }

    @Override
    public void upsert(StoreCollection collection, String id, Object document) {
        upsert(collection, id, null, document);
    }

    @Override
    public void upsert(StoreCollection collection, String id, String indexKey, Object document) {
        String body = encode(document);
        locked(() -> transactionTemplate.execute(status -> {
            if (updateBody(collection, id, indexKey, body) == 0) {
                try {
                    insert(collection, id, indexKey, body);
                } catch (DuplicateKeyException e) {
                    // 다른 핸들이 먼저 insert 한 경우 -> 덮어쓴다
                    updateBody(collection, id, indexKey, body);
                }
            }
            return null;
        }));
    }

    @Override
    public String append(StoreCollection collection, String indexKey, Object document) {
        String id = UUID.randomUUID().toString();
        String body = encode(document);
        locked(() -> {
            insert(collection, id, indexKey, body);
            return null;
        });
        return id;
    }

    @Override
    public <T> List<T> list(StoreCollection collection, Class<T> type, RecordQuery<T> query) {
        StringBuilder sql = new StringBuilder("SELECT body FROM directory_record WHERE collection_name = ?");
        List<Object> args = new ArrayList<>();
        args.add(collection.getTableValue());

        if (query.indexKey() != null) {
            sql.append(" AND index_key = ?");
            args.add(query.indexKey());
        }
        sql.append(query.newestFirst() ? " ORDER BY seq DESC" : " ORDER BY seq ASC");

        // 메모리 필터가 없을 때만 LIMIT 을 SQL 로 내린다
        boolean sqlLimit = query.filter() == null && query.limit() > 0;
        if (sqlLimit) {
            sql.append(" LIMIT ").append(query.limit());
        }

        List<String> bodies = locked(() ->
                jdbcTemplate.query(sql.toString(), (rs, rowNum) -> rs.getString(1), args.toArray()));

        List<T> result = new ArrayList<>();
        for (String body : bodies) {
            T document = decode(body, type);
            if (!query.matches(document)) continue;
            result.add(document);
            if (query.limit() > 0 && result.size() >= query.limit()) break;
        }
        return result;
    }

    @Override
    public <T> Optional<T> update(StoreCollection collection, String id, Class<T> type, UnaryOperator<T> mutation) {
        return locked(() -> transactionTemplate.execute(status -> {
            Optional<String> current = selectBody(collection, id, true);
            if (current.isEmpty()) {
                return Optional.<T>empty();
            }
            T mutated = mutation.apply(decode(current.get(), type));
            jdbcTemplate.update(
                    "UPDATE directory_record SET body = ?, updated_at = ? WHERE collection_name = ? AND record_id = ?",
                    encode(mutated), now(), collection.getTableValue(), id
            );
            return Optional.of(mutated);
        }));
    }

    @Override
    public boolean delete(StoreCollection collection, String id) {
        return locked(() -> jdbcTemplate.update(
                "DELETE FROM directory_record WHERE collection_name = ? AND record_id = ?",
                collection.getTableValue(), id
        ) > 0);
    }

    private Optional<String> selectBody(StoreCollection collection, String id, boolean forUpdate) {
        String sql = "SELECT body FROM directory_record WHERE collection_name = ? AND record_id = ?"
                + (forUpdate ? " FOR UPDATE" : "");
        return jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString(1), collection.getTableValue(), id)
                .stream()
                .findFirst();
    }

    private int updateBody(StoreCollection collection, String id, String indexKey, String body) {
        return jdbcTemplate.update(
                "UPDATE directory_record SET body = ?, index_key = ?, updated_at = ? WHERE collection_name = ? AND record_id = ?",
                body, indexKey, now(), collection.getTableValue(), id
        );
    }

    private void insert(StoreCollection collection, String id, String indexKey, String body) {
        Timestamp now = now();
        jdbcTemplate.update(
                "INSERT INTO directory_record (collection_name, record_id, index_key, body, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?)",
                collection.getTableValue(), id, indexKey, body, now, now
        );
    }

    private <R> R locked(Supplier<R> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    private String encode(Object document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Record serialize failed. store=" + name, e);
        }
    }

    private <T> T decode(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Record deserialize failed. store=" + name + ", type=" + type.getSimpleName(), e);
        }
    }
}
