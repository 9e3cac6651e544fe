package com.len.directory.infra.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.directory.domain.store.RecordStore;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.autoconfigure.jdbc.JdbcConnectionDetails;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * 저장소 핸들 3개
 * - request   : 일반 API 요청 처리
 * - scheduler : 주기 헬스체크
 * - webhook   : 웹훅 전송 결과 기록
 * 느린 백그라운드 작업이 요청 처리용 커넥션/락을 잡고 있지 않도록 분리한다.
 */
@Configuration
public class RecordStoreConfig {

    public static final String REQUEST_STORE = "requestRecordStore";
    public static final String SCHEDULER_STORE = "schedulerRecordStore";
    public static final String WEBHOOK_STORE = "webhookRecordStore";

    @Bean
    @Primary
    public DataSource requestDataSource(DataSourceProperties properties,
                                        ObjectProvider<JdbcConnectionDetails> connectionDetails) {
        return singleConnectionPool(properties, connectionDetails.getIfAvailable(), "request-store");
    }

    @Bean
    public DataSource schedulerDataSource(DataSourceProperties properties,
                                          ObjectProvider<JdbcConnectionDetails> connectionDetails) {
        return singleConnectionPool(properties, connectionDetails.getIfAvailable(), "scheduler-store");
    }

    @Bean
    public DataSource webhookDataSource(DataSourceProperties properties,
                                        ObjectProvider<JdbcConnectionDetails> connectionDetails) {
        return singleConnectionPool(properties, connectionDetails.getIfAvailable(), "webhook-store");
    }

    @Bean(REQUEST_STORE)
    @Primary
    public RecordStore requestRecordStore(@Qualifier("requestDataSource") DataSource dataSource,
                                          ObjectMapper objectMapper, Clock clock) {
        return new JdbcRecordStore("request", dataSource, objectMapper, clock);
    }

    @Bean(SCHEDULER_STORE)
    public RecordStore schedulerRecordStore(@Qualifier("schedulerDataSource") DataSource dataSource,
                                            ObjectMapper objectMapper, Clock clock) {
        return new JdbcRecordStore("scheduler", dataSource, objectMapper, clock);
    }

    @Bean(WEBHOOK_STORE)
    public RecordStore webhookRecordStore(@Qualifier("webhookDataSource") DataSource dataSource,
                                          ObjectMapper objectMapper, Clock clock) {
        return new JdbcRecordStore("webhook", dataSource, objectMapper, clock);
    }

    /**
     * 접속 정보는 spring.datasource.* 를 따르고, 컨테이너 등에서 JdbcConnectionDetails 가 주어지면 그 값을 쓴다.
     */
    private static HikariDataSource singleConnectionPool(DataSourceProperties properties,
                                                         JdbcConnectionDetails connectionDetails,
                                                         String poolName) {
        DataSourceBuilder<HikariDataSource> builder = properties.initializeDataSourceBuilder()
                .type(HikariDataSource.class);
        if (connectionDetails != null) {
            builder.url(connectionDetails.getJdbcUrl())
                    .username(connectionDetails.getUsername())
                    .password(connectionDetails.getPassword())
                    .driverClassName(connectionDetails.getDriverClassName());
        }
        HikariDataSource dataSource = builder.build();
        dataSource.setPoolName(poolName);
        dataSource.setMaximumPoolSize(1);
        return dataSource;
    }
}
