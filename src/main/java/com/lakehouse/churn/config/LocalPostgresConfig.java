package com.lakehouse.churn.config;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.File;
import java.io.IOException;

/**
 * 로컬 실행용 내장 PostgreSQL
 * <p>
 * data-directory 를 지정하면 체크포인트와 silver 테이블이 재시작 후에도 유지되어 증분 실행을 이어갈 수 있습니다.
 * 외부 DB 를 쓰려면 churn.pipeline.embedded-postgres.enabled=false 와 spring.datasource.* 를 지정합니다.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "churn.pipeline.embedded-postgres", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class LocalPostgresConfig {

    @Bean(destroyMethod = "close")
    public EmbeddedPostgres embeddedPostgres(PipelineProperties properties) throws IOException {
        PipelineProperties.LocalDatabase settings = properties.getEmbeddedPostgres();
        EmbeddedPostgres.Builder builder = EmbeddedPostgres.builder();
        if (settings.getPort() > 0) {
            builder.setPort(settings.getPort());
        }
        if (settings.getDataDirectory() != null) {
            builder.setDataDirectory(new File(settings.getDataDirectory()))
                    .setCleanDataDirectory(false);
        }
        EmbeddedPostgres postgres = builder.start();
        log.info("Embedded PostgreSQL for churn pipeline started (port={}, dataDirectory={})",
                postgres.getPort(), settings.getDataDirectory() == null ? "temporary" : settings.getDataDirectory());
        return postgres;
    }

    @Bean
    public DataSource dataSource(EmbeddedPostgres embeddedPostgres) {
        return embeddedPostgres.getPostgresDatabase();
    }
}
