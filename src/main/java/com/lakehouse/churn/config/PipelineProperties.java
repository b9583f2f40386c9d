package com.lakehouse.churn.config;

import com.lakehouse.churn.clean.Expectation;
import com.lakehouse.churn.clean.ViolationPolicy;
import com.lakehouse.churn.domain.SourceName;
import com.lakehouse.churn.ingest.SourceFormat;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * churn.pipeline.* 설정
 * <p>
 * 원천 위치 / 포맷 / 선언 스키마 / Expectation / 재시도 / 스코어링 설정을 외부에서 주입받습니다.
 * 원천 디렉터리는 잡 파라미터 inputRoot 기준의 상대 경로입니다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "churn.pipeline")
public class PipelineProperties {

    private int chunkSize = 100;

    private Map<SourceName, Source> sources = new EnumMap<>(SourceName.class);

    private RetrySettings storageRetry = new RetrySettings();

    private Scoring scoring = new Scoring();

    private Schedule schedule = new Schedule();

    private LocalDatabase embeddedPostgres = new LocalDatabase();

    public Source source(SourceName name) {
        Source source = sources.get(name);
        if (source == null) {
            throw new IllegalStateException("No configuration for source " + name.id()
                    + " (churn.pipeline.sources." + name.id() + ")");
        }
        return source;
    }

    @Getter
    @Setter
    public static class Source {

        private String directory;

        private SourceFormat format = SourceFormat.JSON;

        /** 비어 있으면 스키마를 추론(모든 컬럼 허용)합니다. */
        private List<String> columns = new ArrayList<>();

        private String delimiter = ",";

        private String timestampFormat = "MM-dd-yyyy HH:mm:ss";

        private List<ExpectationSettings> expectations = new ArrayList<>();

        public List<Expectation> toExpectations() {
            return expectations.stream()
                    .map(e -> new Expectation(e.getName(), e.getColumn(), e.getCheck(), e.getPolicy()))
                    .toList();
        }
    }

    @Getter
    @Setter
    public static class ExpectationSettings {

        private String name;

        private String column;

        private Expectation.Check check = Expectation.Check.NOT_NULL;

        private ViolationPolicy policy = ViolationPolicy.DROP_ROW;
    }

    @Getter
    @Setter
    public static class RetrySettings {

        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(200);

        private double multiplier = 2.0;
    }

    @Getter
    @Setter
    public static class Scoring {

        /** MLflow 서빙 엔드포인트. 없으면 기본 비활동 기준 스코어러를 사용합니다. */
        private String endpoint;

        private String modelName = "dbdemos_customer_churn";

        private String modelVersion = "Production";

        private Duration timeout = Duration.ofSeconds(5);

        private RetrySettings retry = new RetrySettings();

        private List<String> inputColumns = new ArrayList<>(List.of(
                "user_id", "age_group", "canal", "country", "gender",
                "order_count", "total_amount", "total_item", "platform",
                "event_count", "session_count",
                "days_since_creation", "days_since_last_activity", "days_last_event"));

        private long inactivityThresholdDays = 30;
    }

    @Getter
    @Setter
    public static class Schedule {

        private boolean enabled = false;

        private Duration pollInterval = Duration.ofMinutes(1);

        private String inputRoot;
    }

    /**
     * 내장 PostgreSQL 설정. enabled=false 이면 spring.datasource.* 를 사용합니다.
     */
    @Getter
    @Setter
    public static class LocalDatabase {

        private boolean enabled = true;

        /** 0 이면 임의 포트 */
        private int port = 0;

        /** 없으면 실행마다 새로 만드는 임시 디렉터리 */
        private String dataDirectory;
    }
}
