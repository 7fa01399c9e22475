package com.musicinsights.listeninghistory.application.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 청취 기록 파이프라인 설정값({@code listening.*}).
 *
 * <p>기본값은 저장소의 요청당 행 수 상한(1000), 동시 chunk 쓰기 3개,
 * 중복 제거 참조 구간 1000건, Top-N 50건, job 보존 1시간을 기준으로 한다.</p>
 */
@ConfigurationProperties(prefix = "listening")
public class ListeningPipelineProperties {

    private final Batch batch = new Batch();
    private final Sync sync = new Sync();
    private final Aggregation aggregation = new Aggregation();
    private final Job job = new Job();
    private final Upload upload = new Upload();
    private final Spotify spotify = new Spotify();

    public Batch getBatch() { return batch; }
    public Sync getSync() { return sync; }
    public Aggregation getAggregation() { return aggregation; }
    public Job getJob() { return job; }
    public Upload getUpload() { return upload; }
    public Spotify getSpotify() { return spotify; }

    /** 배치 쓰기 설정 */
    public static class Batch {
        /** 한 번의 insert 요청에 담을 최대 행 수(저장소 상한) */
        private int chunkSize = 1000;
        /** 동시에 실행할 chunk insert 수 */
        private int concurrency = 3;
        /** 전체 조회 시 페이지 크기 */
        private int pageSize = 1000;

        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public int getPageSize() { return pageSize; }
        public void setPageSize(int pageSize) { this.pageSize = pageSize; }
    }

    /** 증분 동기화 설정 */
    public static class Sync {
        /**
         * 중복 제거에 사용할 최근 저장 이벤트 수.
         * <p>클수록 중복 위험이 줄고 동기화 비용이 늘어난다.</p>
         */
        private int dedupWindow = 1000;
        /** 한 번의 동기화에서 가져올 최대 트랙 수 */
        private int maxTracks = 1000;
        /** 사용자 간 대기 시간(외부 API rate limit 대응) */
        private Duration userDelay = Duration.ofMillis(500);
        private final Schedule schedule = new Schedule();

        public int getDedupWindow() { return dedupWindow; }
        public void setDedupWindow(int dedupWindow) { this.dedupWindow = dedupWindow; }
        public int getMaxTracks() { return maxTracks; }
        public void setMaxTracks(int maxTracks) { this.maxTracks = maxTracks; }
        public Duration getUserDelay() { return userDelay; }
        public void setUserDelay(Duration userDelay) { this.userDelay = userDelay; }
        public Schedule getSchedule() { return schedule; }
    }

    /** 주기적 전체 사용자 동기화 설정 */
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 * * * *";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }
    }

    /** 집계 설정 */
    public static class Aggregation {
        /** 저장할 Top-N 크기. 화면에서는 이보다 작게 잘라 쓴다. */
        private int topLimit = 50;
        /** 시간대/요일/날짜 버킷 계산에 사용할 타임존 */
        private ZoneId zoneId = ZoneId.of("UTC");

        public int getTopLimit() { return topLimit; }
        public void setTopLimit(int topLimit) { this.topLimit = topLimit; }
        public ZoneId getZoneId() { return zoneId; }
        public void setZoneId(ZoneId zoneId) { this.zoneId = zoneId; }
    }

    /** 업로드 job 추적 설정 */
    public static class Job {
        /** 완료/실패 여부와 무관하게 job 항목을 보관하는 기간 */
        private Duration retention = Duration.ofHours(1);
        /** 추적 정보가 없는 job을 "멈춤"으로 판단하기 시작하는 경과 시간 */
        private Duration stuckAfter = Duration.ofMinutes(10);
        /** 추적 정보가 없는 job을 "유실"로 판단하는 경과 시간 */
        private Duration lostAfter = Duration.ofMinutes(15);
        /** 경과 시간 기반 진행률 추정의 기준 소요 시간 */
        private Duration typicalDuration = Duration.ofMinutes(5);

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
        public Duration getStuckAfter() { return stuckAfter; }
        public void setStuckAfter(Duration stuckAfter) { this.stuckAfter = stuckAfter; }
        public Duration getLostAfter() { return lostAfter; }
        public void setLostAfter(Duration lostAfter) { this.lostAfter = lostAfter; }
        public Duration getTypicalDuration() { return typicalDuration; }
        public void setTypicalDuration(Duration typicalDuration) { this.typicalDuration = typicalDuration; }
    }

    /** 업로드 요청 설정 */
    public static class Upload {
        private int maxBytes = 200 * 1024 * 1024;

        public int getMaxBytes() { return maxBytes; }
        public void setMaxBytes(int maxBytes) { this.maxBytes = maxBytes; }
    }

    /** 외부 스트리밍 서비스 API 설정 */
    public static class Spotify {
        private String baseUrl = "https://api.spotify.com";
        private int pageLimit = 50;
        private int maxRetries = 3;
        /** 429/5xx 응답 재시도의 첫 대기 시간(지수 증가) */
        private Duration retryBackoff = Duration.ofSeconds(1);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public int getPageLimit() { return pageLimit; }
        public void setPageLimit(int pageLimit) { this.pageLimit = pageLimit; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
    }
}
