package com.musicinsights.listeninghistory.application.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * 파이프라인 공통 인프라 Bean 설정.
 *
 * <p>백그라운드 job 전용 스케줄러는 요청 처리 스레드와 분리된 bounded-elastic 풀을 사용한다.</p>
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 분리 실행(detached) job 전용 스케줄러를 생성한다.
     *
     * @return job 실행 스케줄러 (컨텍스트 종료 시 dispose)
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler ingestJobScheduler() {
        return Schedulers.newBoundedElastic(
                Runtime.getRuntime().availableProcessors() * 2,
                1_000,
                "ingest-job"
        );
    }

    /**
     * 외부 스트리밍 서비스 호출용 WebClient.
     *
     * @param props 파이프라인 설정
     * @return base URL이 지정된 WebClient
     */
    @Bean
    public WebClient spotifyWebClient(ListeningPipelineProperties props) {
        return WebClient.builder()
                .baseUrl(props.getSpotify().getBaseUrl())
                .build();
    }
}
