package com.musicinsights.listeninghistory.infrastructure.input.spotify;

import com.musicinsights.listeninghistory.application.common.config.ListeningPipelineProperties;
import com.musicinsights.listeninghistory.infrastructure.input.export.NormalizeUtils;
import com.musicinsights.listeninghistory.infrastructure.input.spotify.dto.PlayHistoryItem;
import com.musicinsights.listeninghistory.infrastructure.input.spotify.dto.RecentlyPlayedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Instant;
import java.util.List;

/**
 * "최근 재생" API 클라이언트.
 * <p>
 * 한 페이지(최대 50건)씩, 직전 페이지의 가장 오래된 재생 시각을 {@code before} 커서로 삼아
 * 과거 방향으로 페이지를 넘깁니다. 다음 경우에 페이지 조회를 멈춥니다.
 * <ul>
 *     <li>빈 페이지 또는 페이지 크기보다 적은 항목</li>
 *     <li>페이지의 가장 오래된 항목이 기준 시각 이전</li>
 *     <li>최대 항목 수 도달</li>
 * </ul>
 * 429/5xx 응답은 지수 backoff로 재시도합니다. 첫 페이지 이후의 실패는 그때까지 받은 항목으로 마무리합니다.
 */
@Component
public class SpotifyRecentlyPlayedClient implements RecentlyPlayedSource {

    private static final Logger log = LoggerFactory.getLogger(SpotifyRecentlyPlayedClient.class);

    private static final String PATH = "/v1/me/player/recently-played";

    private final WebClient webClient;
    private final ListeningPipelineProperties.Spotify props;

    public SpotifyRecentlyPlayedClient(@Qualifier("spotifyWebClient") WebClient webClient,
                                       ListeningPipelineProperties props) {
        this.webClient = webClient;
        this.props = props.getSpotify();
    }

    @Override
    public Flux<PlayHistoryItem> fetchSince(String accessToken, Instant after, int maxTracks) {
        return fetchPage(accessToken, null)
                .expand(page -> hasMore(page, after)
                        ? fetchPage(accessToken, oldestMillis(page))
                                .onErrorResume(e -> {
                                    log.warn("Stopped paging recently played tracks: {}", e.getMessage());
                                    return Mono.empty();
                                })
                        : Mono.empty())
                .concatMapIterable(SpotifyRecentlyPlayedClient::itemsOf)
                .filter(item -> after == null || isAfter(item, after))
                .take(maxTracks);
    }

    private Mono<RecentlyPlayedPage> fetchPage(String accessToken, Long before) {
        return webClient.get()
                .uri(b -> {
                    b.path(PATH).queryParam("limit", props.getPageLimit());
                    if (before != null) b.queryParam("before", before);
                    return b.build();
                })
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .retrieve()
                .bodyToMono(RecentlyPlayedPage.class)
                .retryWhen(Retry.backoff(props.getMaxRetries(), props.getRetryBackoff())
                        .filter(SpotifyRecentlyPlayedClient::isRetryable)
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private boolean hasMore(RecentlyPlayedPage page, Instant after) {
        List<PlayHistoryItem> items = itemsOf(page);
        if (items.size() < props.getPageLimit()) return false;
        Long oldest = oldestMillis(page);
        if (oldest == null) return false;
        return after == null || oldest > after.toEpochMilli();
    }

    private static Long oldestMillis(RecentlyPlayedPage page) {
        List<PlayHistoryItem> items = itemsOf(page);
        if (items.isEmpty()) return null;
        Instant oldest = NormalizeUtils.parseInstantOrNull(items.get(items.size() - 1).playedAt());
        return oldest == null ? null : oldest.toEpochMilli();
    }

    private static boolean isAfter(PlayHistoryItem item, Instant after) {
        Instant playedAt = NormalizeUtils.parseInstantOrNull(item.playedAt());
        return playedAt != null && playedAt.isAfter(after);
    }

    private static List<PlayHistoryItem> itemsOf(RecentlyPlayedPage page) {
        return page == null || page.items() == null ? List.of() : page.items();
    }

    private static boolean isRetryable(Throwable e) {
        if (!(e instanceof WebClientResponseException)) return false;
        WebClientResponseException ex = (WebClientResponseException) e;
        return ex.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                || ex.getStatusCode().is5xxServerError();
    }
}
