package com.musicinsights.listeninghistory.application.sync.controller;

import com.musicinsights.listeninghistory.application.common.error.BadRequestException;
import com.musicinsights.listeninghistory.application.sync.service.ListeningSyncService;
import com.musicinsights.listeninghistory.application.upload.dto.response.UploadStartResponse;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpHeaders;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * 최근 재생 기록 증분 동기화 API 컨트롤러.
 */
@RestController
@RequestMapping("/api/sync")
@Validated
public class SyncController {

    private static final String BEARER = "Bearer ";

    private final ListeningSyncService syncService;

    public SyncController(ListeningSyncService syncService) {
        this.syncService = syncService;
    }

    /**
     * 외부 서비스의 최근 재생 기록을 가져와 새 이벤트만 저장한다.
     *
     * @param userId        사용자 ID
     * @param authorization {@code Bearer <token>} 형식의 외부 API 접근 토큰
     * @return 접수 응답(job ID 포함)
     */
    @PostMapping("/recently-played")
    public Mono<UploadStartResponse> syncRecentlyPlayed(
            @RequestHeader("X-User-Id") @NotBlank String userId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        String token = bearerToken(authorization);
        if (token == null) {
            return Mono.error(new BadRequestException("Missing access token", "MISSING_TOKEN"));
        }
        return syncService.start(userId, token)
                .map(job -> UploadStartResponse.accepted(job.id(), "Sync started. Processing in background..."));
    }

    static String bearerToken(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER)) return null;
        String token = authorization.substring(BEARER.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
