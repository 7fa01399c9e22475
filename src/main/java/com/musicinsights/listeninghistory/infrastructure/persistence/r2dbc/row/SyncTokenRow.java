package com.musicinsights.listeninghistory.infrastructure.persistence.r2dbc.row;

/**
 * 주기 동기화에 사용할 사용자 자격 증명입니다.
 *
 * @param userId      사용자 ID
 * @param accessToken 외부 API 접근 토큰(불투명 문자열)
 */
public record SyncTokenRow(String userId, String accessToken) {}
