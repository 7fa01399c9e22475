package com.musicinsights.listeninghistory.infrastructure.mapper;

/**
 * 여러 아티스트가 참여한 트랙의 artistName 생성 방식.
 *
 * <p>Top 아티스트 집계는 "A, B" 같은 합쳐진 문자열을 별도 아티스트로 세므로
 * 호출하는 쪽에서 어느 방식을 쓸지 명시해야 한다.</p>
 */
public enum ArtistNameMode {
    /** 첫 번째 아티스트만 사용 */
    FIRST_ARTIST,
    /** 모든 아티스트를 ", "로 연결 */
    JOINED
}
