package com.musicinsights.listeninghistory.application.sync.service;

import com.musicinsights.listeninghistory.application.listening.model.ListeningEvent;
import com.musicinsights.listeninghistory.application.listening.model.NaturalKey;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 증분 동기화용 중복 제거기.
 *
 * <p>새로 가져온 이벤트 중 참조 구간(최근 저장 이벤트 N건)에 같은 자연키가 없는 것만 남긴다.
 * 참조 구간은 전체 기록이 아니므로 전체 기록 대비 중복이 없음을 보장하지 않는다.</p>
 */
@Component
public class ListeningDeduplicator {

    /**
     * 참조 구간에 없는 이벤트만 반환한다. 입력 순서를 유지하며 입력을 변경하지 않는다.
     *
     * @param fetched   새로 가져온 이벤트
     * @param reference 최근 저장 이벤트(참조 구간)
     * @return 새 이벤트
     */
    public List<ListeningEvent> filterNew(List<ListeningEvent> fetched, Collection<ListeningEvent> reference) {
        Set<NaturalKey> existing = new HashSet<>(reference.size() * 2);
        for (ListeningEvent e : reference) {
            existing.add(e.naturalKey());
        }
        return fetched.stream()
                .filter(e -> !existing.contains(e.naturalKey()))
                .toList();
    }

    /**
     * 외부 조회의 since 기준(참조 구간에서 가장 최근 재생 시각)을 구한다.
     *
     * @param reference 최근 저장 이벤트
     * @return 가장 최근 재생 시각(저장된 기록이 없으면 empty)
     */
    public Optional<Instant> sinceBoundary(Collection<ListeningEvent> reference) {
        return reference.stream()
                .map(ListeningEvent::playedAt)
                .max(Comparator.naturalOrder());
    }
}
