package com.musicinsights.listeninghistory.application.job;

import java.time.Instant;
import java.util.Optional;

/**
 * job 상태 저장소.
 *
 * <p>기본 구현은 프로세스 메모리({@link InMemoryUploadJobStore})이며,
 * 파이프라인 코드 변경 없이 영속 저장소로 교체할 수 있도록 인터페이스로 분리한다.</p>
 */
public interface UploadJobStore {

    void save(UploadJob job);

    Optional<UploadJob> find(String jobId);

    /**
     * 주어진 시각 이전에 생성된 job을 제거한다.
     *
     * @param cutoff 기준 시각
     * @return 제거된 job 수
     */
    int removeCreatedBefore(Instant cutoff);
}
