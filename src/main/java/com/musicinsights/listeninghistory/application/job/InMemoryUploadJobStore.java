package com.musicinsights.listeninghistory.application.job;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 메모리 기반 job 저장소.
 *
 * <p>job마다 쓰기 주체는 실행 중인 파이프라인 단계 하나뿐이므로 별도 잠금 없이
 * 마지막 쓰기가 우선한다. 프로세스 재시작 시 내용은 사라진다.</p>
 */
@Component
public class InMemoryUploadJobStore implements UploadJobStore {

    private final Map<String, UploadJob> jobs = new ConcurrentHashMap<>();

    @Override
    public void save(UploadJob job) {
        jobs.put(job.id(), job);
    }

    @Override
    public Optional<UploadJob> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public int removeCreatedBefore(Instant cutoff) {
        int before = jobs.size();
        jobs.values().removeIf(j -> j.createdAt().isBefore(cutoff));
        return before - jobs.size();
    }
}
