package com.musicinsights.listeninghistory.application.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * {@link UploadJob} 상태 변경 테스트.
 */
@DisplayName("upload job 테스트")
class UploadJobTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @DisplayName("진행률이 0~100으로 제한되고 감소하지 않는지 검증")
    @Test
    void advance_progressClampedAndMonotonic() {
        UploadJob job = UploadJob.pending("u1-1", "u1", "Upload started", T0)
                .advance(JobStatus.EXTRACTING, 15, "Extracting", T0)
                .advance(JobStatus.EXTRACTING, 5, "still extracting", T0);

        assertThat(job.progress()).isEqualTo(15);
        assertThat(job.message()).isEqualTo("still extracting");

        UploadJob over = job.advance(JobStatus.PROCESSING, 250, "x", T0);
        assertThat(over.progress()).isEqualTo(100);
    }

    @DisplayName("완료 시 진행률 100과 결과가 채워지고, 실패 시 진행률을 유지한 채 사유가 채워지는지 검증")
    @Test
    void completeAndFail() {
        UploadJob storing = UploadJob.pending("u1-1", "u1", "Upload started", T0)
                .advance(JobStatus.EXTRACTING, 15, "e", T0)
                .advance(JobStatus.PROCESSING, 25, "p", T0)
                .advance(JobStatus.STORING, 60, "s", T0);

        JobResult result = new JobResult(2, 2, null, T0, T0);
        UploadJob done = storing.complete(result, "Upload completed successfully", T0.plusSeconds(5));
        assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.progress()).isEqualTo(100);
        assertThat(done.result()).isEqualTo(result);
        assertThat(done.error()).isNull();
        assertThat(done.updatedAt()).isEqualTo(T0.plusSeconds(5));

        UploadJob failed = storing.fail("disk full", T0);
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.progress()).isEqualTo(60);
        assertThat(failed.error()).isEqualTo("disk full");
        assertThat(failed.message()).isEqualTo("Failed: disk full");
        assertThat(failed.result()).isNull();
    }

    @DisplayName("단계를 건너뛰거나 종료 상태를 advance로 진입하면 예외가 발생하는지 검증")
    @Test
    void illegalTransitions_throw() {
        UploadJob pending = UploadJob.pending("u1-1", "u1", "Upload started", T0);

        assertThatThrownBy(() -> pending.advance(JobStatus.STORING, 30, "skip", T0))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> pending.advance(JobStatus.COMPLETED, 100, "x", T0))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> pending.complete(new JobResult(0, 0, null, null, null), "x", T0))
                .isInstanceOf(IllegalStateException.class);

        UploadJob failed = pending.fail("boom", T0);
        assertThatThrownBy(() -> failed.fail("again", T0)).isInstanceOf(IllegalStateException.class);
    }
}
