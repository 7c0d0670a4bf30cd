package com.ryuqq.jobpool.application.engine;

import com.ryuqq.jobpool.core.model.JobId;
import com.ryuqq.jobpool.core.model.RejectionReason;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SubmissionHandle 유닛 테스트.
 *
 * @author JobPool Team
 * @since 1.0.0
 */
class SubmissionHandleTest {

    @Test
    void accepted_핸들_생성() {
        // given
        JobId jobId = JobId.of("job-accepted");

        // when
        SubmissionHandle handle = SubmissionHandle.accepted(jobId);

        // then
        assertThat(handle.isAccepted()).isTrue();
        assertThat(handle.getJobIdOrNull()).isEqualTo(jobId);
        assertThat(handle.getRejectionReasonOrNull()).isNull();
    }

    @Test
    void rejected_핸들_생성() {
        // when
        SubmissionHandle handle = SubmissionHandle.rejected(RejectionReason.QUEUE_FULL);

        // then
        assertThat(handle.isAccepted()).isFalse();
        assertThat(handle.getJobIdOrNull()).isNull();
        assertThat(handle.getRejectionReasonOrNull()).isEqualTo(RejectionReason.QUEUE_FULL);
    }

    @Test
    void accepted_null_JobId_예외() {
        // when & then
        assertThatThrownBy(() -> SubmissionHandle.accepted(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }

    @Test
    void rejected_null_사유_예외() {
        // when & then
        assertThatThrownBy(() -> SubmissionHandle.rejected(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }

    @Test
    void toString_상태_포함() {
        // given
        SubmissionHandle accepted = SubmissionHandle.accepted(JobId.of("job-1"));
        SubmissionHandle rejected = SubmissionHandle.rejected(RejectionReason.POOL_SHUTTING_DOWN);

        // then
        assertThat(accepted.toString()).contains("job-1");
        assertThat(rejected.toString()).contains("POOL_SHUTTING_DOWN");
    }
}
