package com.ryuqq.jobpool.application.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JobEngines 유닛 테스트.
 *
 * @author JobPool Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class JobEnginesTest {

    @Mock
    private JobEngine engine;

    @Mock
    private JobEngine another;

    @AfterEach
    void tearDown() {
        JobEngines.uninstall();
    }

    @Test
    void 설치_전_get_예외() {
        // when & then
        assertThatThrownBy(JobEngines::get)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("install");
        assertThat(JobEngines.find()).isEmpty();
    }

    @Test
    void 설치_후_get_동일_인스턴스() {
        // when
        JobEngines.install(engine);

        // then
        assertThat(JobEngines.get()).isSameAs(engine);
        assertThat(JobEngines.find()).containsSame(engine);
    }

    @Test
    void 중복_설치_예외() {
        // given
        JobEngines.install(engine);

        // when & then
        assertThatThrownBy(() -> JobEngines.install(another))
            .isInstanceOf(IllegalStateException.class);
        assertThat(JobEngines.get()).isSameAs(engine);
    }

    @Test
    void null_설치_예외() {
        // when & then
        assertThatThrownBy(() -> JobEngines.install(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 해제_후_재설치_가능() {
        // given
        JobEngines.install(engine);

        // when
        assertThat(JobEngines.uninstall()).containsSame(engine);
        JobEngines.install(another);

        // then
        assertThat(JobEngines.get()).isSameAs(another);
    }
}
