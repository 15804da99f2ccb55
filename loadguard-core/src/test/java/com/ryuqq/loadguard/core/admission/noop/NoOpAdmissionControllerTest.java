package com.ryuqq.loadguard.core.admission.noop;

import com.ryuqq.loadguard.core.admission.AdmissionController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpAdmissionController 유닛 테스트.
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
@DisplayName("NoOpAdmissionController 테스트")
class NoOpAdmissionControllerTest {

    @Test
    @DisplayName("allow() 는 몇 번을 호출해도 true를 반환한다")
    void allow_항상_true_반환() {
        // given
        AdmissionController admission = new NoOpAdmissionController();

        // when & then
        for (int i = 0; i < 1000; i++) {
            assertTrue(admission.allow("client-1"));
        }
    }

    @Test
    @DisplayName("evaluate() 는 재시도 힌트 없이 허용한다")
    void evaluate_허용_반환() {
        // given
        AdmissionController admission = new NoOpAdmissionController();

        // when
        var decision = admission.evaluate("client-1");

        // then
        assertTrue(decision.allowed());
        assertEquals(0L, decision.retryAfterNanos());
    }

    @Test
    @DisplayName("getConfig() 는 무제한에 가까운 설정을 반환한다")
    void getConfig_무제한_설정_반환() {
        // given
        AdmissionController admission = new NoOpAdmissionController();

        // when
        var config = admission.getConfig();

        // then
        assertEquals(Long.MAX_VALUE, config.capacity());
    }
}
