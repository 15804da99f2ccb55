package com.ryuqq.loadguard.core.admission.noop;

import com.ryuqq.loadguard.core.admission.AdmissionConfig;
import com.ryuqq.loadguard.core.admission.AdmissionController;
import com.ryuqq.loadguard.core.admission.AdmissionDecision;

/**
 * Admission Controller NoOp 구현.
 *
 * <p>Rate Limiting을 적용하지 않습니다.
 * 개발 및 테스트 환경이나 파이프라인에서 admission 단계를 생략하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>allow(): 항상 true 반환</li>
 *   <li>evaluate(): 항상 허용 결정 반환</li>
 *   <li>getConfig(): 사실상 무제한 설정 반환</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class NoOpAdmissionController implements AdmissionController {

    private static final AdmissionConfig UNLIMITED_CONFIG =
        new AdmissionConfig(Long.MAX_VALUE, Long.MAX_VALUE, 1);

    @Override
    public AdmissionDecision evaluate(String key) {
        return AdmissionDecision.allow();
    }

    @Override
    public AdmissionConfig getConfig() {
        return UNLIMITED_CONFIG;
    }
}
