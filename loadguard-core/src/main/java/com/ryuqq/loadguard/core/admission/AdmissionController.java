package com.ryuqq.loadguard.core.admission;

/**
 * Admission Controller SPI.
 *
 * <p>요청 키(클라이언트 ID, API 키 등)별로 요청을 핸들러에 통과시킬지 즉시 결정합니다.
 * 대기하지 않으며, 거부는 오류가 아닌 정상 결과입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * AdmissionController admission = ...;
 *
 * AdmissionDecision decision = admission.evaluate("client-42");
 * if (!decision.allowed()) {
 *     // HTTP 429 + Retry-After
 *     return tooManyRequests(decision.retryAfterMillis());
 * }
 * return handler.handle(request);
 * }</pre>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public interface AdmissionController {

    /**
     * 요청 허용 여부 결정 (비블로킹).
     *
     * @param key 요청 키
     * @return true: 허용 (토큰 1개 소비), false: 거부
     * @throws IllegalArgumentException key가 null이거나 빈 문자열인 경우
     */
    default boolean allow(String key) {
        return evaluate(key).allowed();
    }

    /**
     * 요청 허용 여부와 재시도 힌트 결정 (비블로킹).
     *
     * <p>거부 시 다음 토큰이 생길 때까지의 대기 시간을 함께 반환합니다.</p>
     *
     * @param key 요청 키
     * @return 결정 결과
     * @throws IllegalArgumentException key가 null이거나 빈 문자열인 경우
     */
    AdmissionDecision evaluate(String key);

    /**
     * 설정 정보 조회.
     *
     * @return Admission 설정
     */
    AdmissionConfig getConfig();
}
