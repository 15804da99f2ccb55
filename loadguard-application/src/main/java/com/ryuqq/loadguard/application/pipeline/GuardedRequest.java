package com.ryuqq.loadguard.application.pipeline;

import com.ryuqq.loadguard.core.model.Fingerprint;

/**
 * Pipeline에 들어오는 요청 식별 정보.
 *
 * <p>clientKey는 Admission 버킷을, fingerprint는 캐시 엔트리를 선택합니다.</p>
 *
 * <pre>
 * GuardedRequest request = GuardedRequest.of("tenant-42", "GET", "/api/products", "page=1");
 * </pre>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 * @param clientKey 클라이언트 키 (null/blank 불가)
 * @param fingerprint 요청 Fingerprint (null 불가)
 */
public record GuardedRequest(String clientKey, Fingerprint fingerprint) {

    public GuardedRequest {
        if (clientKey == null || clientKey.isBlank()) {
            throw new IllegalArgumentException("clientKey cannot be null or blank");
        }
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
    }

    /**
     * 요청 식별 요소로부터 GuardedRequest 생성.
     *
     * @param clientKey 클라이언트 키
     * @param identityParts 요청 식별 요소 (method, path, query 등)
     * @return GuardedRequest
     * @throws IllegalArgumentException identityParts가 비어있는 경우
     */
    public static GuardedRequest of(String clientKey, String... identityParts) {
        return new GuardedRequest(clientKey, Fingerprint.derive(identityParts));
    }
}
