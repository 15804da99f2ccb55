package com.ryuqq.loadguard.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 캐시 가능한 계산의 입력을 고유하게 식별하는 키.
 *
 * <p>요청 식별 정보(경로, 파라미터 등)로부터 파생되며, Result Cache의 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * <p><strong>파생 규칙 ({@link #derive(String...)}):</strong></p>
 * <pre>
 * parts = ["GET", "/users", "id=42"]
 *   ↓ 각 part를 구분자(U+001F)로 연결
 *   ↓ SHA-256
 * "9f2c...e1" (소문자 hex, 64자)
 * </pre>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class Fingerprint {

    private static final int MAX_LENGTH = 255;
    private static final char PART_SEPARATOR = '\u001F';

    private final String value;

    private Fingerprint(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Fingerprint cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Fingerprint length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * Fingerprint 생성.
     *
     * @param value Fingerprint 값
     * @return Fingerprint 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Fingerprint of(String value) {
        return new Fingerprint(value);
    }

    /**
     * 요청 식별 요소로부터 Fingerprint 파생.
     *
     * <p>요소 경계가 구분자로 보존되므로 ["ab", "c"]와 ["a", "bc"]는 서로 다른 값이 됩니다.</p>
     *
     * @param parts 요청 식별 요소 (1개 이상, null 요소 불가)
     * @return SHA-256 hex 값을 가진 Fingerprint
     * @throws IllegalArgumentException parts가 비어 있거나 null 요소를 포함하는 경우
     */
    public static Fingerprint derive(String... parts) {
        if (parts == null || parts.length == 0) {
            throw new IllegalArgumentException("parts cannot be null or empty");
        }
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (parts[i] == null) {
                throw new IllegalArgumentException("parts cannot contain null (index: " + i + ")");
            }
            if (i > 0) {
                joined.append(PART_SEPARATOR);
            }
            joined.append(parts[i]);
        }
        return new Fingerprint(sha256Hex(joined.toString()));
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16));
                hex.append(Character.forDigit(b & 0xF, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // 모든 JDK는 SHA-256을 제공해야 함
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Fingerprint 값 조회.
     *
     * @return Fingerprint 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Fingerprint that = (Fingerprint) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Fingerprint{" + value + '}';
    }
}
