/**
 * Store SPI Contract Test 패키지.
 *
 * <p>Store SPI 구현체가 지켜야 할 계약을 JUnit 5 추상 테스트로 제공합니다.
 * 구현 모듈은 테스트 소스에서 이 클래스들을 상속하고 {@code createStore()}만 구현합니다.</p>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
package com.ryuqq.loadguard.testkit.contract;
