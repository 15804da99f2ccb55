package com.ryuqq.loadguard.application.pipeline;

import com.ryuqq.loadguard.core.model.Fingerprint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GuardedRequest 유닛 테스트.
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
class GuardedRequestTest {

    @Test
    void of_같은_식별요소는_같은_fingerprint() {
        // when
        GuardedRequest first = GuardedRequest.of("client-1", "GET", "/api/items", "page=1");
        GuardedRequest second = GuardedRequest.of("client-2", "GET", "/api/items", "page=1");

        // then
        assertThat(first.fingerprint()).isEqualTo(second.fingerprint());
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void of_식별요소_경계가_다르면_다른_fingerprint() {
        // when
        GuardedRequest ab = GuardedRequest.of("client-1", "ab", "c");
        GuardedRequest abc = GuardedRequest.of("client-1", "a", "bc");

        // then
        assertThat(ab.fingerprint()).isNotEqualTo(abc.fingerprint());
    }

    @Test
    void clientKey_blank_예외() {
        assertThatThrownBy(() -> new GuardedRequest(" ", Fingerprint.of("fp")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("clientKey cannot be null or blank");
    }

    @Test
    void fingerprint_null_예외() {
        assertThatThrownBy(() -> new GuardedRequest("client-1", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("fingerprint cannot be null");
    }

    @Test
    void of_식별요소_없으면_예외() {
        assertThatThrownBy(() -> GuardedRequest.of("client-1"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
