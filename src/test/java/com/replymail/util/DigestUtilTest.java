package com.replymail.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DigestUtil unit tests
 */
class DigestUtilTest {

    @Test
    @DisplayName("SHA-256 is deterministic and hex encoded")
    void testSha256() {
        String first = DigestUtil.sha256("subject", "body");
        String second = DigestUtil.sha256("subject", "body");

        assertThat(first).isEqualTo(second);
        assertThat(first).matches("[0-9a-f]{64}");
    }

    @Test
    @DisplayName("Part boundaries matter")
    void testSha256PartBoundaries() {
        assertThat(DigestUtil.sha256("ab", "c")).isNotEqualTo(DigestUtil.sha256("a", "bc"));
    }
}
