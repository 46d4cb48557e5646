package com.compliancegate.core.summary;

import java.util.Objects;
import java.util.Optional;

/**
 * Gitleaks 발견 건수 추론 결과.
 * 인식 성공이면 count + variant, 실패면 error 만 갖는다 (0 으로 취급 금지).
 */
public record SecretCount(Long count, SecretFindingCounter.Variant variant, String error) {

    public static final String UNKNOWN_STRUCTURE = "Unknown Gitleaks JSON structure (no findings array found)";

    public SecretCount {
        if ((count == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of count/error must be set");
        }
        if (count != null) Objects.requireNonNull(variant, "variant");
    }

    public static SecretCount of(long count, SecretFindingCounter.Variant variant) {
        return new SecretCount(count, variant, null);
    }

    public static SecretCount unknownStructure() {
        return new SecretCount(null, null, UNKNOWN_STRUCTURE);
    }

    public boolean determined() { return count != null; }

    public Optional<Long> countOpt() { return Optional.ofNullable(count); }

    public Optional<String> errorOpt() { return Optional.ofNullable(error); }
}
