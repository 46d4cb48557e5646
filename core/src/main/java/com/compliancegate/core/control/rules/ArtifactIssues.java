package com.compliancegate.core.control.rules;

import com.compliancegate.core.model.ArtifactReadResult;

import java.util.Optional;

/** 누락/무효 산출물에 대한 공통 문구 */
final class ArtifactIssues {
    private ArtifactIssues() {}

    /** 사용할 수 없는 산출물이면 이유 문구, 정상이면 empty */
    static Optional<String> describe(ArtifactReadResult r) {
        if (!r.found()) return Optional.of(r.name() + " not found");
        if (!r.parsed()) return Optional.of(r.name() + " is not valid JSON (" + r.errorOpt().orElse("unknown error") + ")");
        return Optional.empty();
    }
}
