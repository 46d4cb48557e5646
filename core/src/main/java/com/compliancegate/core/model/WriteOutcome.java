package com.compliancegate.core.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** 보고서 파일 쓰기 결과 */
public record WriteOutcome(Path path, boolean written, String error) {

    public WriteOutcome {
        Objects.requireNonNull(path, "path");
        if (written && error != null) throw new IllegalArgumentException("written outcome cannot carry an error");
    }

    public static WriteOutcome success(Path path) { return new WriteOutcome(path, true, null); }

    public static WriteOutcome failure(Path path, String error) {
        return new WriteOutcome(path, false, error == null ? "unknown error" : error);
    }

    public Optional<String> errorOpt() { return Optional.ofNullable(error); }
}
