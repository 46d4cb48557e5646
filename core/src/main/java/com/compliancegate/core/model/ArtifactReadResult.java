package com.compliancegate.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * 산출물 1개를 읽은 결과.
 * <ul>
 *   <li>found=false            : 파일 없음</li>
 *   <li>found=true, parsed=false: 파일은 있으나 읽기 실패 또는 JSON 아님</li>
 *   <li>found=true, parsed=true : JSON 파싱 성공 (data 보유)</li>
 * </ul>
 * parsed ⇒ found, data 는 parsed 일 때만 존재, error 는 parsed 가 아닐 때만 존재.
 * data 는 꺼낼 때마다 사본을 준다 (JsonNode 가 가변이라 원본은 밖으로 내보내지 않음).
 */
public record ArtifactReadResult(String name,
                                 Path path,
                                 boolean found,
                                 boolean parsed,
                                 JsonNode data,
                                 String error) {

    public ArtifactReadResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        if (parsed && !found) throw new IllegalArgumentException("parsed requires found");
        if (parsed != (data != null)) throw new IllegalArgumentException("data must be present iff parsed");
        if (parsed == (error != null)) throw new IllegalArgumentException("error must be present iff not parsed");
    }

    public static ArtifactReadResult notFound(String name, Path path) {
        return new ArtifactReadResult(name, path, false, false, null, "File not found");
    }

    public static ArtifactReadResult unreadable(String name, Path path, String message) {
        return new ArtifactReadResult(name, path, true, false, null, "Read error: " + message);
    }

    public static ArtifactReadResult invalidJson(String name, Path path, String message) {
        return new ArtifactReadResult(name, path, true, false, null, "Invalid JSON: " + message);
    }

    public static ArtifactReadResult parsed(String name, Path path, JsonNode data) {
        return new ArtifactReadResult(name, path, true, true, Objects.requireNonNull(data, "data"), null);
    }

    /** 파일 존재 + 유효 JSON */
    public boolean usable() { return found && parsed; }

    @Override
    public JsonNode data() { return data == null ? null : data.deepCopy(); }

    public Optional<JsonNode> dataOpt() { return Optional.ofNullable(data()); }

    public Optional<String> errorOpt() { return Optional.ofNullable(error); }
}
