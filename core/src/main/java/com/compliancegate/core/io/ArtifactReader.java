package com.compliancegate.core.io;

import com.compliancegate.core.model.Artifact;
import com.compliancegate.core.model.ArtifactReadResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * artifactDir 아래의 스캐너 JSON 을 읽어 {@link ArtifactReadResult} 로 분류한다.
 * 어떤 I/O·파싱 실패도 예외로 내보내지 않고 결과 필드에 담는다.
 * 디렉터리는 만들지 않는다.
 */
public final class ArtifactReader {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactReader.class);

    private final Path dir;
    private final ObjectMapper om = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public ArtifactReader(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    public ArtifactReadResult read(Artifact artifact) {
        return read(artifact.fileName());
    }

    public ArtifactReadResult read(String name) {
        Path path = dir.resolve(name);

        final String content;
        try {
            // 잘못된 UTF-8 은 치환 문자로 읽고 JSON 파서가 판단하게 둔다
            content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            LOG.debug("Artifact not found: {}", path);
            return ArtifactReadResult.notFound(name, path);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Artifact read failed: {} ({})", path, e.toString());
            return ArtifactReadResult.unreadable(name, path, oneLine(String.valueOf(e.getMessage())));
        }

        try {
            JsonNode node = om.readTree(content);
            if (node == null || node.isMissingNode()) {
                return ArtifactReadResult.invalidJson(name, path, "empty document");
            }
            return ArtifactReadResult.parsed(name, path, node);
        } catch (JsonProcessingException e) {
            LOG.debug("Artifact is not valid JSON: {}", path);
            return ArtifactReadResult.invalidJson(name, path, oneLine(e.getOriginalMessage()));
        }
    }

    static String oneLine(String s) {
        if (s == null) return "unknown error";
        return s.replaceAll("\\s+", " ").trim();
    }
}
