package com.compliancegate.core.control;

import com.compliancegate.core.model.Artifact;
import com.compliancegate.core.model.ArtifactReadResult;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/** 디스크 없이 Evidence 를 조립하는 테스트 헬퍼 (기본: 전부 없음) */
public final class EvidenceFixtures {

    private static final ObjectMapper OM = new ObjectMapper();
    private static final Path DIR = Path.of("artifacts");

    public static final String CLEAN_TRIVY = "{\"SchemaVersion\":2,\"Results\":[{\"Target\":\"app\",\"Vulnerabilities\":[]}]}";

    private final Map<Artifact, ArtifactReadResult> reads = new EnumMap<>(Artifact.class);

    private EvidenceFixtures() {
        for (Artifact a : Artifact.values()) {
            reads.put(a, ArtifactReadResult.notFound(a.fileName(), DIR.resolve(a.fileName())));
        }
    }

    public static EvidenceFixtures allMissing() { return new EvidenceFixtures(); }

    /** 시나리오 2: 모든 산출물이 깨끗한 상태 */
    public static EvidenceFixtures allClean() {
        return new EvidenceFixtures()
                .json(Artifact.SECRETS, "[]")
                .json(Artifact.VULN_FS, CLEAN_TRIVY)
                .json(Artifact.VULN_IMAGE, CLEAN_TRIVY)
                .json(Artifact.HARDENING, "{\"details\":[]}")
                .json(Artifact.SBOM, "{}");
    }

    public EvidenceFixtures json(Artifact a, String content) {
        try {
            reads.put(a, ArtifactReadResult.parsed(a.fileName(), DIR.resolve(a.fileName()), OM.readTree(content)));
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public EvidenceFixtures invalid(Artifact a) {
        reads.put(a, ArtifactReadResult.invalidJson(a.fileName(), DIR.resolve(a.fileName()), "Unexpected character"));
        return this;
    }

    public EvidenceFixtures missing(Artifact a) {
        reads.put(a, ArtifactReadResult.notFound(a.fileName(), DIR.resolve(a.fileName())));
        return this;
    }

    public Evidence build() { return Evidence.collect(reads); }
}
