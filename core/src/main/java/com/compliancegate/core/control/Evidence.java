package com.compliancegate.core.control;

import com.compliancegate.core.model.Artifact;
import com.compliancegate.core.model.ArtifactReadResult;
import com.compliancegate.core.model.HardeningSummary;
import com.compliancegate.core.model.VulnerabilitySummary;
import com.compliancegate.core.summary.HardeningSummarizer;
import com.compliancegate.core.summary.SecretCount;
import com.compliancegate.core.summary.SecretFindingCounter;
import com.compliancegate.core.summary.VulnerabilitySummarizer;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 모든 컨트롤 규칙이 공유하는 증거 묶음 (불변).
 * 읽기 결과 5개 + 파싱된 것에서만 파생한 요약.
 */
public final class Evidence {

    private final Map<Artifact, ArtifactReadResult> reads;
    private final SecretCount secretCount;             // SECRETS 가 파싱된 경우만
    private final VulnerabilitySummary fsSummary;      // nullable: 요약 불가
    private final VulnerabilitySummary imageSummary;   // nullable
    private final HardeningSummary hardeningSummary;   // nullable

    private Evidence(Map<Artifact, ArtifactReadResult> reads,
                     SecretCount secretCount,
                     VulnerabilitySummary fsSummary,
                     VulnerabilitySummary imageSummary,
                     HardeningSummary hardeningSummary) {
        this.reads = reads;
        this.secretCount = secretCount;
        this.fsSummary = fsSummary;
        this.imageSummary = imageSummary;
        this.hardeningSummary = hardeningSummary;
    }

    /** 읽기 결과에서 요약을 파생해 증거를 만든다. 5종이 모두 있어야 한다. */
    public static Evidence collect(Map<Artifact, ArtifactReadResult> reads) {
        return collect(reads, new SecretFindingCounter(), new VulnerabilitySummarizer(), new HardeningSummarizer());
    }

    static Evidence collect(Map<Artifact, ArtifactReadResult> reads,
                            SecretFindingCounter secrets,
                            VulnerabilitySummarizer vulns,
                            HardeningSummarizer hardening) {
        Objects.requireNonNull(reads, "reads");
        EnumMap<Artifact, ArtifactReadResult> copy = new EnumMap<>(Artifact.class);
        for (Artifact a : Artifact.values()) {
            copy.put(a, Objects.requireNonNull(reads.get(a), () -> "missing read result for " + a));
        }

        SecretCount sc = copy.get(Artifact.SECRETS).dataOpt().map(secrets::count).orElse(null);
        VulnerabilitySummary fs = copy.get(Artifact.VULN_FS).dataOpt().flatMap(vulns::summarize).orElse(null);
        VulnerabilitySummary img = copy.get(Artifact.VULN_IMAGE).dataOpt().flatMap(vulns::summarize).orElse(null);
        HardeningSummary hs = copy.get(Artifact.HARDENING).dataOpt().flatMap(hardening::summarize).orElse(null);

        return new Evidence(copy, sc, fs, img, hs);
    }

    public ArtifactReadResult secrets()    { return reads.get(Artifact.SECRETS); }
    public ArtifactReadResult vulnFs()     { return reads.get(Artifact.VULN_FS); }
    public ArtifactReadResult vulnImage()  { return reads.get(Artifact.VULN_IMAGE); }
    public ArtifactReadResult hardening()  { return reads.get(Artifact.HARDENING); }
    public ArtifactReadResult sbom()       { return reads.get(Artifact.SBOM); }

    public Optional<SecretCount> secretCount()               { return Optional.ofNullable(secretCount); }
    public Optional<VulnerabilitySummary> fsSummary()        { return Optional.ofNullable(fsSummary); }
    public Optional<VulnerabilitySummary> imageSummary()     { return Optional.ofNullable(imageSummary); }
    public Optional<HardeningSummary> hardeningSummary()     { return Optional.ofNullable(hardeningSummary); }
}
