package com.compliancegate.core.model;

/** 파이프라인이 artifactDir에 떨어뜨리는 스캐너 산출물 5종 (파일명 고정) */
public enum Artifact {
    SECRETS("gitleaks.json"),
    VULN_FS("trivy-fs.json"),
    VULN_IMAGE("trivy-image.json"),
    HARDENING("dockle.json"),
    SBOM("sbom.json");

    private final String fileName;

    Artifact(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() { return fileName; }
}
