package com.compliancegate.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * 보고서 상단 "Pipeline Context" 블록.
 * 값이 없으면 생략하지 않고 "n/a" 로 채운다.
 */
public record PipelineContext(String commit, String ref, String repository, String runUrl) {

    public static final String NOT_AVAILABLE = "n/a";
    public static final String DEFAULT_SERVER_URL = "https://github.com";

    public PipelineContext {
        commit = orNa(commit);
        ref = orNa(ref);
        repository = orNa(repository);
        runUrl = orNa(runUrl);
    }

    public static PipelineContext unavailable() {
        return new PipelineContext(null, null, null, null);
    }

    /**
     * CI 환경 변수에서 읽는다 (전부 선택):
     * GITHUB_SHA, GITHUB_REF, GITHUB_REPOSITORY, GITHUB_RUN_ID, GITHUB_SERVER_URL.
     * run URL 은 repository 와 run id 가 모두 있을 때만 만든다.
     */
    public static PipelineContext fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String repo = blankToNull(env.get("GITHUB_REPOSITORY"));
        String runId = blankToNull(env.get("GITHUB_RUN_ID"));
        String server = blankToNull(env.get("GITHUB_SERVER_URL"));
        if (server == null) server = DEFAULT_SERVER_URL;

        String runUrl = (repo != null && runId != null)
                ? stripTrailingSlash(server) + "/" + repo + "/actions/runs/" + runId
                : null;

        return new PipelineContext(env.get("GITHUB_SHA"), env.get("GITHUB_REF"), repo, runUrl);
    }

    private static String orNa(String s) {
        String v = blankToNull(s);
        return v == null ? NOT_AVAILABLE : v;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
