package com.compliancegate.core.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * compliance-gate.yml 을 읽어 GateConfig 로 변환 + 환경 변수 오버라이드.
 * 파일이 없으면 기본값. 우선순위: ARTIFACT_DIR 환경 변수 > YAML > 기본값.
 *
 * 예상 YAML 키:
 * artifactDir: "artifacts"
 * readConcurrency: 5
 * output:
 *   reportFile: "compliance-report.md"
 *   jsonFile: "compliance-report.json"
 *   alsoJson: false
 *   stepSummary: true
 */
public final class GateConfigLoader {

    public static final String DEFAULT_FILE = "compliance-gate.yml";
    public static final String ENV_ARTIFACT_DIR = "ARTIFACT_DIR";
    public static final String ENV_CONFIG = "COMPLIANCE_GATE_CONFIG";
    public static final String PROP_CONFIG = "cg.config";

    private GateConfigLoader() {}

    /** 설정 파일 위치: -Dcg.config > COMPLIANCE_GATE_CONFIG > ./compliance-gate.yml */
    public static Path locate(Map<String, String> env) {
        String p = System.getProperty(PROP_CONFIG);
        if (p == null || p.isBlank()) p = env.get(ENV_CONFIG);
        if (p == null || p.isBlank()) p = DEFAULT_FILE;
        return Path.of(p.trim());
    }

    public static GateConfig load(Path yamlPath, Map<String, String> env) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        Objects.requireNonNull(env, "env");

        GateConfig cfg = GateConfig.defaults();
        if (Files.exists(yamlPath)) {
            applyYaml(yamlPath, cfg);
        }

        String dir = env.get(ENV_ARTIFACT_DIR);
        if (dir != null && !dir.isBlank()) {
            cfg.setArtifactDir(Path.of(dir.trim()));
        }

        cfg.validate();
        return cfg;
    }

    private static void applyYaml(Path yamlPath, GateConfig cfg) throws IOException {
        Object root;
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("Malformed config " + yamlPath + ": " + e.getMessage(), e);
        }

        // 비어있거나 단순 스칼라면 defaults 유지
        if (!(root instanceof Map<?, ?> map)) return;

        setString(map, "artifactDir", s -> cfg.setArtifactDir(Path.of(s)));
        setInt(map, "readConcurrency", cfg::setReadConcurrency);

        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            GateConfig.Output o = cfg.output();
            setString(output, "reportFile", o::setReportFile);
            setString(output, "jsonFile", o::setJsonFile);
            setBoolean(output, "alsoJson", o::setAlsoJson);
            setBoolean(output, "stepSummary", o::setStepSummary);
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v).trim());
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) {
            try {
                setter.accept(Integer.parseInt(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer: " + v, e);
            }
        }
    }
}
