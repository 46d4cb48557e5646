package com.compliancegate.core.report;

import com.compliancegate.core.model.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * 보고서 파일 기록. 임시파일 → 원자적 이동으로 반쯤 쓰인 파일이 남지 않게 한다.
 * 실패는 예외 대신 {@link WriteOutcome} 으로 돌려준다.
 * 오케스트레이터 테스트에서 실패를 주입할 수 있도록 상속을 열어 둔다.
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    public WriteOutcome write(Path target, String content) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(content, "content");
        try {
            writeAtomically(target, content);
            LOG.info("Report written: {}", target.toAbsolutePath());
            return WriteOutcome.success(target);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to write compliance report to {}: {}", target, e.toString());
            return WriteOutcome.failure(target, e.toString());
        }
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
