package com.compliancegate.core.report;

import java.io.PrintStream;
import java.util.Objects;

/** 표준 출력으로 보고서를 흘린다. 본문은 파일과 동일, 앞뒤 배너만 추가. */
public final class ConsoleReportSink implements ReportSink {

    static final String HEADER = "\n=== Compliance Report ===\n";
    static final String FOOTER = "\n=== End of Compliance Report ===\n";

    private final PrintStream out;

    public ConsoleReportSink(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public String name() { return "console"; }

    @Override
    public void emit(String document) {
        out.println(HEADER);
        out.println(document);
        out.println(FOOTER);
        out.flush();
    }
}
