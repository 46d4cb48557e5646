package com.compliancegate.core.report;

import java.io.IOException;

/** 최종 보고서 본문을 받는 보조 출력 채널 (콘솔, CI step summary 등) */
public interface ReportSink {
    String name();

    void emit(String document) throws IOException;
}
