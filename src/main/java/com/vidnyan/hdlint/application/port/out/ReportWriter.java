package com.vidnyan.hdlint.application.port.out;

import com.vidnyan.hdlint.domain.report.DiagnosticsReport;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port for persisting a diagnostics report in a machine readable form.
 */
public interface ReportWriter {

    void write(DiagnosticsReport report, Path target) throws IOException;
}
