package com.mendwatch.core.report;

import java.nio.file.Path;

/**
 * The markdown and JSON files written for one report.
 */
public record ReportFiles(Path markdown, Path json) {}
