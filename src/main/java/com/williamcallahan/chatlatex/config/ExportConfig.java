package com.williamcallahan.chatlatex.config;

import java.time.Duration;
import java.util.Locale;

/**
 * PDF export configuration: compiler invocation and the directories export reads and writes.
 */
public class ExportConfig {

    private static final String COMPILER_DEF = "pdflatex";
    private static final int PASSES_DEF = 2;
    private static final Duration TIMEOUT_DEF = Duration.ofSeconds(60);
    private static final String JOB_NAME_DEF = "chat_export";
    private static final String DEBUG_DIR_DEF = "data/latex-debug";
    private static final String HISTORY_DIR_DEF = "history";
    private static final int MIN_POSITIVE = 1;
    private static final String COMPILER_KEY = "app.export.compiler-command";
    private static final String PASSES_KEY = "app.export.compile-passes";
    private static final String TIMEOUT_KEY = "app.export.compile-timeout";
    private static final String JOB_NAME_KEY = "app.export.job-name";
    private static final String DEBUG_DIR_KEY = "app.export.debug-dir";
    private static final String HISTORY_DIR_KEY = "app.export.history-dir";
    private static final String NULL_TEXT_FMT = "%s must not be null.";
    private static final String BLANK_TEXT_FMT = "%s must not be blank.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private String compilerCommand = COMPILER_DEF;
    private int compilePasses = PASSES_DEF;
    private Duration compileTimeout = TIMEOUT_DEF;
    private String jobName = JOB_NAME_DEF;
    private String debugDir = DEBUG_DIR_DEF;
    private String historyDir = HISTORY_DIR_DEF;

    /**
     * Validates export settings.
     */
    public void validateConfiguration() {
        requireText(COMPILER_KEY, compilerCommand);
        requireText(JOB_NAME_KEY, jobName);
        requireText(DEBUG_DIR_KEY, debugDir);
        requireText(HISTORY_DIR_KEY, historyDir);
        if (compilePasses < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, PASSES_KEY));
        }
        if (compileTimeout == null || compileTimeout.isZero() || compileTimeout.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, TIMEOUT_KEY));
        }
    }

    public String getCompilerCommand() {
        return compilerCommand;
    }

    public void setCompilerCommand(String compilerCommand) {
        this.compilerCommand = compilerCommand;
    }

    public int getCompilePasses() {
        return compilePasses;
    }

    public void setCompilePasses(int compilePasses) {
        this.compilePasses = compilePasses;
    }

    public Duration getCompileTimeout() {
        return compileTimeout;
    }

    public void setCompileTimeout(Duration compileTimeout) {
        this.compileTimeout = compileTimeout;
    }

    /**
     * Returns the base name of the generated {@code .tex}, {@code .log} and {@code .pdf} files.
     */
    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    /**
     * Returns where sources and compiler logs of failed exports are kept.
     */
    public String getDebugDir() {
        return debugDir;
    }

    public void setDebugDir(String debugDir) {
        this.debugDir = debugDir;
    }

    /**
     * Returns the conversation history root holding per-chat image folders.
     */
    public String getHistoryDir() {
        return historyDir;
    }

    public void setHistoryDir(String historyDir) {
        this.historyDir = historyDir;
    }

    private static void requireText(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, key));
        }
        if (value.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_TEXT_FMT, key));
        }
    }
}
