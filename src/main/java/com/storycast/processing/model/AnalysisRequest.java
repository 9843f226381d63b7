package com.storycast.processing.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input for one analysis session: the raw page texts of a document plus optional limits.
 */
public class AnalysisRequest {
    private final String sessionId;
    private final List<String> pages;
    private final Integer maxPagesToProcess;
    private final AnalysisCheckpoint resumeFrom;

    /**
     * @param sessionId         identifier used for logging and checkpoints
     * @param pages             raw text of each page, in reading order
     * @param maxPagesToProcess analyse only the first N pages, or null for all pages
     * @param resumeFrom        checkpoint of an earlier interrupted run, or null
     */
    public AnalysisRequest(String sessionId, List<String> pages, Integer maxPagesToProcess,
                           AnalysisCheckpoint resumeFrom) {
        if (maxPagesToProcess != null && maxPagesToProcess < 0) {
            throw new IllegalArgumentException("maxPagesToProcess must be >= 0");
        }
        this.sessionId = sessionId;
        this.pages = pages != null ? Collections.unmodifiableList(new ArrayList<>(pages)) : List.of();
        this.maxPagesToProcess = maxPagesToProcess;
        this.resumeFrom = resumeFrom;
    }

    public static AnalysisRequest of(String sessionId, List<String> pages) {
        return new AnalysisRequest(sessionId, pages, null, null);
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<String> getPages() {
        return pages;
    }

    public Integer getMaxPagesToProcess() {
        return maxPagesToProcess;
    }

    public AnalysisCheckpoint getResumeFrom() {
        return resumeFrom;
    }

    /**
     * Pages that will actually be analysed after applying {@link #getMaxPagesToProcess()}.
     */
    public List<String> getPagesToProcess() {
        if (maxPagesToProcess == null || maxPagesToProcess >= pages.size()) {
            return pages;
        }
        return pages.subList(0, maxPagesToProcess);
    }

    public boolean isPartial() {
        return maxPagesToProcess != null && maxPagesToProcess < pages.size();
    }
}
