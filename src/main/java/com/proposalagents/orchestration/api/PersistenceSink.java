package com.proposalagents.orchestration.api;

import com.proposalagents.exception.ReportStorageException;

import java.nio.file.Path;

/**
 * Service interface for storing the synthesized proposal. Called once per job, after all
 * specialist work has settled.
 */
public interface PersistenceSink {

    /**
     * Saves the proposal under a name derived from the topic and the current date. When the
     * primary write fails, exactly one fallback write under a generic name is attempted.
     *
     * @param topic The topic the job was started with; drives the file name.
     * @param content The synthesized proposal text.
     * @return The absolute path of the saved artifact.
     * @throws ReportStorageException When both the primary and the fallback write fail.
     */
    Path save(String topic, String content);
}
