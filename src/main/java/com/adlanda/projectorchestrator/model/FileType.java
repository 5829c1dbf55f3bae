package com.adlanda.projectorchestrator.model;

/**
 * Coarse classification of a discovered file.
 */
public enum FileType {
    SOURCE_CODE,
    TEXT,
    BINARY,
    IMAGE,
    DOCUMENT,
    ARCHIVE,
    UNKNOWN
}
