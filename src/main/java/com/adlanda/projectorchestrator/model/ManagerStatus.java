package com.adlanda.projectorchestrator.model;

/**
 * Per-manager state inside the active project snapshot.
 */
public enum ManagerStatus {
    LOADED,
    UNLOADED,
    ERROR
}
