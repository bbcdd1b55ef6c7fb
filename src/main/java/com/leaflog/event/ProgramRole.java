package com.leaflog.event;

/**
 * The two programs the indexer understands.
 * TREE  → the concurrent merkle tree program emitting changelogs
 * TOKEN → the compressed-asset program built on top of it
 */
public enum ProgramRole {
    TREE,
    TOKEN
}
