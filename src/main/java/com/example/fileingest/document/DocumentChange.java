package com.example.fileingest.document;

/**
 * An applied document edit and the snapshot that undoes it (null when snapshots are disabled).
 */
public record DocumentChange(DocumentRecord document, String snapshotId) {
}
