package com.ledgerbook.backup.service;

/**
 * The single database entry found inside a backup archive.
 */
public record ArchiveEntryInfo(String entryName, long uncompressedSize) {}
