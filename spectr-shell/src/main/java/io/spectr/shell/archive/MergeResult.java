package io.spectr.shell.archive;

/** Merged spec text and the operations that produced it. */
public record MergeResult(String content, OperationCounts counts) {}
