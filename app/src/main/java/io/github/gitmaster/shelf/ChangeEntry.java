package io.github.gitmaster.shelf;

/** Line statistics for one changed path. Binary files report zero additions and deletions. */
public record ChangeEntry(String path, int additions, int deletions) {}
