package com.shipcheck.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Generated artifact files: ordered filename → content, case-sensitive names.
 * Immutable once built.
 */
public final class FileSet {

    private static final FileSet EMPTY = new FileSet(Map.of());

    private final Map<String, String> files;

    private FileSet(Map<String, String> files) {
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    public static FileSet of(Map<String, String> files) {
        if (files == null || files.isEmpty()) return EMPTY;
        Map<String, String> copy = new LinkedHashMap<>();
        files.forEach((name, content) -> copy.put(name, content != null ? content : ""));
        return new FileSet(copy);
    }

    public static FileSet empty() {
        return EMPTY;
    }

    public Optional<String> find(String name) {
        return Optional.ofNullable(files.get(name));
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public Map<String, String> asMap() {
        return files;
    }

    /** All file contents joined with newlines, in insertion order. */
    public String concatenated() {
        return String.join("\n", files.values());
    }

    @Override
    public String toString() {
        return "FileSet" + files.keySet();
    }
}
