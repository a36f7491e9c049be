package com.serialpdf.template;

/**
 * A template pinned to a commit.
 *
 * @param templateId id as supplied by the caller
 * @param pathWithinRoot template directory relative to the repository root, {@code /}-separated
 * @param commit pinned commit, either a full hash or a caller-supplied reference
 * @param entryFile compilation entry file relative to the template directory
 */
public record TemplateLocation(
    String templateId, String pathWithinRoot, String commit, String entryFile) {}
