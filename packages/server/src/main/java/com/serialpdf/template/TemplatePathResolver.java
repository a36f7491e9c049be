package com.serialpdf.template;

import com.serialpdf.utility.IoUtil;
import java.nio.file.Path;

/**
 * Maps a caller-supplied template id to a template directory below the template root. The
 * returned path must lie inside {@code templateRoot}.
 */
@FunctionalInterface
public interface TemplatePathResolver {

  Path resolve(Path templateRoot, String templateId);

  /** Template id is a relative sub-path of the template root. */
  static TemplatePathResolver subdirectory() {
    return (root, id) -> IoUtil.secureResolve(root, id);
  }
}
