package com.serialpdf.template;

import com.serialpdf.exception.CheckoutException;
import com.serialpdf.exception.IoException;
import com.serialpdf.exception.NotFoundException;
import com.serialpdf.exception.ValidationException;
import com.serialpdf.utility.IoUtil;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Resolves template ids against a git work tree and materialises templates at a pinned commit.
 *
 * <p>Checkouts use a throw-away work tree and a private index file, so the repository's own index
 * and working copy are never modified and parallel checkouts do not contend for {@code
 * index.lock}.
 */
public class VersionResolver {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(VersionResolver.class);

  public static final String HEAD = "HEAD";

  private final Path repoRoot;
  private final String entryFile;
  private final TemplatePathResolver pathResolver;
  private final GitClient git;

  public VersionResolver(
      Path repoRoot, String entryFile, TemplatePathResolver pathResolver, GitClient git) {
    this.repoRoot = repoRoot.toAbsolutePath().normalize();
    this.entryFile = entryFile;
    this.pathResolver = pathResolver;
    this.git = git;
  }

  public Path repoRoot() {
    return repoRoot;
  }

  public String entryFile() {
    return entryFile;
  }

  /** {@code true} for {@code null}, {@code HEAD} (any case) or an alphanumeric reference. */
  public static boolean isValidCommitReference(String commit) {
    return commit == null || HEAD.equalsIgnoreCase(commit) || StringUtils.isAlphanumeric(commit);
  }

  /**
   * Map a template id to its directory and pin the commit.
   *
   * <p>The template must exist with its entry file in the current working tree. A {@code null} or
   * {@code HEAD} commit is pinned to the current HEAD hash; any other reference is pinned to its
   * hash if it resolves now and is otherwise kept as given and verified at checkout time.
   *
   * @throws ValidationException for a blank id or a malformed commit reference
   * @throws NotFoundException if the template directory or its entry file does not exist
   */
  public TemplateLocation resolve(String templateId, String commit) {
    if (StringUtils.isBlank(templateId)) {
      throw new ValidationException("Missing template id");
    }
    if (!isValidCommitReference(commit)) {
      throw new ValidationException("Bad commit reference (should be alphanumeric): " + commit);
    }

    Path folder;
    try {
      folder = pathResolver.resolve(repoRoot, templateId).toAbsolutePath().normalize();
    } catch (IoException e) {
      throw new NotFoundException(
          "Template id does not map into the template root: " + templateId, e);
    }
    if (!folder.startsWith(repoRoot) || !Files.isDirectory(folder)) {
      log.error("Could not find template folder for id '{}' at '{}'", templateId, folder);
      throw new NotFoundException("Could not find template associated with id: " + templateId);
    }
    if (!Files.isRegularFile(folder.resolve(entryFile))) {
      log.error("Template '{}' has no entry file '{}'", templateId, entryFile);
      throw new NotFoundException(
          "Could not find %s for template: %s".formatted(entryFile, templateId));
    }

    String pinned = commit == null || HEAD.equalsIgnoreCase(commit) ? currentHead() : pin(commit);
    String relative = folder.equals(repoRoot) ? "" : IoUtil.relativeUnixPath(repoRoot, folder);
    return new TemplateLocation(templateId, relative, pinned, entryFile);
  }

  /** Full hash of the repository's current HEAD. */
  public String currentHead() {
    return git.run(repoRoot, "rev-parse", "--verify", "HEAD^{commit}");
  }

  /** Full hash for a reference that resolves now (so branch names cannot move), else as given. */
  private String pin(String reference) {
    GitClient.Result result =
        git.exec(repoRoot, Map.of(), "rev-parse", "--verify", "--quiet", reference + "^{commit}");
    return result.ok() ? result.stdout().strip() : reference;
  }

  /**
   * Check a template out into {@code targetDir} and wrap it as a snapshot owned by the caller.
   */
  public TemplateSnapshot checkout(TemplateLocation location, Path targetDir) {
    String resolved = checkout(location.pathWithinRoot(), location.commit(), targetDir);
    return new TemplateSnapshot(targetDir, resolved, targetDir.resolve(location.entryFile()));
  }

  /**
   * Materialise {@code pathWithinRoot} as of {@code commit} into {@code targetDir}. A directory has
   * its contents placed directly in the target; a single file is placed into it.
   *
   * @return the full hash the checkout was made from
   * @throws CheckoutException if the commit or the path does not exist in history, or a name
   *     already exists in {@code targetDir}
   */
  public String checkout(String pathWithinRoot, String commit, Path targetDir) {
    String path = StringUtils.defaultIfBlank(pathWithinRoot, "");
    String revision = StringUtils.defaultIfBlank(commit, HEAD);

    GitClient.Result verified =
        git.exec(repoRoot, Map.of(), "rev-parse", "--verify", "--quiet", revision + "^{commit}");
    if (!verified.ok()) {
      throw new CheckoutException("Unknown commit '%s'".formatted(revision));
    }
    String fullHash = verified.stdout().strip();

    String objectSpec = path.isEmpty() ? fullHash + "^{tree}" : fullHash + ":" + path;
    GitClient.Result type = git.exec(repoRoot, Map.of(), "cat-file", "-t", objectSpec);
    if (!type.ok()) {
      throw new CheckoutException(
          "Path '%s' does not exist at commit %s".formatted(path, fullHash));
    }
    boolean singleFile = "blob".equals(type.stdout().strip());

    Path workDir = null;
    try {
      Files.createDirectories(targetDir);
      // Sibling of the target so that directories can be moved by rename
      Path parent = targetDir.toAbsolutePath().getParent();
      workDir =
          parent == null
              ? Files.createTempDirectory("git_checkout_")
              : Files.createTempDirectory(parent, "git_checkout_");
      Path tree = Files.createDirectory(workDir.resolve("tree"));
      git.run(
          repoRoot,
          Map.of("GIT_INDEX_FILE", workDir.resolve("index").toString()),
          "--work-tree=" + tree,
          "checkout",
          fullHash,
          "--",
          path.isEmpty() ? "." : path);

      // git recreates the parent folders of the path inside the temporary work tree
      Path head = path.isEmpty() ? tree : tree.resolve(path);
      if (singleFile) {
        moveInto(head, targetDir);
      } else {
        try (Stream<Path> children = Files.list(head)) {
          for (Path child : children.toList()) {
            moveInto(child, targetDir);
          }
        }
      }
      log.debug("Checked out '{}' @ {} into {}", path.isEmpty() ? "." : path, fullHash, targetDir);
      return fullHash;
    } catch (IOException e) {
      throw new CheckoutException(
          "Could not check out '%s' @ %s into %s".formatted(path, fullHash, targetDir), e);
    } finally {
      IoUtil.silentDeleteDir(workDir);
    }
  }

  private static void moveInto(Path source, Path targetDir) throws IOException {
    Path target = targetDir.resolve(source.getFileName().toString());
    try {
      Files.move(source, target);
    } catch (FileAlreadyExistsException e) {
      throw new CheckoutException(
          "Refusing to overwrite existing file in checkout target: " + target, e);
    }
  }
}
