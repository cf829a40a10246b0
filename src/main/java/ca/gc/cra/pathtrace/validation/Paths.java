package ca.gc.cra.pathtrace.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for PATHTRACE CLI and configuration flows.
 * <p><strong>Why:</strong> Ensures run histories are read from and appended to sanctioned, writable
 * locations before a probe is launched, so a finished measurement is never lost to a bad path.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths to absolute, canonical form.</li>
 *   <li>Reject control characters and null bytes.</li>
 *   <li>Verify that history files and their parent directories are writable or readable.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a dangling symlink is reported
 * instead of silently recreated.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Checks a path without touching the filesystem, as used when only printing a plan.
   *
   * @param path candidate file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path contains null bytes or control characters
   */
  public static Path validatePath(Path path) {
    return normalize(path);
  }

  /**
   * Validates a file that will be created or rewritten.
   *
   * @param path candidate file; must not be {@code null}
   * @param createParents whether missing parent directories should be created
   * @return absolute normalized path (canonical when the file already exists)
   * @throws IllegalArgumentException if the path is a directory, or the file or its parent is not writable
   */
  public static Path validateWritableFile(Path path, boolean createParents) {
    Path normalized = normalize(path);
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        if (!Files.isRegularFile(real, LinkOption.NOFOLLOW_LINKS)) {
          throw new IllegalArgumentException("path is not a regular file: " + real);
        }
        if (!Files.isWritable(real)) {
          throw new IllegalArgumentException("file is not writable: " + real);
        }
        return real;
      }
      Path parent = normalized.getParent();
      if (parent == null) {
        throw new IllegalArgumentException("path has no parent to validate: " + normalized);
      }
      if (!Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
        if (!createParents) {
          throw new IllegalArgumentException("parent directory does not exist: " + parent);
        }
        Files.createDirectories(parent);
      }
      if (!Files.isDirectory(parent)) {
        throw new IllegalArgumentException("parent is not a directory: " + parent);
      }
      if (!Files.isWritable(parent)) {
        throw new IllegalArgumentException("parent directory is not writable: " + parent);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate file " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a file that must already exist and be readable.
   *
   * @param path candidate file; must not be {@code null}
   * @return canonical path of the file
   * @throws IllegalArgumentException if the file does not exist, is not a regular file, or is unreadable
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = normalize(path);
    try {
      Path real = normalized.toRealPath();
      if (!Files.isRegularFile(real)) {
        throw new IllegalArgumentException("path is not a regular file: " + real);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException("file is not readable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("file must exist: " + normalized, ex);
    }
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
