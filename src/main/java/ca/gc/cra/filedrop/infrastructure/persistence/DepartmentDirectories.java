package ca.gc.cra.filedrop.infrastructure.persistence;

import ca.gc.cra.filedrop.domain.identity.Department;
import ca.gc.cra.filedrop.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.GroupPrincipal;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.UserPrincipalNotFoundException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps each {@link Department} to its directory under the server root ({@code <root>/Manufacturing},
 * {@code <root>/Distribution}).
 *
 * <p>Immutable after construction and safe to share between session workers.</p>
 *
 * @since 0.1.0
 */
public final class DepartmentDirectories {
  private static final Logger log = LoggerFactory.getLogger(DepartmentDirectories.class);

  private final Path root;
  private final Map<Department, Path> directories;

  /**
   * Creates the mapping without touching the filesystem.
   *
   * @param root server root directory
   */
  public DepartmentDirectories(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    EnumMap<Department, Path> map = new EnumMap<>(Department.class);
    for (Department department : Department.values()) {
      map.put(department, this.root.resolve(department.displayName()));
    }
    this.directories = Map.copyOf(map);
  }

  /**
   * Validates that both department directories exist and are writable, creating them when asked.
   *
   * <p>Newly created directories are handed to the department's host group when that group exists;
   * failure to do so is logged and ignored.</p>
   *
   * @param root server root directory
   * @param createIfMissing create the root and department directories when absent
   * @return validated mapping
   * @throws IllegalArgumentException if a directory is missing or not writable
   */
  public static DepartmentDirectories prepare(Path root, boolean createIfMissing) {
    DepartmentDirectories prepared = new DepartmentDirectories(root);
    for (Department department : Department.values()) {
      Path dir = prepared.resolve(department);
      boolean existed = Files.isDirectory(dir);
      Paths.validateWritableDir(dir, prepared.root, createIfMissing);
      if (!existed) {
        log.info("Created department directory {}", dir);
        assignGroup(dir, department.displayName());
      }
    }
    return prepared;
  }

  /**
   * Returns the directory for a department.
   *
   * @param department department
   * @return absolute directory path
   */
  public Path resolve(Department department) {
    return directories.get(Objects.requireNonNull(department, "department"));
  }

  public Path root() {
    return root;
  }

  private static void assignGroup(Path dir, String groupName) {
    PosixFileAttributeView view = Files.getFileAttributeView(dir, PosixFileAttributeView.class);
    if (view == null) {
      return;
    }
    try {
      GroupPrincipal group = dir.getFileSystem().getUserPrincipalLookupService()
          .lookupPrincipalByGroupName(groupName);
      view.setGroup(group);
    } catch (UserPrincipalNotFoundException ex) {
      log.debug("Group {} not found; leaving {} with default group", groupName, dir);
    } catch (IOException | UnsupportedOperationException ex) {
      log.warn("Unable to assign group {} to {}: {}", groupName, dir, ex.getMessage());
    }
  }
}
