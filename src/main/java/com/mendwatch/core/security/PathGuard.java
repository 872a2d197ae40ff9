package com.mendwatch.core.security;

import com.mendwatch.core.model.DetectedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Gatekeeper for every file access the engine performs.
 * <p>
 * Paths are canonicalized (symlinks resolved) and must stay under the project root and outside
 * the excluded trees. Fix content is screened against a denylist of dangerous constructs before
 * any write. All checks fail closed: internal errors are logged and reported as {@code false}.
 */
public class PathGuard {

    private static final Logger log = LoggerFactory.getLogger(PathGuard.class);

    /** Directory names that are never read or written. */
    static final Set<String> EXCLUDED_DIRS = Set.of(
            ".git", ".hg", ".svn",
            "__pycache__", ".pytest_cache", ".mypy_cache", ".tox", ".eggs",
            ".venv", "venv", "env",
            "node_modules",
            "target", "build", "dist", "out", ".gradle",
            ".idea", ".vscode",
            ".mendwatch"
    );

    /** File-name globs that are never read or written. */
    static final List<String> EXCLUDED_FILE_GLOBS = List.of("*.pyc", "*.class", "*.tmp");

    private static final List<DangerousPattern> DENYLIST = List.of(
            new DangerousPattern(Pattern.compile("\\beval\\s*\\("), "dynamic code evaluation"),
            new DangerousPattern(Pattern.compile("\\bexec\\s*\\("), "dynamic code execution"),
            new DangerousPattern(Pattern.compile("__import__\\s*\\("), "dynamic import"),
            new DangerousPattern(Pattern.compile("os\\.system\\s*\\("), "shell command execution"),
            new DangerousPattern(Pattern.compile("os\\.popen\\s*\\("), "shell command execution"),
            new DangerousPattern(Pattern.compile("subprocess\\.(Popen|call|run|check_call|check_output)\\b"),
                    "subprocess spawn"),
            new DangerousPattern(Pattern.compile("new\\s+ProcessBuilder\\b"), "subprocess spawn"),
            new DangerousPattern(Pattern.compile("shutil\\.rmtree\\s*\\("), "unguarded deletion"),
            new DangerousPattern(Pattern.compile("os\\.(remove|unlink|rmdir)\\s*\\("), "unguarded deletion"),
            new DangerousPattern(Pattern.compile("Files\\.delete(IfExists)?\\s*\\("), "unguarded deletion"),
            new DangerousPattern(Pattern.compile("\\brm\\s+-[a-zA-Z]*[rf]"), "unguarded deletion")
    );

    private final SecurityContext context;
    private final List<PathMatcher> extraExclusions;

    public PathGuard(SecurityContext context) {
        this(context, List.of());
    }

    /**
     * @param context         the established security context
     * @param extraExclusions additional globs, matched against paths relative to the project root
     */
    public PathGuard(SecurityContext context, List<String> extraExclusions) {
        this.context = context;
        var matchers = new ArrayList<PathMatcher>();
        for (String glob : extraExclusions) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        this.extraExclusions = List.copyOf(matchers);
    }

    public Path projectRoot() {
        return context.projectRoot();
    }

    /** Resolves a path string against the project root; absolute paths are kept as is. */
    public Path resolve(String path) {
        return context.projectRoot().resolve(path).normalize();
    }

    /**
     * True iff the canonical form of {@code path} lies under the project root and is not excluded.
     */
    public boolean isAllowed(Path path) {
        if (path == null) {
            return false;
        }
        try {
            Path canonical = canonicalize(path);
            Path root = context.projectRoot();
            if (!canonical.startsWith(root)) {
                log.warn("Path is outside project root: {}", path);
                return false;
            }
            Path relative = root.relativize(canonical);
            if (isExcluded(relative)) {
                log.debug("Path is excluded: {}", relative);
                return false;
            }
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Error checking path {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Validates an operation by name ("read", "write", "delete", "execute").
     * Unknown operations are rejected.
     */
    public boolean validate(String operation, Path path) {
        Optional<FileOperation> op = FileOperation.parse(operation);
        if (op.isEmpty()) {
            log.error("Invalid operation: {}", operation);
            return false;
        }
        return validate(op.get(), path);
    }

    public boolean validate(FileOperation operation, Path path) {
        if (!context.permits(operation.capability())) {
            log.error("Operation {} not permitted by security context", operation);
            return false;
        }
        if (!isAllowed(path)) {
            return false;
        }
        try {
            Path target = canonicalize(path);
            return switch (operation) {
                case READ -> checkRead(target);
                case WRITE -> checkWrite(target);
                case DELETE -> checkDelete(target);
                case EXECUTE -> checkExecute(target);
            };
        } catch (IOException | RuntimeException e) {
            log.error("Error validating {} operation on {}: {}", operation, path, e.getMessage());
            return false;
        }
    }

    /**
     * Screens proposed fix content before it is written to the error's file.
     *
     * @return false if the target is not writable or the content contains a dangerous construct
     */
    public boolean verifyFix(DetectedError error, String content) {
        try {
            if (error == null || error.filePath() == null || content == null) {
                return false;
            }
            Path target = resolve(error.filePath());
            if (!validate(FileOperation.WRITE, target)) {
                log.warn("Fix rejected for {}: target not writable", error.filePath());
                return false;
            }
            Optional<String> finding = screenContent(content);
            if (finding.isPresent()) {
                log.warn("Fix rejected for {}: {}", error.filePath(), finding.get());
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            log.error("Error verifying fix for {}: {}", error.filePath(), e.getMessage());
            return false;
        }
    }

    /**
     * Returns a description of the first dangerous construct found in {@code content}, if any.
     */
    public Optional<String> screenContent(String content) {
        for (DangerousPattern dangerous : DENYLIST) {
            var matcher = dangerous.pattern().matcher(content);
            if (matcher.find()) {
                return Optional.of(dangerous.description() + " detected: '" + matcher.group() + "'");
            }
        }
        return Optional.empty();
    }

    /**
     * Lists every regular file under the project root that passes {@link #isAllowed(Path)}.
     * Entries that cannot be read are skipped. Returns an empty list if the root itself cannot
     * be walked.
     */
    public List<Path> listProjectFiles() {
        try {
            return walkProjectFiles();
        } catch (IOException | RuntimeException e) {
            log.error("Failed to list project files under {}: {}", context.projectRoot(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Like {@link #listProjectFiles()}, but a root that cannot be walked is reported to the
     * caller instead of reading as an empty project.
     *
     * @throws IOException if the project root cannot be read
     */
    public List<Path> walkProjectFiles() throws IOException {
        ProjectFileCollector collector = projectFileCollector();
        Files.walkFileTree(context.projectRoot(), collector);
        return collector.files();
    }

    ProjectFileCollector projectFileCollector() {
        return new ProjectFileCollector();
    }

    public boolean verifyToken(String token) {
        return context.verifyToken(token);
    }

    /**
     * Collects allowed files without descending into excluded directories. A failure on one entry
     * is logged and the walk goes on; a failure on the root aborts it.
     */
    class ProjectFileCollector extends SimpleFileVisitor<Path> {

        private final Path root = context.projectRoot();
        private final List<Path> files = new ArrayList<>();
        private int skipped;

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(root) && isExcluded(root.relativize(dir))) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            boolean regular = attrs.isRegularFile() || attrs.isSymbolicLink() && Files.isRegularFile(file);
            if (regular && !isExcluded(root.relativize(file)) && isAllowed(file)) {
                files.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
            if (file.equals(root)) {
                throw e;
            }
            skipped++;
            log.debug("Skipping unreadable entry {}: {}", file, e.getMessage());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException e) throws IOException {
            if (e != null) {
                if (dir.equals(root)) {
                    throw e;
                }
                skipped++;
                log.debug("Stopped listing {} early: {}", dir, e.getMessage());
            }
            return FileVisitResult.CONTINUE;
        }

        List<Path> files() {
            if (skipped > 0) {
                log.info("Listed {} project file(s), skipped {} unreadable entries", files.size(), skipped);
            }
            return files.stream().sorted().toList();
        }
    }

    private boolean checkRead(Path target) {
        if (!Files.exists(target)) {
            log.warn("Path does not exist: {}", target);
            return false;
        }
        return Files.isRegularFile(target) && Files.isReadable(target);
    }

    private boolean checkWrite(Path target) {
        Path parent = target.getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            log.warn("Parent directory does not exist: {}", parent);
            return false;
        }
        return Files.isWritable(parent);
    }

    private boolean checkDelete(Path target) {
        if (!Files.exists(target)) {
            log.warn("Path does not exist: {}", target);
            return false;
        }
        Path parent = target.getParent();
        return parent != null && Files.isWritable(parent);
    }

    private boolean checkExecute(Path target) {
        if (!Files.exists(target)) {
            log.warn("Path does not exist: {}", target);
            return false;
        }
        return Files.isRegularFile(target) && Files.isExecutable(target);
    }

    private boolean isExcluded(Path relative) {
        for (Path component : relative) {
            if (EXCLUDED_DIRS.contains(component.toString())) {
                return true;
            }
        }
        Path fileName = relative.getFileName();
        if (fileName != null) {
            for (String glob : EXCLUDED_FILE_GLOBS) {
                if (FileSystems.getDefault().getPathMatcher("glob:" + glob).matches(fileName)) {
                    return true;
                }
            }
        }
        for (PathMatcher matcher : extraExclusions) {
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolves symlinks on the deepest existing ancestor so that paths which do not exist yet
     * (write targets) are still checked against their real location.
     */
    private Path canonicalize(Path path) throws IOException {
        Path absolute = context.projectRoot().resolve(path).toAbsolutePath().normalize();
        Path existing = absolute;
        Path remainder = null;
        while (existing != null && !Files.exists(existing)) {
            Path name = existing.getFileName();
            remainder = remainder == null ? name : name.resolve(remainder);
            existing = existing.getParent();
        }
        if (existing == null) {
            return absolute;
        }
        Path real = existing.toRealPath();
        return remainder == null ? real : real.resolve(remainder).normalize();
    }

    private record DangerousPattern(Pattern pattern, String description) {}
}
