package com.mainframe.transpiler.lexer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands {@code COPY member.} statements by splicing the member's lines into the including source.
 *
 * Members are looked up in the directory of the including program first, then in the configured
 * copybook directories. Nested COPY statements are expanded recursively; a member that includes
 * itself (directly or through other members) is reported instead of expanded.
 */
public class CopyMemberResolver {
    private static final Logger log = LoggerFactory.getLogger(CopyMemberResolver.class);

    private static final List<String> COPYBOOK_EXTENSIONS = List.of(
            "", ".cpy", ".CPY", ".cbl", ".CBL", ".cob", ".COB", ".cobol", ".COBOL"
    );

    private static final Pattern COPY_STATEMENT = Pattern.compile(
            "^COPY\\s+(\"[^\"]+\"|'[^']+'|[A-Z0-9][A-Z0-9_-]*)(?:\\s+(?:OF|IN)\\s+([A-Z0-9][A-Z0-9_-]*))?(\\s+REPLACING\\b.*)?\\s*\\.?$",
            Pattern.CASE_INSENSITIVE
    );

    private final Path primaryDir;
    private final List<Path> copybookDirs;
    private final CobolLineReader lineReader;

    /** Lines of members already read, by normalized name. */
    private final Map<String, List<SourceLine>> memberCache = new HashMap<>();

    /** Tracks the inclusion stack to detect cycles. */
    private final Set<String> currentlyResolving = new LinkedHashSet<>();

    public CopyMemberResolver(Path primaryDir, List<Path> copybookDirs, CobolLineReader lineReader) {
        this.primaryDir = primaryDir;
        this.copybookDirs = (copybookDirs != null) ? copybookDirs : List.of();
        this.lineReader = Objects.requireNonNull(lineReader, "lineReader");
    }

    public ExpandedSource expand(List<SourceLine> lines) {
        Objects.requireNonNull(lines, "lines");

        List<SourceLine> out = new ArrayList<>();
        List<UnresolvedCopy> unresolved = new ArrayList<>();
        Set<String> included = new LinkedHashSet<>();

        expandInto(lines, out, unresolved, included);

        return new ExpandedSource(List.copyOf(out), List.copyOf(unresolved), List.copyOf(included));
    }

    private void expandInto(List<SourceLine> lines, List<SourceLine> out,
                            List<UnresolvedCopy> unresolved, Set<String> included) {
        for (SourceLine line : lines) {
            Matcher matcher = line.isCode() ? COPY_STATEMENT.matcher(line.getContent().strip()) : null;
            if (matcher == null || !matcher.matches()) {
                out.add(line);
                continue;
            }

            String rawName = unquote(matcher.group(1));
            String nameKey = normalizeName(rawName);

            if (matcher.group(3) != null) {
                unresolved.add(new UnresolvedCopy(rawName, line.getFileName(), line.getNumber(),
                        "COPY REPLACING is not supported"));
                log.warn("COPY {} REPLACING at {}:{} is not supported", rawName, line.getFileName(), line.getNumber());
                continue;
            }

            // Cycle detection
            if (currentlyResolving.contains(nameKey)) {
                String msg = "Recursive COPY " + rawName + " via " + String.join(" -> ", currentlyResolving);
                unresolved.add(new UnresolvedCopy(rawName, line.getFileName(), line.getNumber(), msg));
                log.error("{} at {}:{}", msg, line.getFileName(), line.getNumber());
                continue;
            }

            List<SourceLine> memberLines;
            try {
                memberLines = loadMember(rawName, nameKey);
            } catch (IOException e) {
                unresolved.add(new UnresolvedCopy(rawName, line.getFileName(), line.getNumber(),
                        "Failed to read member (" + e.getMessage() + ")"));
                log.error("Failed to read COPY member {}", rawName, e);
                continue;
            }

            if (memberLines == null) {
                String msg = String.format("Missing copybook '%s'. Provide it next to the program or in a copybook directory",
                        rawName);
                unresolved.add(new UnresolvedCopy(rawName, line.getFileName(), line.getNumber(), msg));
                log.warn("{} (referenced from {} line {})", msg, line.getFileName(), line.getNumber());
                continue;
            }

            currentlyResolving.add(nameKey);
            try {
                included.add(nameKey);
                expandInto(memberLines, out, unresolved, included);
                log.debug("Expanded COPY {} ({} lines)", rawName, memberLines.size());
            } finally {
                currentlyResolving.remove(nameKey);
            }
        }
    }

    private List<SourceLine> loadMember(String rawName, String nameKey) throws IOException {
        List<SourceLine> cached = memberCache.get(nameKey);
        if (cached != null) {
            return cached;
        }

        Path path = findCopybook(rawName);
        if (path == null) {
            return null;
        }

        List<SourceLine> lines = lineReader.read(Files.readString(path), path.getFileName().toString());
        memberCache.put(nameKey, lines);
        return lines;
    }

    /**
     * Find a copybook file by name in the primary + copybook directories.
     */
    public Path findCopybook(String name) {
        if (name == null || name.isBlank()) return null;

        Path found = searchDirectory(primaryDir, name);
        if (found != null) return found;

        for (Path dir : copybookDirs) {
            found = searchDirectory(dir, name);
            if (found != null) return found;
        }

        return null;
    }

    private Path searchDirectory(Path dir, String name) {
        if (dir == null || !Files.isDirectory(dir)) {
            return null;
        }

        for (String ext : COPYBOOK_EXTENSIONS) {
            Path candidate = dir.resolve(name + ext);
            if (Files.isRegularFile(candidate)) return candidate;

            candidate = dir.resolve(name.toLowerCase(Locale.ROOT) + ext);
            if (Files.isRegularFile(candidate)) return candidate;

            candidate = dir.resolve(name.toUpperCase(Locale.ROOT) + ext);
            if (Files.isRegularFile(candidate)) return candidate;
        }

        return null;
    }

    private static String unquote(String name) {
        if (name.length() >= 2 && (name.charAt(0) == '"' || name.charAt(0) == '\'')) {
            return name.substring(1, name.length() - 1);
        }
        return name;
    }

    private static String normalizeName(String name) {
        if (name == null) return "";
        String trimmed = name.trim();
        int dot = trimmed.lastIndexOf('.');
        if (dot > 0) {
            trimmed = trimmed.substring(0, dot);
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }
}
