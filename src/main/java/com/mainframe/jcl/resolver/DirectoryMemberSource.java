package com.mainframe.jcl.resolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.model.SourceMember;

/**
 * Members stored as flat files in directories.
 *
 * A location is a directory, relative locations resolve against the root and
 * {@code "."} is the root itself. Each member name is tried as written, upper-case and
 * lower-case, with the configured extension first and then the fixed extension list.
 */
public class DirectoryMemberSource implements MemberSource {
    private static final Logger log = LoggerFactory.getLogger(DirectoryMemberSource.class);

    private static final List<String> MEMBER_EXTENSIONS = List.of(
            "", ".jcl", ".JCL", ".proc", ".PROC", ".prc", ".PRC", ".cntl", ".CNTL", ".txt"
    );

    private final Path root;
    private final List<String> extensions;

    public DirectoryMemberSource(Path root) {
        this(root, null);
    }

    public DirectoryMemberSource(Path root, String extension) {
        this.root = Objects.requireNonNull(root, "root");
        Set<String> ordered = new LinkedHashSet<>();
        if (extension != null && !extension.isBlank()) {
            String ext = extension.startsWith(".") ? extension : "." + extension;
            ordered.add(ext);
        }
        ordered.addAll(MEMBER_EXTENSIONS);
        this.extensions = List.copyOf(ordered);
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public Optional<SourceMember> find(String memberName, String location) throws IOException {
        if (memberName == null || memberName.isBlank()) {
            return Optional.empty();
        }
        Path dir = directoryFor(location);
        if (!Files.isDirectory(dir)) {
            log.debug("Skipping missing directory {}", dir);
            return Optional.empty();
        }

        for (String candidateName : nameVariants(memberName.trim())) {
            for (String ext : extensions) {
                Path candidate = dir.resolve(candidateName + ext);
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(read(memberName, candidate));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public String describe(String location) {
        return directoryFor(location).toString();
    }

    private Path directoryFor(String location) {
        if (location == null || location.isBlank() || location.equals(".")) {
            return root;
        }
        Path path = Path.of(location);
        return path.isAbsolute() ? path : root.resolve(path);
    }

    private SourceMember read(String memberName, Path file) throws IOException {
        // decoding replaces malformed bytes instead of failing the whole member
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return SourceMember.fromText(memberName.trim().toUpperCase(Locale.ROOT), file.toString(), text);
    }

    private static List<String> nameVariants(String name) {
        Set<String> variants = new LinkedHashSet<>();
        variants.add(name);
        variants.add(name.toUpperCase(Locale.ROOT));
        variants.add(name.toLowerCase(Locale.ROOT));
        return new ArrayList<>(variants);
    }
}
