package com.mainframe.jcl.resolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.jcl.model.SourceMember;

/**
 * Partitioned data sets unloaded to disk: a location is a library name such as
 * {@code SYS1.PROCLIB} and each member is the file {@code <root>/<LIBRARY>/<MEMBER>}.
 * Library and member names are upper-case; an optional extension is tried after the
 * bare name.
 */
public class DatasetMemberSource implements MemberSource {
    private static final Logger log = LoggerFactory.getLogger(DatasetMemberSource.class);

    private final Path root;
    private final String extension;

    public DatasetMemberSource(Path root) {
        this(root, null);
    }

    public DatasetMemberSource(Path root, String extension) {
        this.root = Objects.requireNonNull(root, "root");
        if (extension == null || extension.isBlank()) {
            this.extension = null;
        } else {
            this.extension = extension.startsWith(".") ? extension : "." + extension;
        }
    }

    @Override
    public Optional<SourceMember> find(String memberName, String location) throws IOException {
        if (memberName == null || memberName.isBlank()) {
            return Optional.empty();
        }
        Path library = libraryDir(location);
        if (!Files.isDirectory(library)) {
            log.debug("Library {} not present under {}", location, root);
            return Optional.empty();
        }

        String member = memberName.trim().toUpperCase(Locale.ROOT);
        Path candidate = library.resolve(member);
        if (!Files.isRegularFile(candidate) && extension != null) {
            candidate = library.resolve(member + extension);
        }
        if (!Files.isRegularFile(candidate)) {
            return Optional.empty();
        }

        String text = new String(Files.readAllBytes(candidate), StandardCharsets.UTF_8);
        return Optional.of(SourceMember.fromText(member, location + "(" + member + ")", text));
    }

    @Override
    public String describe(String location) {
        return libraryDir(location).toString();
    }

    private Path libraryDir(String location) {
        if (location == null || location.isBlank() || location.equals(".")) {
            return root;
        }
        return root.resolve(location.trim().toUpperCase(Locale.ROOT));
    }
}
