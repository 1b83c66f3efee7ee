package NfseBot.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Expands the user's selection (files and folders) into the list of XML files to process.
 *
 * Folders are walked recursively, children in lexicographic order of their name. Only files
 * ending in {@code .xml} (any case) are kept. Nothing is read besides directory listings.
 */
@Component
public class PathCollector {

    private static final Logger log = LoggerFactory.getLogger(PathCollector.class);
    private static final String XML_EXTENSION = ".xml";

    private final boolean followLinks;

    public PathCollector(@Value("${nfse.collector.follow-links:false}") boolean followLinks) {
        this.followLinks = followLinks;
    }

    public boolean isFollowLinks() {
        return followLinks;
    }

    public CollectionResult collectPaths(List<Path> entries) {
        Set<Path> files = new LinkedHashSet<>();
        List<CollectionDiagnostic> diagnostics = new ArrayList<>();
        Set<Path> visitedDirectories = new HashSet<>();

        for (Path entry : entries) {
            Path absolute = entry.toAbsolutePath().normalize();
            // an explicitly selected folder is always entered, even through a link
            if (Files.isDirectory(absolute)) {
                walk(absolute, files, diagnostics, visitedDirectories);
            } else if (isXmlFile(absolute)) {
                files.add(absolute);
            } else {
                log.debug("Skipping non-XML entry {}", absolute);
            }
        }

        log.info("Collected {} XML file(s) from {} selected entries", files.size(), entries.size());
        for (CollectionDiagnostic diagnostic : diagnostics) {
            log.warn("Could not read directory {}", diagnostic);
        }
        return new CollectionResult(new ArrayList<>(files), diagnostics);
    }

    private void walk(Path directory, Set<Path> files, List<CollectionDiagnostic> diagnostics, Set<Path> visited) {
        Path key;
        try {
            key = directory.toRealPath();
        } catch (IOException e) {
            key = directory;
        }
        if (!visited.add(key)) {
            log.debug("Directory {} already visited, skipping", directory);
            return;
        }

        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path child : stream) {
                children.add(child);
            }
        } catch (IOException | SecurityException e) {
            diagnostics.add(new CollectionDiagnostic(directory, describe(e)));
            return;
        }
        children.sort(Comparator.comparing((Path p) -> p.getFileName().toString()));

        for (Path child : children) {
            if (!followLinks && Files.isSymbolicLink(child)) {
                log.debug("Not following symbolic link {}", child);
                continue;
            }
            if (Files.isDirectory(child, linkOptions())) {
                walk(child, files, diagnostics, visited);
            } else if (Files.isRegularFile(child, linkOptions()) && isXmlFile(child)) {
                files.add(child.toAbsolutePath().normalize());
            }
        }
    }

    private LinkOption[] linkOptions() {
        return followLinks ? new LinkOption[0] : new LinkOption[] { LinkOption.NOFOLLOW_LINKS };
    }

    static boolean isXmlFile(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(XML_EXTENSION);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
