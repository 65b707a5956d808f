package device;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;

import utils.Log;

/**
 * Resolves interface names against a baksmali output tree. A framework image usually disassembles into
 * several roots ({@code framework/smali}, {@code framework/smali_classes2}, ...), so the same class path
 * may match more than once.
 */
public class CorpusArtifactResolver implements ArtifactResolver {
    private final Path corpusRoot;
    private final String extension;
    // relative class path -> files, built on first lookup
    private Map<String, List<Path>> index;

    public CorpusArtifactResolver(Path corpusRoot, String extension) {
        this.corpusRoot = corpusRoot;
        this.extension = extension;
    }

    @Override
    public List<Path> resolve(String fqn) {
        if (fqn == null || fqn.isEmpty()) {
            return Collections.emptyList();
        }
        String suffix = fqn.replace('.', '/') + extension;
        List<Path> found = getIndex().get(suffix.substring(suffix.lastIndexOf('/') + 1));
        if (found == null) {
            return Collections.emptyList();
        }
        List<Path> matches = new ArrayList<>();
        for (Path p : found) {
            if (p.toString().replace(File.separatorChar, '/').endsWith("/" + suffix)) {
                matches.add(p);
            }
        }
        Collections.sort(matches);
        return matches;
    }

    private Map<String, List<Path>> getIndex() {
        if (index == null) {
            index = buildIndex();
        }
        return index;
    }

    // breadth-first walk, keyed by file name
    private Map<String, List<Path>> buildIndex() {
        Map<String, List<Path>> files = new HashMap<>();
        Queue<File> queue = new LinkedList<>();
        queue.add(corpusRoot.toFile());
        int count = 0;
        while (!queue.isEmpty()) {
            File current = queue.poll();
            if (!current.exists()) {
                continue;
            }
            if (current.isDirectory()) {
                File[] children = current.listFiles();
                if (children != null) {
                    Collections.addAll(queue, children);
                }
            } else if (current.getName().endsWith(extension)) {
                files.computeIfAbsent(current.getName(), k -> new ArrayList<>()).add(current.toPath());
                count++;
            }
        }
        Log.info("Indexed " + count + " " + extension + " files under " + corpusRoot);
        return files;
    }
}
