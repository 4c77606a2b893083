package xyz.jphil.pdf_annotate.tools.pipeline;

import xyz.jphil.pdf_annotate.tools.ordering.Stems;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A resolved input document and the identity its artifacts are named after.
 */
public record SourceDocument(Path path, String stem, String identity) {

    /**
     * Identities are dot-stripped stems. A repeated identity gets a {@code ~2}, {@code ~3}...
     * suffix so that every document renders into its own files.
     */
    public static List<SourceDocument> identify(List<Path> documents) {
        Map<String, Integer> seen = new HashMap<>();
        var result = new ArrayList<SourceDocument>(documents.size());
        for (Path document : documents) {
            String stem = Stems.of(document);
            String base = stem.replace(".", "");
            int occurrence = seen.merge(base, 1, Integer::sum);
            String identity = occurrence == 1 ? base : base + "~" + occurrence;
            result.add(new SourceDocument(document, stem, identity));
        }
        return result;
    }
}
