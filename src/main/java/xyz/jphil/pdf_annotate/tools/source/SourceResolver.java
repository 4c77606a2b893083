package xyz.jphil.pdf_annotate.tools.source;

import lombok.RequiredArgsConstructor;
import xyz.jphil.pdf_annotate.tools.LogFormatter;
import xyz.jphil.pdf_annotate.tools.exec.ConfigurationException;
import xyz.jphil.pdf_annotate.tools.ordering.NaturalKey;
import xyz.jphil.pdf_annotate.tools.ordering.Stems;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Expands the command-line inputs into the ordered list of documents to process.
 * <p>
 * A directory contributes its PDF files in natural order; a file is taken as given.
 * Unless {@code keepOrder} is set, the combined list is then re-sorted by the natural
 * key of each file stem. Nothing is deduplicated.
 */
@RequiredArgsConstructor
public class SourceResolver {

    private static final String PDF_EXTENSION = ".pdf";

    private final LogFormatter log;

    public List<Path> resolve(List<Path> inputs, boolean keepOrder) {
        var documents = new ArrayList<Path>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                documents.addAll(listPdfs(input));
            } else if (Files.isRegularFile(input)) {
                documents.add(input);
            } else {
                throw new ConfigurationException("Invalid source file/dir \"" + input + "\"");
            }
        }

        if (!keepOrder) {
            documents.sort(Stems.byNaturalStem());
        }
        if (log.isTraceEnabled()) {
            documents.forEach(d -> log.trace("SOURCE", d + " -> " + NaturalKey.of(Stems.of(d))));
        }
        return documents;
    }

    private List<Path> listPdfs(Path dir) {
        try (Stream<Path> paths = Files.list(dir)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(SourceResolver::isPdfFile)
                .sorted(Stems.byNaturalStem().thenComparing(p -> p.getFileName().toString()))
                .toList();
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read source dir \"" + dir + "\" (" + e.getMessage() + ")", e);
        }
    }

    static boolean isPdfFile(Path file) {
        String name = file.getFileName().toString();
        return !name.startsWith(".") && name.toLowerCase().endsWith(PDF_EXTENSION);
    }
}
