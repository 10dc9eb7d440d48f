package com.phillippitts.strategist.gateway.retrieval;

import com.phillippitts.strategist.config.properties.RetrievalProperties;
import com.phillippitts.strategist.domain.Document;
import com.phillippitts.strategist.exception.GatewayConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * In-memory corpus of internal document fragments, loaded once from a directory.
 *
 * <p>Files ending in {@code .txt} or {@code .md} are read as UTF-8 in file-name order. Long files
 * are cut into fragments on blank lines so no fragment exceeds the configured size (a single
 * oversized paragraph is kept whole). The publication date is taken from the file name when it
 * contains one ({@code 2024-03-15_report.txt}, {@code report_2024_03_15.md}).
 *
 * <p>Matching is plain keyword containment in load order. There is no relevance ranking.
 */
public class DocumentIndex {

    private static final Logger LOG = LogManager.getLogger(DocumentIndex.class);

    static final String DOCUMENTS_DIR_PROPERTY = "strategist.retrieval.documents-dir";
    private static final Pattern DATE_IN_NAME = Pattern.compile("(\\d{4})[-_.](\\d{2})[-_.](\\d{2})");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\R\\s*\\R");

    private final List<Entry> entries;

    private record Entry(Document document, String lowerText) {
    }

    DocumentIndex(Collection<Document> documents) {
        List<Entry> list = new ArrayList<>(documents.size());
        for (Document d : documents) {
            list.add(new Entry(d, d.text().toLowerCase(Locale.ROOT)));
        }
        this.entries = List.copyOf(list);
    }

    /**
     * Loads the directory named by {@link RetrievalProperties#getDocumentsDir()}.
     * An empty setting yields an empty index.
     *
     * @throws GatewayConfigurationException if the setting names something that is not a directory
     * @throws UncheckedIOException if a file cannot be read
     */
    public static DocumentIndex load(RetrievalProperties props) {
        String dir = props.getDocumentsDir();
        if (dir.isBlank()) {
            LOG.warn("No documents directory configured ({}); retrieval will find nothing",
                    DOCUMENTS_DIR_PROPERTY);
            return new DocumentIndex(List.of());
        }
        Path root = Paths.get(dir).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new GatewayConfigurationException(DOCUMENTS_DIR_PROPERTY);
        }

        List<Document> documents = new ArrayList<>();
        List<Path> files;
        try (Stream<Path> stream = Files.list(root)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(DocumentIndex::isTextFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list documents in " + root, e);
        }
        for (Path file : files) {
            String name = file.getFileName().toString();
            String text;
            try {
                text = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read document " + file, e);
            }
            String date = dateFromName(name);
            for (String fragment : fragments(text, props.getMaxFragmentChars())) {
                documents.add(new Document(name, date, fragment));
            }
        }
        LOG.info("Document index loaded: dir='{}', files={}, fragments={}", root, files.size(), documents.size());
        return new DocumentIndex(documents);
    }

    /**
     * @param keywords lowercase tokens; a fragment matches when it contains any of them
     * @param limit    maximum number of fragments returned
     * @return matching fragments in load order
     */
    public List<Document> find(List<String> keywords, int limit) {
        if (keywords.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<Document> hits = new ArrayList<>();
        for (Entry e : entries) {
            for (String keyword : keywords) {
                if (e.lowerText().contains(keyword)) {
                    hits.add(e.document());
                    break;
                }
            }
            if (hits.size() >= limit) {
                break;
            }
        }
        return hits;
    }

    public int size() {
        return entries.size();
    }

    static String dateFromName(String fileName) {
        Matcher m = DATE_IN_NAME.matcher(fileName);
        return m.find() ? m.group(1) + "-" + m.group(2) + "-" + m.group(3) : "";
    }

    static List<String> fragments(String text, int maxChars) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String paragraph : PARAGRAPH_BREAK.split(text)) {
            String p = paragraph.strip();
            if (p.isEmpty()) {
                continue;
            }
            if (current.length() > 0 && current.length() + 2 + p.length() > maxChars) {
                out.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append("\n\n");
            }
            current.append(p);
        }
        if (current.length() > 0) {
            out.add(current.toString());
        }
        return out;
    }

    private static boolean isTextFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".txt") || name.endsWith(".md");
    }
}
