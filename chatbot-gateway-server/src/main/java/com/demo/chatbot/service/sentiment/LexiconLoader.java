package com.demo.chatbot.service.sentiment;

import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads tab-separated lexicon files from the classpath. Blank lines and lines starting with
 * {@code #} are skipped.
 */
final class LexiconLoader {

    private LexiconLoader() {
    }

    static List<String[]> readRows(String resourcePath, int minColumns) throws IOException {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] columns = trimmed.split("\t");
                if (columns.length < minColumns) {
                    throw new IOException("Malformed lexicon row " + lineNumber + " in " + resourcePath);
                }
                rows.add(columns);
            }
        }
        return rows;
    }
}
