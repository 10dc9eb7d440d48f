package com.phillippitts.strategist.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Location and size limits of the internal document corpus.
 */
@Validated
@ConfigurationProperties(prefix = "strategist.retrieval")
public class RetrievalProperties {

    /** Directory of {@code .txt}/{@code .md} files; empty disables retrieval (no documents). */
    private final String documentsDir;

    @Min(1)
    private final int topK;

    /** Fragments longer than this are split on paragraph boundaries. */
    @Min(200)
    private final int maxFragmentChars;

    @ConstructorBinding
    public RetrievalProperties(String documentsDir, Integer topK, Integer maxFragmentChars) {
        this.documentsDir = documentsDir == null ? "" : documentsDir;
        this.topK = topK == null ? 8 : topK;
        this.maxFragmentChars = maxFragmentChars == null ? 2000 : maxFragmentChars;
    }

    public String getDocumentsDir() {
        return documentsDir;
    }

    public int getTopK() {
        return topK;
    }

    public int getMaxFragmentChars() {
        return maxFragmentChars;
    }
}
