package org.dxworks.cobolframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.cobolframe.analyzer.cobol.TransferKeyword;
import org.dxworks.cobolframe.analyzer.cobol.preprocessor.SourceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public class CobolframeConfig {

    private static final Logger log = LoggerFactory.getLogger(CobolframeConfig.class);

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "cobolframe-config.yml";
    private static final SourceFormat DEFAULT_SOURCE_FORMAT = SourceFormat.AUTO;
    private static final Set<TransferKeyword> DEFAULT_TRANSFER_KEYWORDS = EnumSet.of(TransferKeyword.PERFORM);
    private static final boolean DEFAULT_EMIT_MERMAID = false;
    private static final Set<String> DEFAULT_EXTENSIONS = Set.of(".cbl", ".cob", ".cobol");

    private final int maxFileLines;
    private final SourceFormat sourceFormat;
    private final Set<TransferKeyword> transferKeywords;
    private final boolean emitMermaid;
    private final Set<String> extensions;

    private CobolframeConfig(int maxFileLines, SourceFormat sourceFormat, Set<TransferKeyword> transferKeywords,
                             boolean emitMermaid, Set<String> extensions) {
        this.maxFileLines = maxFileLines;
        this.sourceFormat = sourceFormat;
        this.transferKeywords = Collections.unmodifiableSet(EnumSet.copyOf(transferKeywords));
        this.emitMermaid = emitMermaid;
        this.extensions = Set.copyOf(extensions);
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public SourceFormat getSourceFormat() {
        return sourceFormat;
    }

    public Set<TransferKeyword> getTransferKeywords() {
        return transferKeywords;
    }

    public boolean isEmitMermaid() {
        return emitMermaid;
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    public static CobolframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CobolframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                SourceFormat effectiveFormat = yamlConfig.sourceFormat != null
                        ? yamlConfig.sourceFormat
                        : DEFAULT_SOURCE_FORMAT;
                Set<TransferKeyword> effectiveKeywords = (yamlConfig.transferKeywords != null && !yamlConfig.transferKeywords.isEmpty())
                        ? EnumSet.copyOf(yamlConfig.transferKeywords)
                        : DEFAULT_TRANSFER_KEYWORDS;
                boolean effectiveEmitMermaid = yamlConfig.emitMermaid != null
                        ? yamlConfig.emitMermaid
                        : DEFAULT_EMIT_MERMAID;
                Set<String> effectiveExtensions = (yamlConfig.extensions != null && !yamlConfig.extensions.isEmpty())
                        ? normalizeExtensions(yamlConfig.extensions)
                        : DEFAULT_EXTENSIONS;

                return new CobolframeConfig(effectiveMaxFileLines, effectiveFormat, effectiveKeywords,
                        effectiveEmitMermaid, effectiveExtensions);
            }
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static CobolframeConfig defaults() {
        return new CobolframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_SOURCE_FORMAT, DEFAULT_TRANSFER_KEYWORDS,
                DEFAULT_EMIT_MERMAID, DEFAULT_EXTENSIONS);
    }

    public static CobolframeConfig with(int maxFileLines, SourceFormat sourceFormat,
                                        Set<TransferKeyword> transferKeywords, boolean emitMermaid) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        Set<TransferKeyword> effectiveKeywords = transferKeywords == null || transferKeywords.isEmpty()
                ? DEFAULT_TRANSFER_KEYWORDS
                : transferKeywords;
        return new CobolframeConfig(effectiveMaxFileLines,
                sourceFormat != null ? sourceFormat : DEFAULT_SOURCE_FORMAT,
                effectiveKeywords, emitMermaid, DEFAULT_EXTENSIONS);
    }

    private static Set<String> normalizeExtensions(List<String> extensions) {
        return extensions.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .filter(e -> !e.isEmpty())
                .map(e -> e.startsWith(".") ? e : "." + e)
                .collect(Collectors.toSet());
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public SourceFormat sourceFormat;
        public List<TransferKeyword> transferKeywords;
        public Boolean emitMermaid;
        public List<String> extensions;
    }
}
