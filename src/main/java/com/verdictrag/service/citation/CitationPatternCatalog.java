package com.verdictrag.service.citation;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.verdictrag.exception.RagException;

import lombok.Builder;
import lombok.Getter;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

/**
 * Versioned, ordered list of citation patterns. Order is precedence: when two patterns match
 * the same span the earlier one decides the type.
 */
@Slf4j
@Getter
public class CitationPatternCatalog {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String version;
    private final List<CompiledPattern> patterns;
    private final Map<String, String> courts;

    public CitationPatternCatalog(String version,
                                  List<CitationPatternDefinition> definitions,
                                  Map<String, String> courts) {
        this.version = version;
        this.courts = courts != null ? Map.copyOf(courts) : Map.of();

        List<CompiledPattern> compiled = new ArrayList<>();
        for (int i = 0; i < definitions.size(); i++) {
            CitationPatternDefinition def = definitions.get(i);
            try {
                int flags = def.isCaseInsensitive() ? Pattern.CASE_INSENSITIVE : 0;
                compiled.add(new CompiledPattern(i, def.getType(), def.getAuthority(),
                        Pattern.compile(def.getRegex(), flags)));
            } catch (PatternSyntaxException e) {
                throw new RagException("Invalid citation pattern #" + i + " (" + def.getType() + ")", e);
            }
        }
        this.patterns = List.copyOf(compiled);
    }

    public static CitationPatternCatalog load(InputStream in) throws IOException {
        CatalogFile file = MAPPER.readValue(in, CatalogFile.class);
        if (file.getPatterns() == null || file.getPatterns().isEmpty()) {
            throw new RagException("Citation pattern catalog " + file.getVersion() + " has no patterns");
        }
        CitationPatternCatalog catalog =
                new CitationPatternCatalog(file.getVersion(), file.getPatterns(), file.getCourts());
        log.info("Loaded citation pattern catalog {} ({} patterns)", catalog.getVersion(), catalog.getPatterns().size());
        return catalog;
    }

    public static CitationPatternCatalog fromClasspath(String location) {
        try (InputStream in = CitationPatternCatalog.class.getClassLoader().getResourceAsStream(location)) {
            if (in == null) {
                throw new RagException("Citation pattern catalog not found on classpath: " + location);
            }
            return load(in);
        } catch (IOException e) {
            throw new RagException("Failed to read citation pattern catalog " + location, e);
        }
    }

    public String courtName(String code) {
        return code == null ? null : courts.get(code);
    }

    public record CompiledPattern(int order, String type, String authority, Pattern pattern) {
    }

    @Value
    @Builder
    @Jacksonized
    public static class CatalogFile {
        String version;
        List<CitationPatternDefinition> patterns;
        Map<String, String> courts;
    }
}
