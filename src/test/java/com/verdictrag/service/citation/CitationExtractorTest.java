package com.verdictrag.service.citation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.verdictrag.TestFixtures;
import com.verdictrag.model.ExtractedCitation;

class CitationExtractorTest {

    private final CitationExtractor extractor = TestFixtures.extractor();

    @Nested
    @DisplayName("Citation types")
    class Types {

        @Test
        @DisplayName("SCA law report is a single law-report citation")
        void lawReport() {
            List<ExtractedCitation> citations =
                    extractor.extract("In Smith v Jones 2019 (2) SA 343 (SCA) the court held that...");

            assertThat(citations).hasSize(1);
            ExtractedCitation citation = citations.get(0);
            assertThat(citation.getText()).isEqualTo("2019 (2) SA 343 (SCA)");
            assertThat(citation.getType()).isEqualTo("law-report");
            assertThat(citation.getAuthority()).isEqualTo("Supreme Court of Appeal");
            assertThat(citation.getYear()).isEqualTo(2019);
            assertThat(citation.getOccurrences()).isEqualTo(1);
        }

        @Test
        @DisplayName("neutral citations are typed by court")
        void neutralCitations() {
            List<ExtractedCitation> citations = extractor.extract(
                    "See [2020] ZACC 13, [2002] ZASCA 35 and [2021] ZAGPPHC 101.");

            assertThat(citations).extracting(ExtractedCitation::getType)
                    .containsExactly("apex-court", "appellate-court", "high-court");
            assertThat(citations.get(2).getAuthority()).isEqualTo("Gauteng Division, Pretoria");
        }

        @Test
        @DisplayName("statutes, sections and regulations are recognised")
        void statutesAndRegulations() {
            List<ExtractedCitation> citations = extractor.extract(
                    "Under the Constitution of the Republic of South Africa, 1996, the Labour Relations "
                            + "Act 66 of 1995 and section 23(1)(a), read with regulation 7 and GNR 1234.");

            assertThat(citations).extracting(ExtractedCitation::getText).containsExactly(
                    "Constitution of the Republic of South Africa, 1996",
                    "Act 66 of 1995",
                    "section 23(1)(a)",
                    "regulation 7",
                    "GNR 1234");
            assertThat(citations).extracting(ExtractedCitation::getType).containsExactly(
                    "statute", "statute", "statute", "regulation", "regulation");
        }

        @Test
        @DisplayName("text without citations yields nothing")
        void noCitations() {
            assertThat(extractor.extract("The parties met on Tuesday to discuss the matter.")).isEmpty();
            assertThat(extractor.extract("")).isEmpty();
            assertThat(extractor.extract(null)).isEmpty();
        }

        @Test
        @DisplayName("each citation carries the text around its first occurrence")
        void context() {
            String before = "x".repeat(150) + " The appeal turned on ";
            String after = " which the court followed." + " y".repeat(100);
            List<ExtractedCitation> citations = extractor.extract(before + "2019 (2) SA 343 (SCA)" + after);

            String context = citations.get(0).getContext();
            assertThat(context).contains("The appeal turned on 2019 (2) SA 343 (SCA) which the court followed.");
            assertThat(context).hasSizeLessThanOrEqualTo("2019 (2) SA 343 (SCA)".length() + 200);
            assertThat(context).doesNotStartWith(" ").doesNotEndWith(" ");
            assertThat(extractor.extract("See 2019 (2) SA 343 (SCA).").get(0).getContext())
                    .isEqualTo("See 2019 (2) SA 343 (SCA).");
        }
    }

    @Nested
    @DisplayName("Deduplication and ordering")
    class Dedupe {

        @Test
        @DisplayName("repeated citations are merged with an occurrence count")
        void countsOccurrences() {
            List<ExtractedCitation> citations = extractor.extract(
                    "Act 71 of 2008 applies. [2007] ZACC 5 applies too. Again, Act 71 of 2008 governs.");

            assertThat(citations).extracting(ExtractedCitation::getText)
                    .containsExactly("Act 71 of 2008", "[2007] ZACC 5");
            assertThat(citations.get(0).getOccurrences()).isEqualTo(2);
            assertThat(citations.get(0).getFirstOffset()).isZero();
        }

        @Test
        @DisplayName("re-extracting from the extracted strings yields the same set")
        void idempotent() {
            String text = "Barkhuizen v Napier 2007 (5) SA 323 (CC); [2007] ZACC 5; section 34; Act 3 of 2000.";
            List<String> first = extractor.extractStrings(text);

            List<String> second = extractor.extractStrings(String.join(" ; ", first));

            assertThat(second).containsExactlyElementsOf(first);
        }

        @Test
        @DisplayName("overlapping matches keep the leftmost-longest")
        void leftmostLongest() {
            CitationExtractor custom = new CitationExtractor(new CitationPatternCatalog("test", List.of(
                    definition("short", "Act\\s+\\d+"),
                    definition("long", "Act\\s+\\d+\\s+of\\s+\\d{4}")), Map.of()));

            List<ExtractedCitation> citations = custom.extract("Act 5 of 2001 and Act 9");

            assertThat(citations).extracting(ExtractedCitation::getText).containsExactly("Act 5 of 2001", "Act 9");
            assertThat(citations).extracting(ExtractedCitation::getType).containsExactly("long", "short");
        }

        @Test
        @DisplayName("identical spans take the type of the first pattern")
        void firstPatternWinsTies() {
            CitationExtractor custom = new CitationExtractor(new CitationPatternCatalog("test", List.of(
                    definition("first", "GN\\s+\\d+"),
                    definition("second", "GN\\s+\\d+")), Map.of()));

            assertThat(custom.extract("GN 12")).extracting(ExtractedCitation::getType).containsExactly("first");
        }
    }

    private static CitationPatternDefinition definition(String type, String regex) {
        return CitationPatternDefinition.builder().type(type).authority(type).regex(regex).build();
    }

    @Test
    @DisplayName("catalog version is exposed")
    void catalogVersion() {
        assertThat(extractor.getCatalogVersion()).isEqualTo("sa-v1");
    }
}
