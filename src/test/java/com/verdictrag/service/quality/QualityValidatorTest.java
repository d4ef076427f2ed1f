package com.verdictrag.service.quality;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.verdictrag.TestFixtures;
import com.verdictrag.dto.response.QualityReport;
import com.verdictrag.exception.RegistryLookupException;
import com.verdictrag.model.Chunk;
import com.verdictrag.model.CitationReference;
import com.verdictrag.model.QualityLevel;

class QualityValidatorTest {

    private static final String SCA_CITATION = "2019 (2) SA 343 (SCA)";

    private InMemoryCitationRegistry registry;
    private QualityValidator validator;

    @BeforeEach
    void setUp() {
        registry = new InMemoryCitationRegistry();
        registry.register(reference(SCA_CITATION));
        registry.register(reference("Act 66 of 1995"));
        validator = validatorWith(registry);
    }

    private static CitationReference reference(String citation) {
        return CitationReference.builder().citation(citation).jurisdiction("South Africa").build();
    }

    private static QualityValidator validatorWith(CitationRegistry registry) {
        return new QualityValidator(TestFixtures.extractor(), registry, new LegalVocabulary(),
                TestFixtures.tokenizer(), TestFixtures.properties());
    }

    private static Chunk context(String text) {
        return Chunk.builder().id("doc_chunk_0").documentId("doc").index(0).text(text).build();
    }

    @Nested
    @DisplayName("Citation validity")
    class CitationValidity {

        @Test
        @DisplayName("registered citation scores 1.0")
        void registeredCitation() {
            String answer = "The Supreme Court of Appeal decided this point in " + SCA_CITATION + ".";

            QualityReport report = validator.validate("What did the court decide?", answer,
                    List.of(context("Judgment reported as " + SCA_CITATION)));

            assertThat(report.getCitationsChecked()).containsExactly(SCA_CITATION);
            assertThat(report.getCitationValidity()).isEqualTo(1.0);
            assertThat(report.getInvalidCitations()).isEmpty();
            assertThat(report.getUngroundedCitations()).isEmpty();
        }

        @Test
        @DisplayName("unregistered citations lower validity and are listed")
        void unregisteredCitation() {
            String answer = "See " + SCA_CITATION + " and also Act 99 of 2099 for the rule.";

            QualityReport report = validator.validate("question", answer, List.of());

            assertThat(report.getCitationValidity()).isEqualTo(0.5);
            assertThat(report.getInvalidCitations()).containsExactly("Act 99 of 2099");
        }

        @Test
        @DisplayName("answer without citations scores 0.0")
        void noCitations() {
            QualityReport report = validator.validate("question", "No authority is cited here.", List.of());

            assertThat(report.getCitationValidity()).isZero();
            assertThat(report.getCitationsChecked()).isEmpty();
        }

        @Test
        @DisplayName("failed lookups degrade to invalid citations and the registry is never written")
        void registryFailure() {
            CitationRegistry failing = mock(CitationRegistry.class);
            when(failing.findAll(anyCollection())).thenThrow(new RegistryLookupException("registry offline"));
            when(failing.find(SCA_CITATION)).thenReturn(Optional.of(reference(SCA_CITATION)));
            when(failing.find("Act 66 of 1995")).thenThrow(new RegistryLookupException("timeout"));

            QualityReport report = validatorWith(failing).validate("question",
                    "Both " + SCA_CITATION + " and Act 66 of 1995 apply.", List.of());

            assertThat(report.getCitationValidity()).isEqualTo(0.5);
            assertThat(report.getInvalidCitations()).containsExactly("Act 66 of 1995");
            assertThat(report.getUnresolvedCitations()).containsExactly("Act 66 of 1995");
            verify(failing, never()).register(any());
        }

        @Test
        @DisplayName("citations absent from the context are flagged as ungrounded")
        void ungrounded() {
            QualityReport report = validator.validate("question",
                    "The rule is in Act 66 of 1995 and " + SCA_CITATION + ".",
                    List.of(context("Only Act 66 of 1995 is discussed in this source.")));

            assertThat(report.getCitationValidity()).isEqualTo(1.0);
            assertThat(report.getUngroundedCitations()).containsExactly(SCA_CITATION);
            assertThat(report.getIssues()).anyMatch(issue -> issue.contains(SCA_CITATION));
            assertThat(report.getSuggestions()).anyMatch(s -> s.contains("retrieved sources"));
        }
    }

    @Nested
    @DisplayName("Text signals")
    class TextSignals {

        @Test
        @DisplayName("five hedging phrases give a hedging score of 0.8")
        void fiveHedges() {
            String answer = "It might apply. Perhaps the court will agree. It is possibly relevant. "
                    + "Arguably the rule applies. Maybe not.";

            QualityReport report = validator.validate("question", answer, List.of());

            assertThat(report.getHedgingPhraseCount()).isEqualTo(5);
            assertThat(report.getHedging()).isCloseTo(0.8, within(1e-9));
        }

        @Test
        @DisplayName("up to three hedges are free")
        void hedgingAllowance() {
            QualityReport report = validator.validate("question",
                    "It might apply, perhaps, and I think it does.", List.of());

            assertThat(report.getHedgingPhraseCount()).isEqualTo(3);
            assertThat(report.getHedging()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("terminology density saturates at five distinct terms")
        void terminology() {
            QualityReport three = validator.validate("question",
                    "The plaintiff sought an interdict against the respondent.", List.of());
            QualityReport six = validator.validate("question",
                    "The plaintiff sought an interdict against the respondent in the high court; "
                            + "the appellant relied on estoppel and prescription.", List.of());

            assertThat(three.getLegalTermsFound()).containsExactly("plaintiff", "interdict", "respondent");
            assertThat(three.getTerminologyDensity()).isCloseTo(0.6, within(1e-9));
            assertThat(six.getTerminologyDensity()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("relevance is the share of question tokens found in the answer")
        void relevance() {
            QualityReport report = validator.validate("What is unfair dismissal?",
                    "Unfair dismissal is a dismissal without a fair reason.", List.of());

            assertThat(report.getRelevance()).isCloseTo(0.75, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Composite and feedback")
    class Composite {

        @Test
        @DisplayName("composite is the weighted sum of the components and stays in [0,1]")
        void weightedSum() {
            String answer = "In terms of Act 66 of 1995 an employer must have a fair reason. The Labour Court and "
                    + "the CCMA apply this, and the applicant bears the onus in the bargaining council.";

            QualityReport report = validator.validate("Does an employer need a fair reason?", answer,
                    List.of(context("Act 66 of 1995 section 188")));

            double expected = 0.4 * report.getCitationValidity()
                    + 0.3 * report.getTerminologyDensity()
                    + 0.2 * report.getRelevance()
                    + 0.1 * report.getHedging();
            assertThat(report.getCompositeScore()).isCloseTo(expected, within(1e-9));
            assertThat(report.getCompositeScore()).isBetween(0.0, 1.0);
            assertThat(report.getLevel()).isEqualTo(QualityLevel.of(report.getCompositeScore()));
        }

        @Test
        @DisplayName("weak answer receives suggestions and issues")
        void weakAnswer() {
            QualityReport report = validator.validate("Can my landlord evict me without a court order?",
                    "Just google it.", List.of());

            assertThat(report.getSuggestions()).hasSize(3);
            assertThat(report.getIssues()).anyMatch(i -> i.contains("too brief"));
            assertThat(report.getIssues()).anyMatch(i -> i.contains("external search"));
            assertThat(report.getLevel()).isEqualTo(QualityLevel.INSUFFICIENT);
        }

        @Test
        @DisplayName("lawyer disclaimer is reported as an issue")
        void disclaimer() {
            QualityReport report = validator.validate("question",
                    "I am not a lawyer, but the answer depends on the facts.", List.of());

            assertThat(report.getIssues()).anyMatch(i -> i.contains("disclaimer"));
        }

        @Test
        @DisplayName("level thresholds")
        void levels() {
            assertThat(QualityLevel.of(0.95)).isEqualTo(QualityLevel.EXCELLENT);
            assertThat(QualityLevel.of(0.9)).isEqualTo(QualityLevel.EXCELLENT);
            assertThat(QualityLevel.of(0.85)).isEqualTo(QualityLevel.GOOD);
            assertThat(QualityLevel.of(0.7)).isEqualTo(QualityLevel.SATISFACTORY);
            assertThat(QualityLevel.of(0.5)).isEqualTo(QualityLevel.NEEDS_IMPROVEMENT);
            assertThat(QualityLevel.of(0.49)).isEqualTo(QualityLevel.INSUFFICIENT);
        }

        @Test
        @DisplayName("composite exactly on a level boundary gets that level")
        void boundaryComposite() {
            double excellent = QualityValidator.composite(1.0, 1.0, 0.5, 1.0);
            double needsImprovement = QualityValidator.composite(0.5, 0.5, 0.5, 0.5);

            assertThat(excellent).isEqualTo(0.9);
            assertThat(QualityLevel.of(excellent)).isEqualTo(QualityLevel.EXCELLENT);
            assertThat(needsImprovement).isEqualTo(0.5);
            assertThat(QualityLevel.of(needsImprovement)).isEqualTo(QualityLevel.NEEDS_IMPROVEMENT);
        }
    }
}
