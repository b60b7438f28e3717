package com.genflow.quality;

import com.genflow.core.generation.GenerationException;
import com.genflow.quality.model.FixResult;
import com.genflow.quality.model.QualityCategory;
import com.genflow.quality.model.QualityGateConfig;
import com.genflow.quality.model.QualityGateResult;
import com.genflow.quality.model.QualityScore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QualityGateTest {

    private static final QualityGateConfig MIN_70 = new QualityGateConfig(70, 3, true);

    @Mock
    private ContentFixer fixer;

    /** Scores content by looking it up; unknown content scores 0. */
    private static QualityScorer scoresByContent(Map<String, QualityScore> scores) {
        return (content, type) -> scores.getOrDefault(content, QualityScore.of(0));
    }

    @Test
    @DisplayName("Score 55 fixed to 72 passes a 70 gate after one pass")
    void runGate_shouldPassAfterOneFix() throws GenerationException {
        QualityScore initial = QualityScore.of(55,
            QualityCategory.of("Completeness", 8, 20, "Missing NFRs"),
            QualityCategory.of("Clarity", 18, 20, "Minor wording"));
        QualityScorer scorer = scoresByContent(Map.of("v1", initial, "v2", QualityScore.of(72)));
        when(fixer.fix("v1", List.of("Missing NFRs"), "prd")).thenReturn(new FixResult("v2", List.of("Added NFRs")));

        QualityGateResult result = new QualityGate(scorer, fixer).runGate("v1", "prd", MIN_70);

        assertThat(result.passed()).isTrue();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.score().overall()).isEqualTo(72);
        assertThat(result.minimumRequired()).isEqualTo(70);
        assertThat(result.content()).isEqualTo("v2");
        assertThat(result.improvements()).containsExactly("Added NFRs");
        assertThat(result.issues()).isEmpty();
        assertThat(result.hasError()).isFalse();
    }

    @Test
    void runGate_shouldPassImmediatelyWithoutFixing() {
        QualityScorer scorer = scoresByContent(Map.of("good", QualityScore.of(91)));

        QualityGateResult result = new QualityGate(scorer, fixer).runGate("good", "prd", MIN_70);

        assertThat(result.passed()).isTrue();
        assertThat(result.attempts()).isZero();
        verifyNoInteractions(fixer);
    }

    @Test
    @DisplayName("A gate that never reaches the threshold stops after maxRetries and keeps the best content")
    void runGate_shouldStopAfterMaxRetriesWithBestContent() throws GenerationException {
        QualityScorer scorer = scoresByContent(Map.of(
            "v1", QualityScore.of(40, QualityCategory.of("Clarity", 5, 20, "Vague")),
            "v2", QualityScore.of(62, QualityCategory.of("Clarity", 12, 20, "Still vague")),
            "v3", QualityScore.of(58),
            "v4", QualityScore.of(50)));
        List<String> versions = new ArrayList<>(List.of("v2", "v3", "v4"));
        when(fixer.fix(anyString(), anyList(), eq("architecture")))
            .thenAnswer(inv -> new FixResult(versions.remove(0), List.of("pass")));

        QualityGateResult result = new QualityGate(scorer, fixer).runGate("v1", "architecture", MIN_70);

        assertThat(result.passed()).isFalse();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.score().overall()).isEqualTo(62);
        assertThat(result.content()).isEqualTo("v2");
        assertThat(result.issues()).containsExactly("Still vague");
        assertThat(result.improvements()).hasSize(3);
        verify(fixer, times(3)).fix(anyString(), anyList(), eq("architecture"));
    }

    @Test
    void runGate_shouldOnlyScoreWhenAutoFixDisabled() {
        QualityScorer scorer = scoresByContent(Map.of("v1", QualityScore.of(30)));

        QualityGateResult result = new QualityGate(scorer, fixer).runGate("v1", "prd", MIN_70.withoutAutoFix());

        assertThat(result.passed()).isFalse();
        assertThat(result.attempts()).isZero();
        verifyNoInteractions(fixer);
    }

    @Test
    void runGate_shouldSendGenericIssueWhenScoreHasNoBreakdown() throws GenerationException {
        QualityScorer scorer = scoresByContent(Map.of("v1", QualityScore.of(50), "v2", QualityScore.of(80)));
        when(fixer.fix(eq("v1"), anyList(), eq("prd"))).thenReturn(new FixResult("v2", List.of()));

        new QualityGate(scorer, fixer).runGate("v1", "prd", MIN_70);

        verify(fixer).fix("v1", List.of("Overall quality score 50 is below the required 70"), "prd");
    }

    @Test
    void runGate_shouldReportScorerFailure() {
        QualityScorer failing = (content, type) -> {
            throw GenerationException.network("scorer unreachable");
        };

        QualityGateResult result = new QualityGate(failing, fixer).runGate("v1", "prd", MIN_70);

        assertThat(result.passed()).isFalse();
        assertThat(result.attempts()).isZero();
        assertThat(result.content()).isEqualTo("v1");
        assertThat(result.errorMessage()).contains("scorer unreachable");
    }

    @Test
    void runGate_shouldReportFixerFailure() throws GenerationException {
        QualityScorer scorer = scoresByContent(Map.of("v1", QualityScore.of(50)));
        when(fixer.fix(anyString(), anyList(), anyString())).thenThrow(GenerationException.timeout("fix timed out"));

        QualityGateResult result = new QualityGate(scorer, fixer).runGate("v1", "prd", MIN_70);

        assertThat(result.passed()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.score().overall()).isEqualTo(50);
        assertThat(result.errorMessage()).isEqualTo("fix timed out");
    }

    @Test
    void runGate_shouldUseContentTypeDefaults() {
        QualityScorer scorer = scoresByContent(Map.of("review", QualityScore.of(74)));

        QualityGateResult result = new QualityGate(scorer, (c, i, t) -> FixResult.unchanged(c)).runGate("review", "code-review");

        assertThat(result.minimumRequired()).isEqualTo(75);
        assertThat(result.passed()).isFalse();
        assertThat(result.attempts()).isEqualTo(3);
    }
}
