package ru.aritmos.clinicalboundary.isolation;

import org.junit.jupiter.api.Test;
import ru.aritmos.clinicalboundary.config.BoundaryTables;
import ru.aritmos.clinicalboundary.config.BoundaryTablesStore;
import ru.aritmos.clinicalboundary.config.TestTables;
import ru.aritmos.clinicalboundary.model.ClinicalModels;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IsolationFilterTest {

    private final BoundaryTablesStore store = TestTables.store();
    private final IsolationFilter filter = new IsolationFilter(store);

    @Test
    void profileContainsOnlyAllowListedLabels() {
        ClinicalModels.ClinicalAnalysis analysis = ClinicalModels.ClinicalAnalysis.builder()
                .framework("Gottman Four Horsemen: criticism and stonewalling", "communication")
                .pattern("Projection onto partner when she told me about work", "Sarah said it twice")
                .theme("Trust after the argument last Tuesday")
                .riskFlag(ClinicalModels.RiskLevel.MEDIUM, "Mentioned a hospital visit")
                .build();

        IsolationModels.IsolatedProfile profile = filter.isolate(analysis);
        BoundaryTables.IsolationSection iso = store.getEffective().isolation();

        for (Map.Entry<IsolationModels.LabelCategory, List<String>> e : profile.byCategory().entrySet()) {
            List<String> allowed = IsolationFilter.allowList(iso, e.getKey());
            for (String label : e.getValue()) {
                assertTrue(allowed.contains(label), e.getKey().code() + " contains " + label);
            }
        }
        assertEquals(List.of("gottman four horsemen", "stonewalling", "criticism"), profile.frameworks());
        assertEquals(List.of("gottman"), profile.modalities());
        assertEquals(List.of("stonewalling", "criticism"), profile.communicationPatterns());
        assertEquals(List.of("projection"), profile.defensePatterns());
        assertEquals(List.of("trust"), profile.themeCategories());

        String joined = String.join(" ", profile.allLabels()).toLowerCase(Locale.ROOT);
        for (String leaked : List.of("sarah", "told", "tuesday", "argument", "work", "hospital")) {
            assertFalse(joined.contains(leaked), leaked);
        }
        filter.verifyProfile(profile);
    }

    @Test
    void unmatchedRawLabelsAreDroppedAndCounted() {
        ClinicalModels.ClinicalAnalysis analysis = ClinicalModels.ClinicalAnalysis.builder()
                .framework("Sarah's personal method", "other")
                .pattern("Silent treatment")
                .theme("Money worries")
                .build();

        IsolationModels.IsolationReport report = filter.isolateWithReport(analysis);

        assertEquals(3, report.droppedCount());
        assertEquals(0, report.profile().size());
    }

    @Test
    void longerTermWinsOverContainedShorterTerms() {
        ClinicalModels.ClinicalAnalysis analysis = ClinicalModels.ClinicalAnalysis.builder()
                .theme("Passive-aggressive remarks")
                .build();

        assertEquals(List.of("passive-aggressive"), filter.isolate(analysis).communicationPatterns());
    }

    @Test
    void underscoresAreNormalizedToSpaces() {
        ClinicalModels.ClinicalAnalysis analysis = ClinicalModels.ClinicalAnalysis.builder()
                .pattern("reaction_formation")
                .build();

        assertEquals(List.of("reaction formation"), filter.isolate(analysis).defensePatterns());
    }

    @Test
    void partialAttachmentStyleIsRecognized() {
        ClinicalModels.ClinicalAnalysis analysis = ClinicalModels.ClinicalAnalysis.builder()
                .framework("Attachment style: anxious", "attachment")
                .build();

        assertEquals(List.of("anxious attachment"), filter.isolate(analysis).attachmentPatterns());
    }

    @Test
    void attachmentFrameworkDoesNotLeakIntoCommunication() {
        ClinicalModels.ClinicalAnalysis analysis = ClinicalModels.ClinicalAnalysis.builder()
                .framework("Avoidant attachment", "attachment")
                .build();

        IsolationModels.IsolatedProfile profile = filter.isolate(analysis);
        assertEquals(List.of("avoidant attachment"), profile.attachmentPatterns());
        assertTrue(profile.communicationPatterns().isEmpty());
    }

    @Test
    void shortModalityIsMatchedOnlyAsWholeWord() {
        ClinicalModels.ClinicalAnalysis analysis = ClinicalModels.ClinicalAnalysis.builder()
                .framework("Radical acceptance practice", "dbt")
                .build();

        IsolationModels.IsolatedProfile profile = filter.isolate(analysis);
        assertEquals(List.of("radical acceptance"), profile.frameworks());
        assertTrue(profile.modalities().isEmpty());
    }

    @Test
    void partnersAreIsolatedIndependently() {
        ClinicalModels.ClinicalAnalysis a = ClinicalModels.ClinicalAnalysis.builder()
                .framework("Anxious attachment", "attachment").theme("Communication").build();
        ClinicalModels.ClinicalAnalysis b = ClinicalModels.ClinicalAnalysis.builder()
                .pattern("Denial").theme("Intimacy").build();

        IsolationModels.IsolatedPair pair = filter.isolateForCouplesMerge(a, b, true);

        assertEquals(List.of("anxious attachment"), pair.profileA().attachmentPatterns());
        assertEquals(List.of("communication"), pair.profileA().themeCategories());
        assertTrue(pair.profileA().defensePatterns().isEmpty());
        assertEquals(List.of("denial"), pair.profileB().defensePatterns());
        assertEquals(List.of("intimacy"), pair.profileB().themeCategories());
    }

    @Test
    void strictModeRejectsMisconfiguredAllowListEntry() {
        IsolationFilter misconfigured = new IsolationFilter(TestTables.storeWithExtraThemes("argument last week"));
        ClinicalModels.ClinicalAnalysis a = ClinicalModels.ClinicalAnalysis.builder()
                .theme("Argument last week").build();
        ClinicalModels.ClinicalAnalysis b = ClinicalModels.ClinicalAnalysis.builder()
                .theme("Trust").build();

        IsolationFilter.IsolationViolationException e = assertThrows(IsolationFilter.IsolationViolationException.class,
                () -> misconfigured.isolateForCouplesMerge(a, b, true));
        assertEquals("ISOLATION_VIOLATION", e.errorCode());

        IsolationModels.IsolatedPair relaxed = misconfigured.isolateForCouplesMerge(a, b, false);
        assertEquals(List.of("argument last week"), relaxed.profileA().themeCategories());
    }

    @Test
    void verifyRejectsLabelOutsideItsCategory() {
        IsolationModels.IsolatedProfile forged = new IsolationModels.IsolatedProfile(
                List.of(), List.of("John Smith"), List.of(), List.of(), List.of(), List.of());

        assertThrows(IsolationFilter.IsolationViolationException.class, () -> filter.verifyProfile(forged));
    }

    @Test
    void nullAnalysisGivesEmptyProfile() {
        IsolationModels.IsolationReport report = filter.isolateWithReport(null);
        assertEquals(0, report.profile().size());
        assertEquals(0, report.droppedCount());
    }
}
