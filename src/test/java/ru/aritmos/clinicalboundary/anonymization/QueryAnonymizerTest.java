package ru.aritmos.clinicalboundary.anonymization;

import org.junit.jupiter.api.Test;
import ru.aritmos.clinicalboundary.config.BoundaryProperties;
import ru.aritmos.clinicalboundary.config.TestTables;
import ru.aritmos.clinicalboundary.core.BoundaryOutcome;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QueryAnonymizerTest {

    private final QueryAnonymizer strict = new QueryAnonymizer(TestTables.store(), new BoundaryProperties());

    @Test
    void shouldBlockExplicitSelfDisclosureWithoutPartialRedaction() {
        AnonymizationModels.AnonymizationOutcome r = strict.anonymize("My name is John Smith and I live at 123 Main Street");

        assertFalse(r.safe());
        assertEquals(List.of(AnonymizationModels.BLOCKING_CATEGORY), r.categories());
        assertEquals("", r.anonymizedQuery());
        assertNotNull(r.rejectionReason());
    }

    @Test
    void shouldPassClinicalVocabularyQuery() {
        AnonymizationModels.AnonymizationOutcome r = strict.anonymize("evidence-based interventions for avoidant attachment in therapy");

        assertTrue(r.safe());
        assertTrue(r.categories().isEmpty());
        assertEquals("evidence-based interventions for avoidant attachment in therapy", r.anonymizedQuery());
    }

    @Test
    void shouldNotTreatCapitalizedClinicalTermsAsNames() {
        assertTrue(strict.isSafe("Gottman Method techniques for stonewalling"));
        assertTrue(strict.isSafe("Emotionally Focused Therapy for couples"));
        assertTrue(strict.isSafe("couples therapy in New York"));
    }

    @Test
    void shouldRejectPersonNameInStrictMode() {
        AnonymizationModels.AnonymizationOutcome r = strict.anonymize("research on anxiety for Sarah Johnson");

        assertFalse(r.safe());
        assertEquals(List.of("name"), r.categories());
        assertEquals("PHI detected: name", r.rejectionReason());
        assertEquals("research on anxiety for [PERSON]", r.anonymizedQuery());
    }

    @Test
    void shouldRedactFullNameFollowingCapitalizedClinicalWord() {
        BoundaryProperties props = new BoundaryProperties();
        props.getAnonymization().setStrictMode(false);
        QueryAnonymizer permissive = new QueryAnonymizer(TestTables.store(), props);

        AnonymizationModels.AnonymizationOutcome r = permissive.anonymize("techniques from Therapy John Smith recommends");

        assertTrue(r.safe());
        assertEquals(List.of("name"), r.categories());
        assertEquals("techniques from Therapy [PERSON] recommends", r.anonymizedQuery());
        assertFalse(r.anonymizedQuery().contains("Smith"));

        assertFalse(strict.isSafe("techniques from Therapy John Smith recommends"));
        assertEquals("couples therapy in New York for [PERSON]",
                permissive.anonymize("couples therapy in New York for Sarah Johnson").anonymizedQuery());
    }

    @Test
    void shouldSkipStreetNamesInNameHeuristicButRedactLocation() {
        AnonymizationModels.AnonymizationOutcome r = strict.anonymize("support groups near Main Street");

        assertFalse(r.safe());
        assertEquals(List.of("location"), r.categories());
        assertEquals("support groups near [LOCATION]", r.anonymizedQuery());
    }

    @Test
    void shouldRecordEachCategoryOnceInDetectionOrder() {
        AnonymizationModels.AnonymizationOutcome r = strict.anonymize(
                "call 555-123-4567 or 555-987-6543 about therapy on 03/14/2024");

        assertFalse(r.safe());
        assertEquals(List.of("date", "phone"), r.categories());
        assertEquals("call [PHONE] or [PHONE] about therapy on [DATE]", r.anonymizedQuery());
    }

    @Test
    void permissiveModeShouldReturnRedactedCandidateAsSafe() {
        BoundaryProperties props = new BoundaryProperties();
        props.getAnonymization().setStrictMode(false);
        QueryAnonymizer permissive = new QueryAnonymizer(TestTables.store(), props);

        AnonymizationModels.AnonymizationOutcome r = permissive.anonymize(
                "interventions for couples, contact me at someone@example.com");

        assertTrue(r.safe());
        assertTrue(r.phiDetected());
        assertEquals(List.of("email"), r.categories());
        assertEquals("interventions for couples, contact me at [EMAIL]", r.anonymizedQuery());
        assertEquals("interventions for couples, contact me at [EMAIL]", permissive.validateAndAnonymize(
                "interventions for couples, contact me at someone@example.com"));
    }

    @Test
    void validateShouldThrowAndTryValidateShouldReturnRejected() {
        assertThrows(QueryAnonymizer.AnonymizationException.class,
                () -> strict.validateAndAnonymize("my phone number is private"));

        BoundaryOutcome<String> outcome = strict.tryValidate("research on denial for Sarah Johnson");
        assertFalse(outcome.success());
        assertEquals("ANONYMIZATION_REJECTED", outcome.errorCode());
        assertNull(outcome.result());

        BoundaryOutcome<String> ok = strict.tryValidate("clinical research on denial in therapy");
        assertTrue(ok.success());
        assertEquals("clinical research on denial in therapy", ok.result());
    }

    @Test
    void blankQueryIsNeverSafe() {
        assertFalse(strict.isSafe("   "));
        assertFalse(strict.isSafe(null));
    }

    @Test
    void matchMadeOnlyOfClinicalVocabularyIsFalsePositive() {
        Set<String> vocabulary = TestTables.store().getEffective().clinicalVocabulary();

        assertTrue(QueryAnonymizer.isClinicalVocabulary("Gottman Method,", vocabulary));
        assertFalse(QueryAnonymizer.isClinicalVocabulary("John Smith", vocabulary));
        assertFalse(QueryAnonymizer.isClinicalVocabulary("555-123-4567", vocabulary));
    }
}
