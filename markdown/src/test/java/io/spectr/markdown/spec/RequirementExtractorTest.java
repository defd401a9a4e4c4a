package io.spectr.markdown.spec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.Markdown;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class RequirementExtractorTest {

    private static final String DELTA = String.join("\n",
        "# Delta",
        "",
        "## ADDED Requirements",
        "",
        "### Requirement: Export",
        "The system SHALL export data.",
        "",
        "#### Scenario: CSV",
        "- **WHEN** asked",
        "- **THEN** writes csv",
        "",
        "#### Scenario: JSON",
        "- works",
        "",
        "## MODIFIED Requirements",
        "",
        "### Requirement: Login",
        "The system MUST log in.",
        "",
        "## REMOVED Requirements",
        "",
        "### Requirement: Legacy",
        "",
        "## RENAMED Requirements",
        "",
        "- FROM: `### Requirement: Logout`",
        "- TO: `### Requirement: Sign Out`",
        "- FROM: ### Requirement: Old",
        "- TO: ### Requirement: New",
        "");

    @Test
    void classifiesDeltaSections() {
        DeltaPlan plan = RequirementExtractor.extractDelta(Markdown.parse(DELTA));

        assertEquals(List.of("Export"), names(plan.added()));
        assertEquals(List.of("Login"), names(plan.modified()));
        assertEquals(List.of("Legacy"), plan.removed());
        assertEquals(List.of(new RenameOp("Logout", "Sign Out"), new RenameOp("Old", "New")), plan.renamed());
        assertEquals(5, plan.operationCount());
        assertTrue(plan.hasDeltas());
    }

    @Test
    void requirementCarriesRawTextAndScenarios() {
        Requirement export = RequirementExtractor.extractDelta(Markdown.parse(DELTA)).added().get(0);

        assertEquals("### Requirement: Export", export.headerLine());
        assertEquals(5, export.line());
        assertEquals(List.of("CSV", "JSON"), export.scenarios());
        assertEquals(String.join("\n",
            "### Requirement: Export",
            "The system SHALL export data.",
            "",
            "#### Scenario: CSV",
            "- **WHEN** asked",
            "- **THEN** writes csv",
            "",
            "#### Scenario: JSON",
            "- works"), export.rawText());
    }

    @Test
    void extractRequirementsIgnoresSections() {
        List<Requirement> all = RequirementExtractor.extractRequirements(Markdown.parse(DELTA));
        assertEquals(List.of("Export", "Login", "Legacy"), names(all));
        assertEquals("### Requirement: Legacy", all.get(2).rawText());
        assertTrue(all.get(1).scenarios().isEmpty());
    }

    @Test
    void sectionHeadersMatchBySubstring() {
        String text = "## ADDED Requirements (v2)\n\n### Requirement: A\ntext\n";
        DeltaPlan plan = RequirementExtractor.extractDelta(Markdown.parse(text));
        assertEquals(List.of("A"), names(plan.added()));
    }

    @Test
    void requirementsOutsideDeltaSectionsAreIgnored() {
        String text = "## Requirements\n\n### Requirement: A\ntext\n\n### Notes\n";
        DeltaPlan plan = RequirementExtractor.extractDelta(Markdown.parse(text));
        assertFalse(plan.hasDeltas());
        assertEquals(DeltaPlan.empty(), plan);
    }

    @Test
    void otherLevelThreeHeaderExtendsRequirement() {
        String text = "## Requirements\n\n### Requirement: A\ntext\n\n### Notes\nmore\n\n## Other\n\nafter\n";
        Requirement a = RequirementExtractor.extractRequirements(Markdown.parse(text)).get(0);
        assertEquals("### Requirement: A\ntext\n\n### Notes\nmore", a.rawText());
    }

    @Test
    void scenarioOutsideRequirementIsPlainContent() {
        String text = "## Requirements\n\n#### Scenario: Lost\n\n### Requirement: A\n";
        List<Requirement> all = RequirementExtractor.extractRequirements(Markdown.parse(text));
        assertEquals(1, all.size());
        assertTrue(all.get(0).scenarios().isEmpty());
    }

    @Test
    void renameTargets() {
        assertEquals("Name", RequirementExtractor.renameTarget(" `### Requirement: Name` "));
        assertEquals("Name", RequirementExtractor.renameTarget("###Requirement: Name"));
        assertNull(RequirementExtractor.renameTarget("Requirement: Name"));
        assertNull(RequirementExtractor.renameTarget("`### Requirement:`"));
        assertEquals("Name", RequirementExtractor.renameTarget("`###  Requirement: Name`"));
        assertEquals("Name", RequirementExtractor.renameTarget("###\t Requirement:\tName"));
        assertNull(RequirementExtractor.renameTarget("#### Requirement: Name"));
    }

    @Test
    void renameHeadersToleratesSpacesAndTabs() {
        String text = "## RENAMED Requirements\n\n"
            + "- FROM: `###  Requirement: OldName`\n"
            + "- TO: `###\tRequirement: NewName`\n";
        List<RenameOp> renamed = RequirementExtractor.extractDelta(Markdown.parse(text)).renamed();
        assertEquals(List.of(new RenameOp("OldName", "NewName")), renamed);
    }

    @Test
    void unmatchedFromIsDropped() {
        String text = "## RENAMED Requirements\n\n- TO: `### Requirement: B`\n- FROM: `### Requirement: A`\n";
        assertTrue(RequirementExtractor.extractDelta(Markdown.parse(text)).renamed().isEmpty());
    }

    @Test
    void enclosingRequirementAndScenario() {
        Document doc = Markdown.parse(DELTA);
        int csv = DELTA.indexOf("writes csv");
        assertEquals("Requirement: Export", RequirementExtractor.enclosingRequirement(doc, csv).orElseThrow().text());
        assertEquals("Scenario: CSV", RequirementExtractor.enclosingScenario(doc, csv).orElseThrow().text());

        int login = DELTA.indexOf("MUST log in");
        assertEquals("Requirement: Login", RequirementExtractor.enclosingRequirement(doc, login).orElseThrow().text());
        assertTrue(RequirementExtractor.enclosingScenario(doc, login).isEmpty());

        assertTrue(RequirementExtractor.enclosingRequirement(doc, DELTA.indexOf("FROM")).isEmpty());
        assertTrue(RequirementExtractor.enclosingRequirement(doc, 0).isEmpty());
    }

    @Test
    void normalizedNames() {
        assertEquals("user login", Requirement.normalize("  User Login "));
    }

    private static List<String> names(List<Requirement> requirements) {
        return requirements.stream().map(Requirement::name).collect(Collectors.toList());
    }
}
