package io.spectr.shell.archive;

import static org.junit.jupiter.api.Assertions.*;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.Markdown;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpecMergerTest {

  private static final String BASE =
      String.join(
          "\n",
          "# Auth Specification",
          "",
          "## Purpose",
          "",
          "Handles auth.",
          "",
          "## Requirements",
          "",
          "### Requirement: Login",
          "The system SHALL log in.",
          "",
          "#### Scenario: Ok",
          "- works",
          "",
          "### Requirement: Logout",
          "The system SHALL log out.",
          "",
          "### Requirement: Legacy",
          "Old stuff.",
          "",
          "## Notes",
          "",
          "Keep this.",
          "");

  private static final String DELTA =
      String.join(
          "\n",
          "## ADDED Requirements",
          "",
          "### Requirement: Export",
          "The system SHALL export.",
          "",
          "## MODIFIED Requirements",
          "",
          "### Requirement: Login",
          "The system SHALL log in with MFA.",
          "",
          "## REMOVED Requirements",
          "",
          "### Requirement: Legacy",
          "",
          "## RENAMED Requirements",
          "",
          "- FROM: `### Requirement: Logout`",
          "- TO: `### Requirement: Sign Out`",
          "");

  private static final String ADD_ONLY =
      "## ADDED Requirements\n\n### Requirement: Export\nThe system SHALL export.\n";

  private static Document parse(String text) {
    return Markdown.parse(text);
  }

  @Test
  void appliesAllOperations() throws Exception {
    MergeResult result = SpecMerger.merge(parse(BASE), parse(DELTA), "auth");

    assertEquals(
        String.join(
            "\n",
            "# Auth Specification",
            "",
            "## Purpose",
            "",
            "Handles auth.",
            "",
            "## Requirements",
            "",
            "### Requirement: Login",
            "The system SHALL log in with MFA.",
            "",
            "### Requirement: Sign Out",
            "The system SHALL log out.",
            "",
            "### Requirement: Export",
            "The system SHALL export.",
            "",
            "## Notes",
            "",
            "Keep this.",
            ""),
        result.content());
    assertEquals(new OperationCounts(1, 1, 1, 1), result.counts());
    assertEquals(4, result.counts().total());
  }

  @Test
  void modifyAfterRenameUsesNewName() throws Exception {
    String delta =
        String.join(
            "\n",
            "## RENAMED Requirements",
            "",
            "- FROM: `### Requirement: Logout`",
            "- TO: `### Requirement: Sign Out`",
            "",
            "## MODIFIED Requirements",
            "",
            "### Requirement: Sign Out",
            "The system SHALL sign out everywhere.",
            "");

    MergeResult result = SpecMerger.merge(parse(BASE), parse(delta), "auth");

    assertTrue(result.content().contains("### Requirement: Sign Out\nThe system SHALL sign out everywhere.\n"));
    assertFalse(result.content().contains("Logout"));
    // the renamed requirement keeps its place between Login and Legacy
    assertTrue(result.content().indexOf("Sign Out") < result.content().indexOf("Legacy"));
    assertEquals(new OperationCounts(0, 1, 0, 1), result.counts());
  }

  @Test
  void renameWithLooseHeaderSpacing() throws Exception {
    String delta =
        "## RENAMED Requirements\n\n"
            + "- FROM: `###  Requirement: Logout`\n"
            + "- TO: `###\tRequirement: Sign Out`\n";

    MergeResult result = SpecMerger.merge(parse(BASE), parse(delta), "auth");

    assertEquals(new OperationCounts(0, 0, 0, 1), result.counts());
    assertTrue(result.content().contains("### Requirement: Sign Out\nThe system SHALL log out.\n"));
  }

  @Test
  void missingTargetsAreSkipped() throws Exception {
    String delta =
        "## REMOVED Requirements\n\n### Requirement: Nope\n\n"
            + "## MODIFIED Requirements\n\n### Requirement: Ghost\nThe system SHALL haunt.\n";

    MergeResult result = SpecMerger.merge(parse(BASE), parse(delta), "auth");

    assertEquals(new OperationCounts(0, 0, 0, 0), result.counts());
    assertFalse(result.content().contains("Ghost"));
    assertTrue(result.content().contains("### Requirement: Legacy"));
  }

  @Test
  void namesMatchIgnoringCase() throws Exception {
    String delta = "## REMOVED Requirements\n\n### Requirement:   LEGACY  \n";
    MergeResult result = SpecMerger.merge(parse(BASE), parse(delta), "auth");
    assertEquals(1, result.counts().removed());
    assertFalse(result.content().contains("Old stuff."));
  }

  @Test
  void sectionAtEndOfFile() throws Exception {
    String base = "## Requirements\n\n### Requirement: A\nText.\n";
    String delta = "## ADDED Requirements\n\n### Requirement: B\nThe system SHALL b.\n";

    MergeResult result = SpecMerger.merge(parse(base), parse(delta), "x");

    assertEquals(
        "## Requirements\n\n### Requirement: A\nText.\n\n### Requirement: B\nThe system SHALL b.\n",
        result.content());
  }

  @Test
  void baseWithoutSectionGetsOne() throws Exception {
    MergeResult result = SpecMerger.merge(parse("# Spec\n\nIntro.\n"), parse(ADD_ONLY), "x");

    assertEquals(
        "# Spec\n\nIntro.\n\n## Requirements\n\n### Requirement: Export\nThe system SHALL export.\n",
        result.content());
  }

  @Test
  void createsNewSpec() throws Exception {
    MergeResult result = SpecMerger.merge(null, parse(ADD_ONLY), "user-auth");

    assertEquals(
        "# User Auth Specification\n\n## Requirements\n\n"
            + "### Requirement: Export\nThe system SHALL export.\n",
        result.content());
    assertEquals(new OperationCounts(1, 0, 0, 0), result.counts());
  }

  @Test
  void newSpecAcceptsOnlyAdditions() {
    SpecMergeException e =
        assertThrows(SpecMergeException.class, () -> SpecMerger.merge(null, parse(DELTA), "auth"));
    assertTrue(e.getMessage().contains("only ADDED"));
  }

  @Test
  void emptyDeltaIsRejected() {
    assertThrows(
        SpecMergeException.class,
        () -> SpecMerger.merge(parse(BASE), parse("# Nothing here\n"), "auth"));
  }

  @Test
  void mergesFiles(@TempDir Path dir) throws Exception {
    Path spec = dir.resolve("specs").resolve("spec-merge").resolve("spec.md");
    Path delta = dir.resolve("delta.md");
    Files.writeString(delta, ADD_ONLY);

    MergeResult created = SpecMerger.merge(spec, delta);
    assertTrue(created.content().startsWith("# Spec Merge Specification\n"));
    assertFalse(Files.exists(spec), "merge does not write");

    Files.createDirectories(spec.getParent());
    Files.writeString(spec, BASE);
    Files.writeString(delta, DELTA);
    assertEquals(4, SpecMerger.merge(spec, delta).counts().total());
  }

  @Test
  void unreadableDelta(@TempDir Path dir) {
    assertThrows(
        SpecMergeException.class,
        () -> SpecMerger.merge(dir.resolve("spec.md"), dir.resolve("missing.md")));
  }

  @Test
  void capabilityTitles() {
    assertEquals("Spec Merge", SpecMerger.capabilityTitle("spec-merge"));
    assertEquals("Auth", SpecMerger.capabilityTitle("auth"));
    assertEquals("Capability", SpecMerger.capabilityTitle(" "));
    assertEquals("Capability", SpecMerger.capabilityTitle(null));
  }
}
