package io.spectr.shell.archive;

import io.spectr.markdown.api.Document;
import io.spectr.markdown.api.EncodingException;
import io.spectr.markdown.api.Markdown;
import io.spectr.markdown.api.NodeHandle;
import io.spectr.markdown.api.NodeKind;
import io.spectr.markdown.spec.DeltaPlan;
import io.spectr.markdown.spec.RenameOp;
import io.spectr.markdown.spec.Requirement;
import io.spectr.markdown.spec.RequirementExtractor;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the operations of a delta spec to a base spec.
 *
 * <p>Operations run in the order RENAMED, REMOVED, MODIFIED, ADDED and match requirements by
 * normalized name. Operations naming a requirement the base does not have are skipped. The
 * base keeps everything outside its {@code ## Requirements} section byte for byte, and the
 * requirements that survive keep their order; added requirements go to the end of the section.
 * Runs of three or more newlines in the result collapse to a single blank line.
 */
public final class SpecMerger {
  private static final Logger log = LoggerFactory.getLogger(SpecMerger.class);

  static final String REQUIREMENTS_SECTION = "Requirements";
  private static final Pattern BLANK_RUN = Pattern.compile("\n{3,}");

  private SpecMerger() {}

  /**
   * Merges a delta into a base spec.
   *
   * @param base the current spec, or {@code null} when the capability has no spec yet
   * @param delta the delta spec of a change
   * @param capability capability id used for the title of a new spec, such as {@code
   *     archive-workflow}
   */
  public static MergeResult merge(Document base, Document delta, String capability)
      throws SpecMergeException {
    DeltaPlan plan = RequirementExtractor.extractDelta(delta);
    if (!plan.hasDeltas()) {
      throw new SpecMergeException("Delta spec has no operations");
    }
    if (base == null) {
      return create(plan, capability);
    }
    return new Merge(base, plan).run();
  }

  /**
   * Merges the delta file into the spec file; a missing spec file is created from the delta.
   * The capability id is the name of the spec file's directory. Nothing is written.
   */
  public static MergeResult merge(Path baseSpec, Path deltaSpec) throws SpecMergeException {
    try {
      Document delta = Markdown.read(deltaSpec);
      Document base = Files.exists(baseSpec) ? Markdown.read(baseSpec) : null;
      Path dir = baseSpec.toAbsolutePath().getParent();
      String capability = dir != null && dir.getFileName() != null ? dir.getFileName().toString() : "";
      return merge(base, delta, capability);
    } catch (IOException | EncodingException e) {
      throw new SpecMergeException("Failed to read spec: " + e.getMessage(), e);
    }
  }

  private static MergeResult create(DeltaPlan plan, String capability) throws SpecMergeException {
    if (!plan.modified().isEmpty() || !plan.removed().isEmpty() || !plan.renamed().isEmpty()) {
      throw new SpecMergeException(
          "Target spec does not exist; only ADDED requirements are allowed for new specs");
    }
    StringBuilder out = new StringBuilder(skeleton(capability));
    for (Requirement r : plan.added()) {
      out.append('\n').append(stripTrailingNewlines(r.rawText())).append('\n');
    }
    log.debug("Created spec for '{}' with {} requirements", capability, plan.added().size());
    return new MergeResult(out.toString(), new OperationCounts(plan.added().size(), 0, 0, 0));
  }

  static String skeleton(String capability) {
    return "# " + capabilityTitle(capability) + " Specification\n\n## " + REQUIREMENTS_SECTION + "\n";
  }

  /** Converts a kebab-case capability id to title case: {@code spec-merge} to {@code Spec Merge}. */
  static String capabilityTitle(String capability) {
    if (capability == null || capability.isBlank()) {
      return "Capability";
    }
    StringBuilder sb = new StringBuilder();
    for (String word : capability.split("-")) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      if (!word.isEmpty()) {
        sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
      }
    }
    return sb.toString();
  }

  static String stripTrailingNewlines(String s) {
    int end = s.length();
    while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) {
      end--;
    }
    return s.substring(0, end);
  }

  private static final class Merge {
    private final Document base;
    private final byte[] src;
    private final DeltaPlan plan;

    private int sectionStart = -1;
    private int sectionEnd;
    // keyed by the name the requirement had in the base, so renames keep their place
    private final Map<String, Requirement> byBaseName = new LinkedHashMap<>();
    private final Map<String, String> baseNameByCurrent = new LinkedHashMap<>();
    private int firstRequirementStart = -1;

    Merge(Document base, DeltaPlan plan) {
      this.base = base;
      this.src = base.printBytes();
      this.plan = plan;
    }

    MergeResult run() {
      locateSection();
      int renamed = renamed();
      int removed = removed();
      int modified = modified();
      String content = assemble();
      OperationCounts counts = new OperationCounts(plan.added().size(), modified, removed, renamed);
      log.debug("Merged delta into spec: {}", counts);
      return new MergeResult(content, counts);
    }

    private void locateSection() {
      sectionEnd = src.length;
      for (NodeHandle block : base.root().contentChildren()) {
        if (block.kind() != NodeKind.HEADER || block.level() > 2) {
          continue;
        }
        if (sectionStart >= 0) {
          sectionEnd = block.start();
          break;
        }
        if (block.level() == 2 && REQUIREMENTS_SECTION.equals(block.text().strip())) {
          sectionStart = block.end();
        }
      }
      if (sectionStart < 0) {
        return;
      }
      for (Requirement r : RequirementExtractor.extractRequirements(base)) {
        int start = base.lineIndex().lineStart(r.line());
        if (start < sectionStart || start >= sectionEnd) {
          continue;
        }
        if (firstRequirementStart < 0) {
          firstRequirementStart = start;
        }
        byBaseName.putIfAbsent(r.normalizedName(), r);
        baseNameByCurrent.putIfAbsent(r.normalizedName(), r.normalizedName());
      }
    }

    private int renamed() {
      int count = 0;
      for (RenameOp op : plan.renamed()) {
        String from = Requirement.normalize(op.from());
        String key = baseNameByCurrent.remove(from);
        if (key == null) {
          log.debug("Rename source '{}' not found", op.from());
          continue;
        }
        Requirement r = byBaseName.get(key);
        String header = "### Requirement: " + op.to();
        String raw = r.rawText();
        int eol = raw.indexOf('\n');
        raw = eol < 0 ? header : header + raw.substring(eol);
        byBaseName.put(key, new Requirement(op.to(), header, raw, r.scenarios(), r.line()));
        baseNameByCurrent.put(Requirement.normalize(op.to()), key);
        count++;
      }
      return count;
    }

    private int removed() {
      int count = 0;
      for (String name : plan.removed()) {
        String key = baseNameByCurrent.remove(Requirement.normalize(name));
        if (key == null) {
          log.debug("Removed requirement '{}' not found", name);
          continue;
        }
        byBaseName.remove(key);
        count++;
      }
      return count;
    }

    private int modified() {
      int count = 0;
      for (Requirement r : plan.modified()) {
        String key = baseNameByCurrent.get(r.normalizedName());
        if (key == null) {
          log.debug("Modified requirement '{}' not found", r.name());
          continue;
        }
        byBaseName.put(key, r);
        count++;
      }
      return count;
    }

    private String assemble() {
      StringBuilder out = new StringBuilder();
      String after;
      if (sectionStart < 0) {
        out.append(text(0, src.length));
        ensureNewline(out);
        out.append("\n## ").append(REQUIREMENTS_SECTION).append('\n');
        after = "";
      } else {
        int leadEnd = firstRequirementStart >= 0 ? firstRequirementStart : sectionEnd;
        out.append(text(0, leadEnd));
        ensureNewline(out);
        after = text(sectionEnd, src.length);
      }
      List<Requirement> requirements = new ArrayList<>(byBaseName.values());
      requirements.addAll(plan.added());
      for (Requirement r : requirements) {
        out.append('\n').append(stripTrailingNewlines(r.rawText())).append('\n');
      }
      if (!after.isEmpty()) {
        out.append('\n').append(after);
      }
      String merged = BLANK_RUN.matcher(out).replaceAll("\n\n");
      return after.isEmpty() ? stripTrailingNewlines(merged) + "\n" : merged;
    }

    private String text(int from, int to) {
      return new String(src, from, to - from, StandardCharsets.UTF_8);
    }

    private static void ensureNewline(StringBuilder sb) {
      if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') {
        sb.append('\n');
      }
    }
  }
}
