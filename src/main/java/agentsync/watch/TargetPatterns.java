package agentsync.watch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.tuple.Pair;
import org.eclipse.jgit.ignore.FastIgnoreRule;
import org.jooq.lambda.Seq;

/**
 * Per-{@link WatchTarget} lists of .gitignore-style rules, used to classify a changed path.
 *
 * Rules are evaluated against the path relative to the watched root. A rule
 * with a slash in the middle, e.g. {@code agents/*.md}, matches at any depth
 * rather than only at the root, so {@code x/agents/foo.md} is an agent too.
 * Within one target the last matching rule wins, so {@code !} rules can carve
 * out exceptions.
 */
public class TargetPatterns {

  private final Map<WatchTarget, List<Pair<String, FastIgnoreRule>>> rules = new EnumMap<>(WatchTarget.class);

  public static TargetPatterns defaults() {
    TargetPatterns p = new TargetPatterns();
    p.setRules(WatchTarget.CONFIG, "*.toml", "*.json", "*.yaml", "*.yml", "config.toml", "settings.json");
    p.setRules(WatchTarget.AGENTS, "*.md", "*.yaml", "*.yml", "*agent*.md", "agents/*.md");
    p.setRules(WatchTarget.TOOLS, ".cursorrules", "settings.json", "claude_*", "cursor_*");
    p.setRules(WatchTarget.TEMPLATES, "*.md", "*.yaml", "*.yml", "template_*", "templates/*.md");
    p.setRules(WatchTarget.INTEGRATIONS, "*integration*", "*adapter*", "*.json");
    return p;
  }

  /** @return patterns with no rules at all, so only the ancestor heuristic classifies */
  public static TargetPatterns none() {
    return new TargetPatterns();
  }

  public TargetPatterns setRules(WatchTarget target, String... lines) {
    return setRules(target, Arrays.asList(lines));
  }

  public TargetPatterns setRules(WatchTarget target, List<String> lines) {
    List<Pair<String, FastIgnoreRule>> parsed = new ArrayList<>();
    for (String line : lines) {
      String trimmed = line.trim();
      if (trimmed.length() > 0 && !trimmed.startsWith("#")) {
        FastIgnoreRule rule = new FastIgnoreRule(unanchor(trimmed));
        if (!rule.isEmpty()) {
          parsed.add(Pair.of(trimmed, rule));
        }
      }
    }
    rules.put(target, parsed);
    return this;
  }

  /** @return the first target, in declaration order, whose rules match {@code relativePath} */
  public Optional<WatchTarget> match(String relativePath) {
    for (WatchTarget target : WatchTarget.values()) {
      if (matches(target, relativePath)) {
        return Optional.of(target);
      }
    }
    return Optional.empty();
  }

  public boolean matches(WatchTarget target, String relativePath) {
    boolean result = false;
    for (Pair<String, FastIgnoreRule> t : rules.getOrDefault(target, Collections.emptyList())) {
      FastIgnoreRule rule = t.getRight();
      if (rule.isMatch(relativePath, false)) {
        result = rule.getResult();
        // keep going so a later "!..." can undo this
      }
    }
    return result;
  }

  public List<String> getLines(WatchTarget target) {
    return Seq.seq(rules.getOrDefault(target, Collections.emptyList())).map(Pair::getLeft).toList();
  }

  @Override
  public String toString() {
    Map<WatchTarget, List<String>> lines = new EnumMap<>(WatchTarget.class);
    rules.keySet().forEach(t -> lines.put(t, getLines(t)));
    return lines.toString();
  }

  private static String unanchor(String line) {
    boolean negated = line.startsWith("!");
    String body = negated ? line.substring(1) : line;
    int slash = body.indexOf('/');
    if (slash > 0 && slash < body.length() - 1 && !body.startsWith("**/")) {
      body = "**/" + body;
    }
    return negated ? "!" + body : body;
  }

}
