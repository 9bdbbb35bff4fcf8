package io.github.simbo1905.styler;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Entry point: runs the enabled rules over a file, then repairs line metadata for the printer.
///
/// A `Styler` holds no per-file state, so one instance may style many files, on any thread.
public final class Styler {

    private static final Logger LOG = Logger.getLogger(Styler.class.getName());

    private final StylerConfig config;
    private final RuleEngine engine;

    /// @param config the run's configuration
    /// @param catalog every available rule, in priority order
    /// @throws IllegalArgumentException when `config` enables a rule the catalog does not have
    public Styler(StylerConfig config, List<Rule> catalog) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");
        final Set<String> known = catalog.stream().map(Rule::name).collect(Collectors.toSet());
        for (final var name : config.enabledRules()) {
            if (!known.contains(name)) {
                throw new IllegalArgumentException("Unknown rule: " + name + ". Known rules: " + known);
            }
        }
        this.engine = new RuleEngine(catalog.stream().filter(rule -> config.isEnabled(rule.name())).toList());
    }

    public StylerConfig config() {
        return config;
    }

    public SourceTree style(SourceTree source) {
        Objects.requireNonNull(source, "source must not be null");
        final var context = new StyleContext(source.comments(), source.file(), config);
        final var fold = engine.run(Zipper.zip(source.root()), context);
        final var styled = LineFixup.fixBlocks(new SourceTree(fold.zipper().root(), fold.acc().comments(), source.file()));
        LOG.fine(() -> "Styled " + source.file());
        return styled;
    }
}
