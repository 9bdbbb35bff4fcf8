package io.github.simbo1905.styler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Settings for one styling run.
///
/// A config is an immutable value handed to [Styler] and passed to every rule through
/// [StyleContext]. [#defaults()] is a snapshot read once from system properties:
/// - `styler.alias_lifting_exclude`: comma separated module names alias lifting must never introduce
/// - `styler.minimum_supported_elixir_version`: oldest toolchain the code must keep supporting
/// - `styler.toolchain_version`: the toolchain in use, the default minimum (`1.18.0` if unset)
/// - `styler.on_error`: `log` (default) or `raise`
/// - `styler.enable`: comma separated rule names; unset runs every rule
///
/// Invalid property values are logged at WARNING and replaced by their default.
///
/// @param aliasLiftingExclude short names never lifted, including the standard library set
/// @param minimumSupportedVersion deprecation rewrites need their replacement available at this version
/// @param onError what to do when a rule throws
/// @param enabledRules names of the rules to run, empty for all
public record StylerConfig(
        Set<String> aliasLiftingExclude,
        Version minimumSupportedVersion,
        OnError onError,
        List<String> enabledRules
) {

    private static final Logger LOG = Logger.getLogger(StylerConfig.class.getName());

    public static final String EXCLUDE_PROPERTY = "styler.alias_lifting_exclude";
    public static final String MINIMUM_VERSION_PROPERTY = "styler.minimum_supported_elixir_version";
    public static final String TOOLCHAIN_VERSION_PROPERTY = "styler.toolchain_version";
    public static final String ON_ERROR_PROPERTY = "styler.on_error";
    public static final String ENABLE_PROPERTY = "styler.enable";

    public static final Version DEFAULT_TOOLCHAIN = Version.of(1, 18, 0);

    /// Standard library and common framework modules that are never lifted.
    public static final Set<String> STDLIB = Set.of(
            "Access", "Agent", "Application", "Atom", "Base", "Behaviour", "Bitwise", "Code", "Date",
            "DateTime", "Dict", "Ecto", "Enum", "Exception", "File", "Float", "GenEvent", "GenServer",
            "HashDict", "HashSet", "Integer", "IO", "Kernel", "Keyword", "List", "Macro", "Map", "MapSet",
            "Module", "NaiveDateTime", "Node", "Oban", "OptionParser", "Path", "Port", "Process", "Protocol",
            "Range", "Record", "Regex", "Registry", "Set", "Stream", "String", "StringIO", "Supervisor",
            "System", "Task", "Time", "Tuple", "URI", "Version");

    /// Reaction to a rule throwing.
    public enum OnError {
        /// log a warning, stop running that rule for the file, and carry on
        LOG,
        /// rethrow as a [StyleException]
        RAISE
    }

    private static volatile StylerConfig defaults;

    public StylerConfig {
        Objects.requireNonNull(aliasLiftingExclude, "aliasLiftingExclude must not be null");
        Objects.requireNonNull(minimumSupportedVersion, "minimumSupportedVersion must not be null");
        Objects.requireNonNull(onError, "onError must not be null");
        Objects.requireNonNull(enabledRules, "enabledRules must not be null");
        final var excludes = new LinkedHashSet<String>(STDLIB);
        aliasLiftingExclude.forEach(name -> excludes.add(stripElixirPrefix(name)));
        aliasLiftingExclude = Set.copyOf(excludes);
        enabledRules = List.copyOf(enabledRules);
    }

    /// {@return the process-wide defaults, read from system properties on first use}
    public static StylerConfig defaults() {
        var config = defaults;
        if (config == null) {
            synchronized (StylerConfig.class) {
                config = defaults;
                if (config == null) {
                    config = fromSystemProperties();
                    defaults = config;
                }
            }
        }
        return config;
    }

    /// Forgets the snapshot so the next [#defaults()] re-reads system properties. For tests.
    public static void resetDefaults() {
        synchronized (StylerConfig.class) {
            defaults = null;
        }
    }

    /// {@return a config with no extra excludes, the toolchain version, LOG and every rule}
    public static StylerConfig standard() {
        return new StylerConfig(Set.of(), toolchainVersion(), OnError.LOG, List.of());
    }

    /// Builds a config from formatter style options, e.g.
    /// `{"alias_lifting_exclude": ["Foo"], "minimum_supported_elixir_version": "1.15.0"}`.
    ///
    /// Unknown keys are ignored.
    /// @throws IllegalArgumentException when a known key holds an unusable value
    public static StylerConfig fromOptions(Map<String, ?> options) {
        Objects.requireNonNull(options, "options must not be null");
        final var excludes = new LinkedHashSet<String>();
        for (final var raw : asList(options.get("alias_lifting_exclude"))) {
            if (!(raw instanceof String name)) {
                throw new IllegalArgumentException("Expected a module name for alias_lifting_exclude, got: " + raw);
            }
            excludes.add(name);
        }
        final var minimum = options.get("minimum_supported_elixir_version");
        final Version version;
        if (minimum == null) {
            version = toolchainVersion();
        } else if (minimum instanceof Version v) {
            version = v;
        } else {
            version = Version.parse(minimum.toString());
        }
        final var onErrorValue = options.get("on_error");
        final var onError = onErrorValue == null ? OnError.LOG : parseOnError(onErrorValue.toString());
        final var enabled = new ArrayList<String>();
        for (final var raw : asList(options.get("enable"))) {
            if (!(raw instanceof String name)) {
                throw new IllegalArgumentException("Expected a rule name for enable, got: " + raw);
            }
            enabled.add(name);
        }
        options.keySet().stream()
                .filter(key -> !Set.of("alias_lifting_exclude", "minimum_supported_elixir_version", "on_error", "enable")
                        .contains(key))
                .forEach(key -> LOG.fine(() -> "Ignoring unknown option: " + key));
        return new StylerConfig(excludes, version, onError, enabled);
    }

    /// {@return true when an API introduced in `since` can be used by code that must still run on the
    /// minimum supported version}
    public boolean supports(Version since) {
        return minimumSupportedVersion.isAtLeast(since);
    }

    public boolean excludesFromLifting(String name) {
        return aliasLiftingExclude.contains(name);
    }

    public boolean isEnabled(String rule) {
        return enabledRules.isEmpty() || enabledRules.contains(rule);
    }

    public StylerConfig withMinimumSupportedVersion(Version version) {
        return new StylerConfig(aliasLiftingExclude, version, onError, enabledRules);
    }

    public StylerConfig withOnError(OnError onError) {
        return new StylerConfig(aliasLiftingExclude, minimumSupportedVersion, onError, enabledRules);
    }

    public StylerConfig withEnabledRules(List<String> rules) {
        return new StylerConfig(aliasLiftingExclude, minimumSupportedVersion, onError, rules);
    }

    public StylerConfig withAliasLiftingExclude(Set<String> names) {
        return new StylerConfig(names, minimumSupportedVersion, onError, enabledRules);
    }

    static StylerConfig fromSystemProperties() {
        final var toolchain = toolchainVersion();
        final var minimumValue = System.getProperty(MINIMUM_VERSION_PROPERTY);
        Version minimum = toolchain;
        if (minimumValue != null) {
            try {
                minimum = Version.parse(minimumValue);
                final var parsed = minimum;
                LOG.fine(() -> "Minimum supported version set to " + parsed + " via system property");
            } catch (IllegalArgumentException e) {
                LOG.warning(() -> "Invalid " + MINIMUM_VERSION_PROPERTY + ": " + minimumValue
                        + ". Using default: " + toolchain);
            }
        }

        OnError onError = OnError.LOG;
        final var onErrorValue = System.getProperty(ON_ERROR_PROPERTY);
        if (onErrorValue != null) {
            try {
                onError = parseOnError(onErrorValue);
            } catch (IllegalArgumentException e) {
                LOG.warning(() -> "Invalid " + ON_ERROR_PROPERTY + ": " + onErrorValue + ". Using default: LOG");
            }
        }

        final var config = new StylerConfig(
                Set.copyOf(splitList(System.getProperty(EXCLUDE_PROPERTY))),
                minimum,
                onError,
                splitList(System.getProperty(ENABLE_PROPERTY)));
        LOG.fine(() -> "Styler defaults: " + config);
        return config;
    }

    static Version toolchainVersion() {
        final var value = System.getProperty(TOOLCHAIN_VERSION_PROPERTY);
        if (value == null) {
            return DEFAULT_TOOLCHAIN;
        }
        try {
            return Version.parse(value);
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> "Invalid " + TOOLCHAIN_VERSION_PROPERTY + ": " + value + ". Using default: "
                    + DEFAULT_TOOLCHAIN);
            return DEFAULT_TOOLCHAIN;
        }
    }

    private static OnError parseOnError(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "log" -> OnError.LOG;
            case "raise" -> OnError.RAISE;
            default -> throw new IllegalArgumentException("on_error must be log or raise, got: " + value);
        };
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static Collection<?> asList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        return List.of(value);
    }

    private static String stripElixirPrefix(String name) {
        return name.startsWith("Elixir.") ? name.substring("Elixir.".length()) : name;
    }
}
