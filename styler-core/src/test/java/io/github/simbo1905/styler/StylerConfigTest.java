package io.github.simbo1905.styler;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StylerConfigTest extends StylerTestBase {

    @AfterEach
    void clearProperties() {
        System.clearProperty(StylerConfig.EXCLUDE_PROPERTY);
        System.clearProperty(StylerConfig.MINIMUM_VERSION_PROPERTY);
        System.clearProperty(StylerConfig.TOOLCHAIN_VERSION_PROPERTY);
        System.clearProperty(StylerConfig.ON_ERROR_PROPERTY);
        System.clearProperty(StylerConfig.ENABLE_PROPERTY);
        StylerConfig.resetDefaults();
    }

    @Test
    void standardConfigUsesTheToolchainAndStdlibExcludes() {
        final var config = StylerConfig.standard();
        assertThat(config.minimumSupportedVersion()).isEqualTo(StylerConfig.DEFAULT_TOOLCHAIN);
        assertThat(config.aliasLiftingExclude()).containsAll(StylerConfig.STDLIB);
        assertThat(config.onError()).isEqualTo(StylerConfig.OnError.LOG);
        assertThat(config.isEnabled("Anything")).isTrue();
    }

    @Test
    void defaultsAreASnapshotUntilReset() {
        System.setProperty(StylerConfig.MINIMUM_VERSION_PROPERTY, "1.14.0");
        StylerConfig.resetDefaults();
        final var first = StylerConfig.defaults();
        assertThat(first.minimumSupportedVersion()).isEqualTo(Version.of(1, 14, 0));

        System.setProperty(StylerConfig.MINIMUM_VERSION_PROPERTY, "1.16.0");
        assertThat(StylerConfig.defaults()).isSameAs(first);

        StylerConfig.resetDefaults();
        assertThat(StylerConfig.defaults().minimumSupportedVersion()).isEqualTo(Version.of(1, 16, 0));
    }

    @Test
    void systemPropertiesFeedEveryField() {
        System.setProperty(StylerConfig.EXCLUDE_PROPERTY, "Foo, Elixir.Bar");
        System.setProperty(StylerConfig.ON_ERROR_PROPERTY, "RAISE");
        System.setProperty(StylerConfig.ENABLE_PROPERTY, "AliasLifting,Deprecations");
        StylerConfig.resetDefaults();

        final var config = StylerConfig.defaults();
        assertThat(config.aliasLiftingExclude()).contains("Foo", "Bar", "Enum");
        assertThat(config.onError()).isEqualTo(StylerConfig.OnError.RAISE);
        assertThat(config.enabledRules()).containsExactly("AliasLifting", "Deprecations");
        assertThat(config.isEnabled("Deprecations")).isTrue();
        assertThat(config.isEnabled("PipeChainStart")).isFalse();
    }

    @Test
    void invalidPropertiesFallBackToDefaults() {
        System.setProperty(StylerConfig.MINIMUM_VERSION_PROPERTY, "not-a-version");
        System.setProperty(StylerConfig.TOOLCHAIN_VERSION_PROPERTY, "1.15.2");
        System.setProperty(StylerConfig.ON_ERROR_PROPERTY, "explode");
        StylerConfig.resetDefaults();

        final var config = StylerConfig.defaults();
        assertThat(config.minimumSupportedVersion()).isEqualTo(Version.of(1, 15, 2));
        assertThat(config.onError()).isEqualTo(StylerConfig.OnError.LOG);
    }

    @Test
    void fromOptionsReadsFormatterOptions() {
        final var config = StylerConfig.fromOptions(Map.of(
                "alias_lifting_exclude", List.of("Elixir.Foo", "Bar"),
                "minimum_supported_elixir_version", "1.13.0",
                "on_error", "raise",
                "line_length", 98));
        assertThat(config.excludesFromLifting("Foo")).isTrue();
        assertThat(config.excludesFromLifting("Bar")).isTrue();
        assertThat(config.excludesFromLifting("Baz")).isFalse();
        assertThat(config.minimumSupportedVersion()).isEqualTo(Version.of(1, 13, 0));
        assertThat(config.onError()).isEqualTo(StylerConfig.OnError.RAISE);
    }

    @Test
    void fromOptionsRejectsBadValues() {
        assertThatThrownBy(() -> StylerConfig.fromOptions(Map.of("alias_lifting_exclude", List.of(42))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("alias_lifting_exclude");
        assertThatThrownBy(() -> StylerConfig.fromOptions(Map.of("minimum_supported_elixir_version", "one")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StylerConfig.fromOptions(Map.of("on_error", "ignore")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void supportsComparesAgainstTheMinimum() {
        final var config = StylerConfig.standard().withMinimumSupportedVersion(Version.parse("1.15"));
        assertThat(config.supports(Version.of(1, 11, 0))).isTrue();
        assertThat(config.supports(Version.of(1, 15, 0))).isTrue();
        assertThat(config.supports(Version.of(1, 16, 0))).isFalse();
    }
}
