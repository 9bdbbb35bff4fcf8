package io.github.simbo1905.styler.rules;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import io.github.simbo1905.styler.Node;
import io.github.simbo1905.styler.Node.Call;
import io.github.simbo1905.styler.Node.Leaf;
import io.github.simbo1905.styler.Node.Meta;
import io.github.simbo1905.styler.Node.Sequence;
import io.github.simbo1905.styler.Rule;
import io.github.simbo1905.styler.StyleContext;
import io.github.simbo1905.styler.Syntax;
import io.github.simbo1905.styler.Syntax.Remote;
import io.github.simbo1905.styler.Version;
import io.github.simbo1905.styler.Zipper;
import io.github.simbo1905.styler.Zipper.Walk;

/// Replaces deprecated calls with their successors.
///
/// Each rewrite applies only when its replacement exists in the oldest toolchain the code must
/// support ([io.github.simbo1905.styler.StylerConfig#supports(Version)]):
///
/// | deprecated | replacement | available since |
/// |---|---|---|
/// | `Logger.warn` | `Logger.warning` | 1.11 |
/// | `List.zip` | `Enum.zip` | 1.0 |
/// | `Path.safe_relative_to` | `Path.safe_relative` | 1.16 |
/// | `IO.read(:all)`, `IO.binread(:all)` | `:eof` | 1.13 |
/// | `Enum.slice(e, 2..-1)`, `String.slice` | explicit `//1` step | 1.12 |
/// | `first..last` as a pattern | `first..last//_` | 1.12 |
/// | `Date.range(~D[later], ~D[earlier])` | explicit `-1` step | 1.12 |
/// | `File.stream!(path, modes, :line)` | `File.stream!(path, :line, modes)` | 1.16 |
/// | `~R` | `~r` | 1.0 |
///
/// Calls taking their first argument from a pipe, like `first |> Date.range(last)`, are rewritten
/// the same way.
///
/// A module name that a local alias has rebound, such as `Logger` after `alias MyApp.Logger`, is
/// not the standard module and is left alone.
public final class Deprecations implements Rule {

    private static final Logger LOG = Logger.getLogger(Deprecations.class.getName());

    static final Version LOGGER_WARNING = Version.of(1, 11, 0);
    static final Version ENUM_ZIP = Version.of(1, 0, 0);
    static final Version SAFE_RELATIVE = Version.of(1, 16, 0);
    static final Version IO_EOF = Version.of(1, 13, 0);
    static final Version STEPPED_RANGE = Version.of(1, 12, 0);
    static final Version LOWER_REGEX_SIGIL = Version.of(1, 0, 0);
    static final Version DATE_RANGE_STEP = Version.of(1, 12, 0);
    static final Version FILE_STREAM_ORDER = Version.of(1, 16, 0);

    private static final Set<String> RANGE_BINDINGS = Set.of("=", "<-");

    @Override
    public Walk<StyleContext> run(Zipper zipper, StyleContext context) {
        final var node = zipper.node();
        final Optional<Node> rewritten;
        if (Syntax.isCall(node, "sigil_R")) {
            rewritten = supported(context, LOWER_REGEX_SIGIL)
                    ? Optional.of(new Call(new Leaf("sigil_r"), ((Call) node).meta(), ((Call) node).args()))
                    : Optional.empty();
        } else if (node instanceof Call call && Syntax.callName(call).isPresent()) {
            rewritten = supported(context, STEPPED_RANGE) ? stepRangePatterns(call) : Optional.empty();
        } else {
            rewritten = Syntax.remote(node).flatMap(remote -> rewriteRemote((Call) node, remote, zipper, context));
        }
        if (rewritten.isEmpty()) {
            return Walk.cont(zipper, context);
        }
        LOG.fine(() -> "Replaced deprecated call on line " + node.line() + " in " + context.file());
        return Walk.cont(zipper.replace(rewritten.get()), context);
    }

    private static Optional<Node> rewriteRemote(Call call, Remote remote, Zipper zipper, StyleContext context) {
        final var module = remote.moduleSegments().filter(path -> path.size() == 1).map(path -> path.get(0));
        if (module.isEmpty()) {
            return Optional.empty();
        }
        final var name = module.get();
        final var fun = remote.function();
        final Optional<Node> candidate = switch (name) {
            case "Logger" -> fun.equals("warn") && supported(context, LOGGER_WARNING)
                    ? Optional.of(rename(call, remote, "Logger", "warning"))
                    : Optional.empty();
            case "List" -> fun.equals("zip") && supported(context, ENUM_ZIP)
                    ? Optional.of(rename(call, remote, "Enum", "zip"))
                    : Optional.empty();
            case "Path" -> fun.equals("safe_relative_to") && supported(context, SAFE_RELATIVE)
                    ? Optional.of(rename(call, remote, "Path", "safe_relative"))
                    : Optional.empty();
            case "IO" -> (fun.equals("read") || fun.equals("binread")) && supported(context, IO_EOF)
                    ? allToEof(call)
                    : Optional.empty();
            case "Enum", "String" -> fun.equals("slice") && supported(context, STEPPED_RANGE)
                    ? stepDecreasingRange(call)
                    : Optional.empty();
            case "Date" -> fun.equals("range") && supported(context, DATE_RANGE_STEP)
                    ? stepDecreasingDates(call, pipedValue(zipper))
                    : Optional.empty();
            case "File" -> fun.equals("stream!") && supported(context, FILE_STREAM_ORDER)
                    ? reorderStreamArgs(call, pipedValue(zipper).isPresent())
                    : Optional.empty();
            default -> Optional.empty();
        };
        if (candidate.isEmpty() || context.aliases(zipper).lookup(name).isPresent()) {
            return Optional.empty();
        }
        return candidate;
    }

    private static boolean supported(StyleContext context, Version since) {
        return context.config().supports(since);
    }

    private static Node rename(Call call, Remote remote, String module, String function) {
        final var target = remote.module() instanceof Call aliases
                ? Syntax.aliases(aliases.meta(), List.of(module))
                : Syntax.aliases(List.of(module));
        final var dot = (Call) call.head();
        return Syntax.remoteCall(target, function, dot.meta(), call.args()).withMeta(call.meta());
    }

    /// `IO.read(:all)` and `IO.read(device, :all)` read to `:eof` instead.
    private static Optional<Node> allToEof(Call call) {
        final var args = call.args();
        if (args.isEmpty() || args.size() > 2 || !Syntax.isAtom(args.get(args.size() - 1), "all")) {
            return Optional.empty();
        }
        final var all = (Call) args.get(args.size() - 1);
        final var updated = new ArrayList<>(args);
        updated.set(args.size() - 1, Syntax.literal("eof", all.meta()));
        return Optional.of(call.withArgs(updated));
    }

    /// A range that counts down, like `2..-1`, needs an explicit `//1` step to slice to the end.
    private static Optional<Node> stepDecreasingRange(Call call) {
        final var args = call.args();
        if (args.isEmpty() || !Syntax.isCall(args.get(args.size() - 1), "..")) {
            return Optional.empty();
        }
        final var range = (Call) args.get(args.size() - 1);
        if (range.args().size() != 2) {
            return Optional.empty();
        }
        final var start = integerValue(range.args().get(0));
        final var stop = integerValue(range.args().get(1));
        if (start.isEmpty() || stop.isEmpty() || start.get() <= stop.get()) {
            return Optional.empty();
        }
        final var stopLine = range.args().get(1).line();
        final var step = Syntax.literal(1, (stopLine == null ? Meta.NONE : Meta.line(stopLine)).with(Syntax.TOKEN, "1"));
        final var stepped = Syntax.local("..//", range.meta(), List.of(range.args().get(0), range.args().get(1), step));
        final var updated = new ArrayList<>(args);
        updated.set(args.size() - 1, stepped);
        return Optional.of(call.withArgs(updated));
    }

    /// Ranges used as patterns must spell out their step, `first..last//_`.
    ///
    /// Covers the left of `=` and `<-`, a single `->` clause pattern, and `def`/`defp` parameters.
    private static Optional<Node> stepRangePatterns(Call call) {
        final var name = Syntax.callName(call).orElseThrow();
        final var args = call.args();
        if (RANGE_BINDINGS.contains(name) && args.size() == 2 && isRange(args.get(0))) {
            return Optional.of(call.withArgs(List.of(stepAny((Call) args.get(0)), args.get(1))));
        }
        if (name.equals("->") && args.size() == 2 && args.get(0) instanceof Sequence patterns
                && patterns.elements().size() == 1 && isRange(patterns.elements().get(0))) {
            final var pattern = Node.seq(stepAny((Call) patterns.elements().get(0)));
            return Optional.of(call.withArgs(List.of(pattern, args.get(1))));
        }
        if ((name.equals("def") || name.equals("defp")) && !args.isEmpty()
                && args.get(0) instanceof Call head && Syntax.callName(head).isPresent()
                && head.args().stream().anyMatch(Deprecations::isRange)) {
            final var params = head.args().stream()
                    .map(param -> isRange(param) ? stepAny((Call) param) : param)
                    .toList();
            final var updated = new ArrayList<>(args);
            updated.set(0, head.withArgs(params));
            return Optional.of(call.withArgs(updated));
        }
        return Optional.empty();
    }

    private static boolean isRange(Node node) {
        return Syntax.isCall(node, "..") && ((Call) node).args().size() == 2;
    }

    private static Call stepAny(Call range) {
        final var last = range.args().get(1);
        final var any = Syntax.variable("_", last.line() == null ? Meta.NONE : Meta.line(last.line()));
        return Syntax.local("..//", range.meta(), List.of(range.args().get(0), last, any));
    }

    /// `Date.range(first, last)` counting down needs the `-1` step of `Date.range/3`.
    ///
    /// Only dates written as `~D` sigils are compared. `piped` holds `first` when the call is the
    /// right hand side of a pipe and so carries `last` alone.
    private static Optional<Node> stepDecreasingDates(Call call, Optional<Node> piped) {
        final var args = call.args();
        final int arity = piped.isPresent() ? 1 : 2;
        if (args.size() != arity) {
            return Optional.empty();
        }
        final var first = dateValue(piped.orElseGet(() -> args.get(0)));
        final var last = dateValue(args.get(arity - 1));
        if (first.isEmpty() || last.isEmpty() || !first.get().isAfter(last.get())) {
            return Optional.empty();
        }
        final var line = args.get(arity - 1).line();
        final var meta = line == null ? Meta.NONE : Meta.line(line);
        final var minusOne = Syntax.local("-", meta, List.of(Syntax.literal(1, meta.with(Syntax.TOKEN, "1"))));
        final var updated = new ArrayList<>(args);
        updated.add(minusOne);
        return Optional.of(call.withArgs(updated));
    }

    private static Optional<LocalDate> dateValue(Node node) {
        if (!Syntax.isCall(node, "sigil_D") || ((Call) node).args().isEmpty()
                || !(((Call) node).args().get(0) instanceof Call string)
                || string.args().size() != 1
                || !(string.args().get(0) instanceof Leaf leaf)
                || !(leaf.value() instanceof String text)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(text));
        } catch (DateTimeParseException e) {
            LOG.finer(() -> "Not an ISO date: " + text);
            return Optional.empty();
        }
    }

    /// `File.stream!(path, modes, line_or_bytes)` takes `line_or_bytes` before `modes`.
    private static Optional<Node> reorderStreamArgs(Call call, boolean piped) {
        final var args = call.args();
        final int modes = piped ? 0 : 1;
        if (args.size() != modes + 2 || !isListLiteral(args.get(modes))) {
            return Optional.empty();
        }
        final var updated = new ArrayList<>(args);
        updated.set(modes, args.get(modes + 1));
        updated.set(modes + 1, args.get(modes));
        return Optional.of(call.withArgs(updated));
    }

    private static boolean isListLiteral(Node node) {
        return Syntax.isBlock(node) && ((Call) node).args().size() == 1 && ((Call) node).args().get(0) instanceof Sequence;
    }

    /// {@return the piped in first argument when the focus is the right hand side of a pipe}
    private static Optional<Node> pipedValue(Zipper zipper) {
        if (zipper.leftSiblings().size() != 1 || !zipper.up().map(parent -> Syntax.isPipe(parent.node())).orElse(false)) {
            return Optional.empty();
        }
        return Optional.of(zipper.leftSiblings().get(0));
    }

    private static Optional<Long> integerValue(Node node) {
        if (Syntax.isCall(node, "-") && ((Call) node).args().size() == 1) {
            return integerValue(((Call) node).args().get(0)).map(v -> -v);
        }
        return Syntax.literalValue(node)
                .filter(v -> v instanceof Integer || v instanceof Long)
                .map(v -> ((Number) v).longValue());
    }
}
