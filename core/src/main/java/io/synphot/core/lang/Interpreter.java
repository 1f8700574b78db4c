package io.synphot.core.lang;

import io.synphot.core.error.DisjointSpectrumException;
import io.synphot.core.error.ParserException;
import io.synphot.core.model.NormalizationResult;
import io.synphot.core.spectrum.FluxUnit;
import io.synphot.core.spectrum.Formats;
import io.synphot.core.spectrum.ReddeningLaw;
import io.synphot.core.spectrum.SourceSpectrum;
import io.synphot.core.spectrum.SpectralElement;
import io.synphot.core.spectrum.Spectrum;
import io.synphot.core.spi.SpectralResources;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a syntax tree bottom-up. Each node's value is assigned after all of its children's.
 *
 * <p>
 * Identifiers evaluate to text; text is turned into a spectrum (loaded from the file it names)
 * only when an operator, a group or the final result needs a spectrum. Functions are looked up
 * by exact name:
 *
 * <table>
 * <caption>Functions</caption>
 * <tr><th>name</th><th>arguments</th><th>result</th></tr>
 * <tr><td>unit</td><td>amplitude, unit</td><td>constant flux</td></tr>
 * <tr><td>bb</td><td>temperature</td><td>blackbody, 1 R☉ at 1 kpc</td></tr>
 * <tr><td>pl</td><td>reference wavelength, exponent, unit</td><td>power law</td></tr>
 * <tr><td>box</td><td>center, width</td><td>rectangular passband</td></tr>
 * <tr><td>spec</td><td>file</td><td>source spectrum from file</td></tr>
 * <tr><td>band</td><td>observation mode keywords</td><td>instrument passband</td></tr>
 * <tr><td>em</td><td>center, FWHM, integrated flux, unit</td><td>Gaussian emission line</td></tr>
 * <tr><td>icat</td><td>grid, T_eff, metallicity, log_g</td><td>interpolated catalog spectrum</td></tr>
 * <tr><td>rn</td><td>source, passband, level, unit</td><td>renormalized source</td></tr>
 * <tr><td>z</td><td>source or {@code null}, redshift</td><td>redshifted source</td></tr>
 * <tr><td>ebmvx</td><td>E(B−V), law</td><td>extinction curve</td></tr>
 * </table>
 *
 * Results other than {@code icat} are tagged {@code name(arg,...)} with numbers rendered as
 * doubles.
 */
public final class Interpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    /** Placeholder source meaning "no source": a flat spectrum. */
    public static final String NULL_SOURCE = "null";

    /** Warning key attached to spectra renormalized despite partial overlap. */
    public static final String FORCE_RENORM_WARNING = "force_renorm";

    static final String FORCE_RENORM_MESSAGE = "Renormalization exceeds the limit of the specified passband.";

    /** Function name → argument count; -1 accepts any count. */
    private static final Map<String, Integer> ARITY = Map.ofEntries(
            Map.entry("unit", 2),
            Map.entry("bb", 1),
            Map.entry("pl", 3),
            Map.entry("box", 2),
            Map.entry("spec", 1),
            Map.entry("band", -1),
            Map.entry("em", 4),
            Map.entry("icat", 4),
            Map.entry("rn", 4),
            Map.entry("z", 2),
            Map.entry("ebmvx", 2));

    private final SpectralResources resources;
    private final String source;

    /**
     * @param resources data access for files, modes and catalogs
     * @param source    expression text, used in error messages
     */
    public Interpreter(SpectralResources resources, String source) {
        this.resources = resources;
        this.source = source;
    }

    /**
     * Evaluates the tree and returns the resulting spectrum.
     *
     * @throws ParserException if the expression does not denote a spectrum, or uses an unknown
     *                         function, unit or law
     */
    public Spectrum interpret(AstNode root) {
        visit(root);
        Value result = coerce(root.value());
        LOG.debug("Interpreted '{}' as {}", source, describe(result));
        if (result instanceof Value.Source s) {
            return s.spectrum();
        }
        if (result instanceof Value.Element e) {
            return e.element();
        }
        throw new ParserException("Expression does not evaluate to a spectrum: " + source, source);
    }

    private void visit(AstNode node) {
        for (AstNode child : node.children()) {
            visit(child);
        }
        switch (node.kind()) {
            case INTEGER, FLOAT -> node.assign(new Value.Numeric(Double.parseDouble(node.attr())), node.attr());
            case IDENTIFIER -> node.assign(new Value.Text(node.attr()), node.attr());
            case FILELIST -> throw new ParserException("File lists cannot be evaluated: @" + node.attr(), source);
            case GROUP -> {
                AstNode inner = node.child(0);
                String text = inner.displayText() != null ? inner.displayText() : describe(inner.value());
                node.assign(coerce(inner.value()), "(" + text + ")");
            }
            case ARGLIST -> {
                AstNode left = node.child(0);
                AstNode right = node.child(1);
                List<Value> values = new ArrayList<>();
                if (left.value() instanceof Value.Arguments nested) {
                    values.addAll(nested.values());
                } else {
                    values.add(left.value());
                }
                values.add(right.value());
                String text = left.displayText() != null && right.displayText() != null
                        ? left.displayText() + "," + right.displayText()
                        : null;
                node.assign(new Value.Arguments(values), text);
            }
            case FACTOR -> node.assign(unary(node.attr(), node.child(0).value()), null);
            case EXPR, TERM -> node.assign(binary(node.attr(), node.child(0).value(), node.child(1).value()), null);
            case FUNCTION_CALL -> node.assign(call(node), null);
        }
    }

    private Value unary(String sign, Value operand) {
        Value value = coerce(operand);
        if ("+".equals(sign)) {
            return value;
        }
        if (value instanceof Value.Numeric n) {
            return new Value.Numeric(-n.value());
        }
        if (value instanceof Value.Source s) {
            return new Value.Source(s.spectrum().negate().withTag("-" + describe(value)));
        }
        if (value instanceof Value.Element e) {
            return new Value.Element(e.element().negate().withTag("-" + describe(value)));
        }
        throw new ParserException("Cannot negate " + kindOf(value) + " in: " + source, source);
    }

    private Value binary(String op, Value leftOperand, Value rightOperand) {
        Value left = coerce(leftOperand);
        Value right = "/".equals(op) ? rightOperand : coerce(rightOperand);
        Value result =
                switch (op) {
                    case "+" -> add(left, right);
                    case "-" -> subtract(left, right);
                    case "*" -> multiply(left, right);
                    case "/" -> divide(left, right);
                    default -> throw new IllegalStateException("Unknown operator: " + op);
                };
        if (result instanceof Value.Numeric) {
            return result;
        }
        return retag(result, describe(left) + " " + op + " " + describe(right));
    }

    private Value add(Value left, Value right) {
        if (left instanceof Value.Numeric a && right instanceof Value.Numeric b) {
            return new Value.Numeric(a.value() + b.value());
        }
        if (left instanceof Value.Source a && right instanceof Value.Source b) {
            return new Value.Source(a.spectrum().plus(b.spectrum()));
        }
        if (left instanceof Value.Element a && right instanceof Value.Element b) {
            return new Value.Element(a.element().plus(b.element()));
        }
        throw unsupported("add", left, right);
    }

    private Value subtract(Value left, Value right) {
        if (left instanceof Value.Numeric a && right instanceof Value.Numeric b) {
            return new Value.Numeric(a.value() - b.value());
        }
        if (left instanceof Value.Source a && right instanceof Value.Source b) {
            return new Value.Source(a.spectrum().minus(b.spectrum()));
        }
        if (left instanceof Value.Element a && right instanceof Value.Element b) {
            return new Value.Element(a.element().minus(b.element()));
        }
        throw unsupported("subtract", left, right);
    }

    private Value multiply(Value left, Value right) {
        if (left instanceof Value.Numeric a && right instanceof Value.Numeric b) {
            return new Value.Numeric(a.value() * b.value());
        }
        if (left instanceof Value.Source a && right instanceof Value.Element b) {
            return new Value.Source(a.spectrum().times(b.element()));
        }
        if (left instanceof Value.Element a && right instanceof Value.Source b) {
            return new Value.Source(a.element().times(b.spectrum()));
        }
        if (left instanceof Value.Element a && right instanceof Value.Element b) {
            return new Value.Element(a.element().times(b.element()));
        }
        if (left instanceof Value.Numeric n) {
            return scale(right, n.value(), left);
        }
        if (right instanceof Value.Numeric n) {
            return scale(left, n.value(), right);
        }
        throw unsupported("multiply", left, right);
    }

    private Value scale(Value spectrum, double factor, Value other) {
        if (spectrum instanceof Value.Source s) {
            return new Value.Source(s.spectrum().times(factor));
        }
        if (spectrum instanceof Value.Element e) {
            return new Value.Element(e.element().times(factor));
        }
        throw unsupported("multiply", spectrum, other);
    }

    private Value divide(Value left, Value right) {
        if (!(right instanceof Value.Numeric divisor)) {
            throw new ParserException("Divisor must be a number, got " + kindOf(right) + " in: " + source, source);
        }
        if (divisor.value() == 0.0) {
            throw new ParserException("Division by zero in: " + source, source);
        }
        if (left instanceof Value.Numeric n) {
            return new Value.Numeric(n.value() / divisor.value());
        }
        if (left instanceof Value.Source s) {
            return new Value.Source(s.spectrum().dividedBy(divisor.value()));
        }
        if (left instanceof Value.Element e) {
            return new Value.Element(e.element().dividedBy(divisor.value()));
        }
        throw unsupported("divide", left, right);
    }

    private Value call(AstNode node) {
        String name = node.attr();
        AstNode argsNode = node.child(1);
        List<Value> args = argsNode.value() instanceof Value.Arguments list ? list.values() : List.of(argsNode.value());

        Integer arity = ARITY.get(name);
        if (arity == null) {
            throw new ParserException("Unknown function: " + name, source);
        }
        if (arity >= 0 && args.size() != arity) {
            throw new ParserException(
                    String.format("Function %s expects %d argument(s), got %d in: %s", name, arity, args.size(), source),
                    source);
        }
        String tag = name + "(" + args.stream().map(this::describe).collect(Collectors.joining(",")) + ")";

        try {
            return switch (name) {
                case "unit" -> Value.of(SourceSpectrum.constFlux(number(args, 0, name), densityUnit(args, 1, name))
                        .withTag(tag));
                case "bb" -> Value.of(SourceSpectrum.blackbody(number(args, 0, name)).withTag(tag));
                case "pl" -> Value.of(SourceSpectrum.powerLaw(
                                number(args, 0, name), number(args, 1, name), densityUnit(args, 2, name))
                        .withTag(tag));
                case "box" -> Value.of(SpectralElement.box(number(args, 0, name), number(args, 1, name))
                        .withTag(tag));
                case "spec" -> Value.of(resources.loadSource(text(args, 0, name)).withTag(tag));
                case "band" -> band(argsNode, tag);
                case "em" -> Value.of(SourceSpectrum.gaussianLine(
                                number(args, 0, name),
                                number(args, 1, name),
                                number(args, 2, name),
                                densityUnit(args, 3, name))
                        .withTag(tag));
                case "icat" -> Value.of(resources.catalogSpectrum(
                        text(args, 0, name), number(args, 1, name), number(args, 2, name), number(args, 3, name)));
                case "rn" -> renormalize(args, tag);
                case "z" -> redshift(args, tag);
                case "ebmvx" -> extinction(args, tag);
                default -> throw new IllegalStateException("No implementation for function " + name);
            };
        } catch (IllegalArgumentException e) {
            throw new ParserException(name + ": " + e.getMessage(), e, source);
        }
    }

    private Value band(AstNode argsNode, String tag) {
        String keywords = argsNode.displayText();
        if (keywords == null) {
            throw new ParserException("band() takes plain keywords, got: " + argsNode.render(), source);
        }
        return Value.of(resources.band(keywords).withTag(tag));
    }

    private Value renormalize(List<Value> args, String tag) {
        SourceSpectrum spectrum = asSource(args.get(0), "rn");
        SpectralElement band = asElement(args.get(1), "rn");
        double level = number(args, 2, "rn");
        FluxUnit unit = unit(args, 3, "rn");
        SourceSpectrum vega = unit == FluxUnit.VEGAMAG ? resources.vega() : null;

        NormalizationResult result = spectrum.normalize(level, unit, band, false, vega, resources.area());
        return switch (result.type()) {
            case NORMALIZED -> Value.of(result.spectrum().withTag(tag));
            case PARTIAL_OVERLAP -> {
                LOG.warn("{}: {}", tag, FORCE_RENORM_MESSAGE);
                NormalizationResult forced = spectrum.normalize(level, unit, band, true, vega, resources.area());
                yield Value.of(forced.spectrum().withTag(tag).withWarning(FORCE_RENORM_WARNING, FORCE_RENORM_MESSAGE));
            }
            case DISJOINT -> throw new DisjointSpectrumException(
                    "Spectrum " + describe(args.get(0)) + " and passband " + describe(args.get(1)) + " are disjoint",
                    source);
        };
    }

    private Value redshift(List<Value> args, String tag) {
        Value first = args.get(0);
        double z = number(args, 1, "z");
        if (first instanceof Value.Text t && NULL_SOURCE.equals(t.text())) {
            return Value.of(SourceSpectrum.constFlux(1.0, FluxUnit.PHOTLAM).withTag(tag));
        }
        return Value.of(asSource(first, "z").redshift(z).withTag(tag));
    }

    private Value extinction(List<Value> args, String tag) {
        double ebv = number(args, 0, "ebmvx");
        String name = text(args, 1, "ebmvx");
        String law = ReddeningLaw.canonicalName(name)
                .orElseThrow(() -> new ParserException("Unrecognized reddening law: " + name, source));
        if (!law.equals(name)) {
            LOG.info("{} uses {} reddening law.", name, law);
        }
        return Value.of(resources.extinction(law, ebv).withTag(tag));
    }

    private Value coerce(Value value) {
        if (value instanceof Value.Text t) {
            return Value.of(resources.load(t.text()).withTag(t.text()));
        }
        return value;
    }

    private SourceSpectrum asSource(Value value, String function) {
        if (value instanceof Value.Source s) {
            return s.spectrum();
        }
        if (value instanceof Value.Text t) {
            return resources.loadSource(t.text()).withTag(t.text());
        }
        throw new ParserException(
                function + " expects a source spectrum, got " + kindOf(value) + " in: " + source, source);
    }

    private SpectralElement asElement(Value value, String function) {
        if (value instanceof Value.Element e) {
            return e.element();
        }
        if (value instanceof Value.Text t) {
            return resources.loadElement(t.text()).withTag(t.text());
        }
        throw new ParserException(function + " expects a passband, got " + kindOf(value) + " in: " + source, source);
    }

    private double number(List<Value> args, int index, String function) {
        if (args.get(index) instanceof Value.Numeric n) {
            return n.value();
        }
        throw new ParserException(
                String.format("Argument %d of %s must be a number, got %s in: %s",
                        index + 1, function, kindOf(args.get(index)), source),
                source);
    }

    private String text(List<Value> args, int index, String function) {
        if (args.get(index) instanceof Value.Text t) {
            return t.text();
        }
        throw new ParserException(
                String.format("Argument %d of %s must be a name, got %s in: %s",
                        index + 1, function, kindOf(args.get(index)), source),
                source);
    }

    private FluxUnit unit(List<Value> args, int index, String function) {
        Value value = args.get(index);
        String name = value instanceof Value.Text t ? t.text() : describe(value);
        return FluxUnit.fromName(name)
                .orElseThrow(() -> new ParserException("Unrecognized unit: " + name + " in " + function, source));
    }

    private FluxUnit densityUnit(List<Value> args, int index, String function) {
        FluxUnit unit = unit(args, index, function);
        if (!unit.isDensity()) {
            throw new ParserException("Unit " + unit + " is not supported by " + function + "()", source);
        }
        return unit;
    }

    private Value retag(Value value, String tag) {
        if (value instanceof Value.Source s) {
            return new Value.Source(s.spectrum().withTag(tag));
        }
        if (value instanceof Value.Element e) {
            return new Value.Element(e.element().withTag(tag));
        }
        return value;
    }

    private ParserException unsupported(String operation, Value left, Value right) {
        return new ParserException(
                String.format("Cannot %s %s and %s in: %s", operation, kindOf(left), kindOf(right), source), source);
    }

    private String describe(Value value) {
        if (value instanceof Value.Numeric n) {
            return Formats.number(n.value());
        }
        if (value instanceof Value.Text t) {
            return t.text();
        }
        if (value instanceof Value.Arguments a) {
            return a.values().stream().map(this::describe).collect(Collectors.joining(","));
        }
        Spectrum spectrum = value instanceof Value.Source s ? s.spectrum() : ((Value.Element) value).element();
        return spectrum.tag() != null ? spectrum.tag() : spectrum.toString();
    }

    private static String kindOf(Value value) {
        if (value instanceof Value.Numeric) {
            return "a number";
        }
        if (value instanceof Value.Text) {
            return "a name";
        }
        if (value instanceof Value.Source) {
            return "a source spectrum";
        }
        if (value instanceof Value.Element) {
            return "a passband";
        }
        return "an argument list";
    }
}
