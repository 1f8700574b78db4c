package io.synphot.core.lang;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.withinPercentage;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.synphot.core.error.DisjointSpectrumException;
import io.synphot.core.error.ErrorKind;
import io.synphot.core.error.ParserException;
import io.synphot.core.spectrum.FluxUnit;
import io.synphot.core.spectrum.ReddeningLaw;
import io.synphot.core.spectrum.SourceSpectrum;
import io.synphot.core.spectrum.SpectralElement;
import io.synphot.core.spectrum.Spectrum;
import io.synphot.core.spi.SpectralResources;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

class InterpreterTest {

    private static final SourceSpectrum FLAT =
            SourceSpectrum.tabulated(new double[] {3000, 8000}, new double[] {2.0, 2.0});

    private SpectralResources resources;

    @BeforeEach
    void setUp() {
        resources = mock(SpectralResources.class);
        when(resources.area()).thenReturn(45238.93416);
    }

    private Spectrum interpret(String expression) {
        return new Interpreter(resources, expression).interpret(Parser.parse(expression));
    }

    @Nested
    @DisplayName("built-in functions")
    class Functions {

        @Test
        void unitIsTaggedWithDoubles() {
            Spectrum sp = interpret("unit(1, flam)");

            assertThat(sp).isInstanceOf(SourceSpectrum.class);
            assertThat(sp.tag()).isEqualTo("unit(1.0,flam)");
            assertThat(sp.evaluate(5000)).isCloseTo(FluxUnit.FLAM.toPhotlam(1.0, 5000), withinPercentage(1e-9));
        }

        @Test
        void blackbody() {
            Spectrum sp = interpret("bb(5000)");

            assertThat(sp.tag()).isEqualTo("bb(5000.0)");
            assertThat(sp.evaluate(5000)).isPositive();
        }

        @Test
        void boxIsAPassband() {
            Spectrum sp = interpret("box(5000,10)");

            assertThat(sp).isInstanceOf(SpectralElement.class);
            assertThat(sp.tag()).isEqualTo("box(5000.0,10.0)");
            assertThat(sp.evaluate(5000)).isEqualTo(1.0);
            assertThat(sp.evaluate(5100)).isZero();
        }

        @Test
        void powerLaw() {
            Spectrum sp = interpret("pl(5000,-2,photlam)");

            assertThat(sp.tag()).isEqualTo("pl(5000.0,-2.0,photlam)");
            assertThat(sp.evaluate(5000)).isCloseTo(1.0, withinPercentage(1e-9));
            assertThat(sp.evaluate(10000)).isCloseTo(0.25, withinPercentage(1e-9));
        }

        @Test
        void emissionLine() {
            Spectrum sp = interpret("em(6563,10,1,photlam)");

            assertThat(sp.tag()).isEqualTo("em(6563.0,10.0,1.0,photlam)");
            assertThat(sp.integrate()).isCloseTo(1.0, withinPercentage(1.0));
        }

        @Test
        void specLoadsASourceFromItsFile() {
            when(resources.loadSource("crcalspec$flat.csv")).thenReturn(FLAT);

            Spectrum sp = interpret("spec(crcalspec$flat.csv)");

            assertThat(sp.tag()).isEqualTo("spec(crcalspec$flat.csv)");
            assertThat(sp.evaluate(5000)).isEqualTo(2.0);
        }

        @Test
        void bandPassesTheRawKeywordList() {
            when(resources.band("wfc,f555w,mjd#54000")).thenReturn(SpectralElement.box(5500, 1000));

            Spectrum sp = interpret("band(wfc,f555w,mjd#54000)");

            verify(resources).band("wfc,f555w,mjd#54000");
            assertThat(sp.tag()).isEqualTo("band(wfc,f555w,mjd#54000)");
        }

        @Test
        void catalogSpectrumKeepsItsOwnTag() {
            when(resources.catalogSpectrum("ck04models", 5000, 0.0, 4.5))
                    .thenReturn(FLAT.withTag("ck04models(T_eff=5000,metallicity=0,log_g=4.5)"));

            Spectrum sp = interpret("icat(ck04models,5000,0.0,4.5)");

            assertThat(sp.tag()).isEqualTo("ck04models(T_eff=5000,metallicity=0,log_g=4.5)");
        }

        @Test
        void redshiftOfNullIsAFlatSpectrum() {
            Spectrum sp = interpret("z(null,0.1)");

            assertThat(sp.tag()).isEqualTo("z(null,0.1)");
            assertThat(sp.evaluate(4000)).isEqualTo(1.0);
            assertThat(sp.evaluate(9000)).isEqualTo(1.0);
        }

        @Test
        void redshiftOfASource() {
            Spectrum sp = interpret("z(bb(5000),0.5)");

            assertThat(sp).isInstanceOf(SourceSpectrum.class);
            assertThat(((SourceSpectrum) sp).z()).isEqualTo(0.5);
            assertThat(sp.tag()).isEqualTo("z(bb(5000.0),0.5)");
        }
    }

    @Nested
    @DisplayName("renormalization")
    class Renormalization {

        @Test
        void fullOverlapMatchesTheRequestedLevel() {
            Spectrum sp = interpret("rn(bb(5000),box(5000,10),17,abmag)");

            assertThat(sp.tag()).isEqualTo("rn(bb(5000.0),box(5000.0,10.0),17.0,abmag)");
            assertThat(sp.warnings()).isEmpty();
            SpectralElement band = SpectralElement.box(5000, 10);
            double expected = SourceSpectrum.constFlux(17, FluxUnit.ABMAG).times(band).integrate();
            assertThat(((SourceSpectrum) sp).times(band).integrate()).isCloseTo(expected, withinPercentage(1e-6));
        }

        @Test
        void vegamagUsesTheVegaSpectrum() {
            when(resources.vega()).thenReturn(FLAT);

            Spectrum sp = interpret("rn(bb(5000),box(5000,10),0,vegamag)");

            verify(resources).vega();
            SpectralElement band = SpectralElement.box(5000, 10);
            assertThat(((SourceSpectrum) sp).times(band).integrate())
                    .isCloseTo(FLAT.times(band).integrate(), withinPercentage(1e-6));
        }

        @Test
        void countsDivideByTheCollectingArea() {
            Spectrum sp = interpret("rn(bb(5000),box(5000,10),1000,counts)");

            SpectralElement band = SpectralElement.box(5000, 10);
            assertThat(((SourceSpectrum) sp).times(band).integrate())
                    .isCloseTo(1000 / 45238.93416, withinPercentage(1e-6));
            verify(resources, never()).vega();
        }

        @Test
        void partialOverlapIsForcedWithAWarning() {
            when(resources.loadSource("flat.csv")).thenReturn(FLAT);
            ListAppender<ILoggingEvent> appender = attach(Interpreter.class);
            try {
                Spectrum sp = interpret("rn(spec(flat.csv),box(7990,100),10,photlam)");

                assertThat(sp.warnings())
                        .containsEntry(Interpreter.FORCE_RENORM_WARNING, Interpreter.FORCE_RENORM_MESSAGE);
                assertThat(appender.list)
                        .anyMatch(e -> e.getLevel() == Level.WARN
                                && e.getFormattedMessage().contains(Interpreter.FORCE_RENORM_MESSAGE));
            } finally {
                detach(Interpreter.class, appender);
            }
        }

        @Test
        void disjointSpectraFail() {
            when(resources.loadSource("flat.csv")).thenReturn(FLAT);

            assertThatThrownBy(() -> interpret("rn(spec(flat.csv),box(20000,100),10,photlam)"))
                    .isInstanceOf(DisjointSpectrumException.class)
                    .satisfies(e -> assertThat(((DisjointSpectrumException) e).kind())
                            .isEqualTo(ErrorKind.DISJOINT_OVERLAP));
        }
    }

    @Nested
    @DisplayName("operators")
    class Operators {

        @Test
        void scalingKeepsTheSpectrumKind() {
            Spectrum sp = interpret("bb(5000) * 2");

            assertThat(sp).isInstanceOf(SourceSpectrum.class);
            assertThat(sp.tag()).isEqualTo("bb(5000.0) * 2.0");
            assertThat(sp.evaluate(5000))
                    .isCloseTo(2 * SourceSpectrum.blackbody(5000).evaluate(5000), withinPercentage(1e-9));
        }

        @Test
        void numericSubexpressionsFold() {
            Spectrum sp = interpret("bb(5000) * (2 + 3)");

            assertThat(sp.evaluate(5000))
                    .isCloseTo(5 * SourceSpectrum.blackbody(5000).evaluate(5000), withinPercentage(1e-9));
        }

        @Test
        void identifiersAreLoadedWhenAnOperatorNeedsThem() {
            when(resources.load("flat.csv")).thenReturn(FLAT);

            Spectrum sp = interpret("flat.csv * box(5000,10)");

            assertThat(sp).isInstanceOf(SourceSpectrum.class);
            assertThat(sp.tag()).isEqualTo("flat.csv * box(5000.0,10.0)");
            assertThat(sp.evaluate(5000)).isEqualTo(2.0);
        }

        @Test
        void bareIdentifierIsLoaded() {
            when(resources.load(anyString())).thenReturn(FLAT);

            assertThat(interpret("flat.csv").tag()).isEqualTo("flat.csv");
        }

        @Test
        void divisionByANumber() {
            Spectrum sp = interpret("bb(5000) / 2");

            assertThat(sp.evaluate(5000))
                    .isCloseTo(SourceSpectrum.blackbody(5000).evaluate(5000) / 2, withinPercentage(1e-9));
        }

        @Test
        void divisionBySpectrumIsRejected() {
            assertThatThrownBy(() -> interpret("bb(5000) / box(5000,10)"))
                    .isInstanceOf(ParserException.class)
                    .hasMessageStartingWith("Divisor must be a number");
        }

        @Test
        void divisionByZeroIsRejected() {
            assertThatThrownBy(() -> interpret("bb(5000) / 0"))
                    .isInstanceOf(ParserException.class)
                    .hasMessageStartingWith("Division by zero");
        }

        @Test
        void negation() {
            Spectrum sp = interpret("-box(5000,10)");

            assertThat(sp.evaluate(5000)).isEqualTo(-1.0);
        }

        @Test
        void addingSourceAndPassbandIsRejected() {
            assertThatThrownBy(() -> interpret("bb(5000) + box(5000,10)"))
                    .isInstanceOf(ParserException.class)
                    .hasMessageStartingWith("Cannot add a source spectrum and a passband");
        }
    }

    @Nested
    @DisplayName("reddening")
    class Reddening {

        @Test
        void aliasIsReplacedAndLogged() {
            when(resources.extinction("mwavg", 0.2))
                    .thenReturn(new ReddeningLaw("mwavg", new double[] {3000, 8000}, new double[] {5, 1})
                            .extinctionCurve(0.2));
            ListAppender<ILoggingEvent> appender = attach(Interpreter.class);
            try {
                Spectrum sp = interpret("ebmvx(0.2,gal3)");

                verify(resources).extinction("mwavg", 0.2);
                assertThat(sp.tag()).isEqualTo("ebmvx(0.2,gal3)");
                assertThat(sp.evaluate(3000)).isCloseTo(Math.pow(10, -0.4 * 0.2 * 5), withinPercentage(1e-9));
                assertThat(appender.list)
                        .extracting(ILoggingEvent::getFormattedMessage)
                        .contains("gal3 uses mwavg reddening law.");
            } finally {
                detach(Interpreter.class, appender);
            }
        }

        @Test
        void unknownLaw() {
            assertThatThrownBy(() -> interpret("ebmvx(0.1,foo)"))
                    .isInstanceOf(ParserException.class)
                    .hasMessage("Unrecognized reddening law: foo");
        }
    }

    @Nested
    @DisplayName("tags as expressions")
    class TagsReparse {

        @BeforeEach
        void stubResources() {
            when(resources.band(anyString())).thenReturn(SpectralElement.box(5500, 1000));
            when(resources.extinction(anyString(), anyDouble()))
                    .thenReturn(new ReddeningLaw("mwavg", new double[] {3000, 8000}, new double[] {5, 1})
                            .extinctionCurve(0.2));
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "rn(bb(5000),box(5000,10),17,abmag)",
            "rn(pl(5000,-2,flam),band(wfc,f555w,mjd#54000),0.5,counts)",
            "ebmvx(0.2,gal3)",
            "ebmvx(0.1,smcbar) * bb(10000)",
            "z(em(6563,10,1,photlam),0.5)",
            "band(hrc,f555w,mjd#57500) * 2"
        })
        void tagParsesBackToTheSameCalls(String expression) {
            Spectrum sp = interpret(expression);

            assertThat(shape(Parser.parse(sp.tag()))).isEqualTo(shape(Parser.parse(expression)));
        }

        @Test
        void catalogGridTagDescribesTheParametersByName() {
            when(resources.catalogSpectrum("ck04models", 5000, 0.0, 4.5))
                    .thenReturn(FLAT.withTag("ck04models(T_eff=5000,metallicity=0,log_g=4.5)"));

            assertThat(interpret("icat(ck04models,5000,0.0,4.5)").tag())
                    .startsWith("ck04models(")
                    .containsSubsequence("T_eff=5000", "metallicity=0", "log_g=4.5");
        }

        /** Function names, argument order and operators, with numbers compared by value. */
        private String shape(AstNode node) {
            switch (node.kind()) {
                case EXPR:
                case TERM:
                    return shape(node.child(0)) + node.attr() + shape(node.child(1));
                case FACTOR:
                    return node.attr() + shape(node.child(0));
                case GROUP:
                    return "(" + shape(node.child(0)) + ")";
                case FUNCTION_CALL:
                    return node.attr() + "(" + shape(node.child(1)) + ")";
                case ARGLIST:
                    return shape(node.child(0)) + "," + shape(node.child(1));
                case INTEGER:
                case FLOAT:
                    return Double.toString(Double.parseDouble(node.attr()));
                default:
                    return node.attr();
            }
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void unknownFunction() {
            assertThatThrownBy(() -> interpret("foo(1)"))
                    .isInstanceOf(ParserException.class)
                    .hasMessage("Unknown function: foo");
        }

        @Test
        void unknownUnit() {
            assertThatThrownBy(() -> interpret("unit(1,nm)"))
                    .isInstanceOf(ParserException.class)
                    .hasMessage("Unrecognized unit: nm in unit");
        }

        @Test
        void magnitudeSystemsWithoutADensityAreRejectedByUnit() {
            assertThatThrownBy(() -> interpret("unit(1,vegamag)"))
                    .isInstanceOf(ParserException.class)
                    .hasMessage("Unit vegamag is not supported by unit()");
        }

        @Test
        void wrongArgumentCount() {
            assertThatThrownBy(() -> interpret("bb(1,2)"))
                    .isInstanceOf(ParserException.class)
                    .hasMessage("Function bb expects 1 argument(s), got 2 in: bb(1,2)");
        }

        @Test
        void bareNumberIsNotASpectrum() {
            assertThatThrownBy(() -> interpret("5"))
                    .isInstanceOf(ParserException.class)
                    .hasMessage("Expression does not evaluate to a spectrum: 5");
        }

        @Test
        void fileListsCannotBeEvaluated() {
            assertThatThrownBy(() -> interpret("@targets"))
                    .isInstanceOf(ParserException.class)
                    .hasMessage("File lists cannot be evaluated: @targets");
        }
    }

    private static ListAppender<ILoggingEvent> attach(Class<?> type) {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        ((Logger) LoggerFactory.getLogger(type)).addAppender(appender);
        return appender;
    }

    private static void detach(Class<?> type, ListAppender<ILoggingEvent> appender) {
        ((Logger) LoggerFactory.getLogger(type)).detachAppender(appender);
        appender.stop();
    }
}
