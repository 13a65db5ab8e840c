package com.spinemlgen.core;

import com.spinemlgen.core.TranslationException.ConfigurationException;
import com.spinemlgen.core.TranslationException.UnsupportedFeatureException;
import com.spinemlgen.core.models.ModelTranslator;
import com.spinemlgen.core.models.NeuronModel;
import com.spinemlgen.core.reader.ModelVariable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NeuronModelTest {

    private final ModelTranslator translator = new ModelTranslator();

    @Test
    void singleRegimeSimCodeHasNoRegimeGuard() {
        NeuronModel model = translator.translateNeuron(Fixtures.model("LeakyIntegrateAndFire.xml"), Set.of());

        assertEquals("""
                if($(V) > $(V_thresh)) {
                    $(V) = $(V_reset);
                }
                $(V) += DT * ((($(Isyn)) / $(C)) + ($(V_rest) - $(V)) / $(tau));
                """, model.getSimCode());
        assertEquals("($(V) > $(V_thresh))", model.getThresholdConditionCode());
        assertFalse(model.hasMultipleRegimes());
        assertEquals(List.of(ModelVariable.scalar("V")), model.getVars());
    }

    @Test
    void refractoryNeuronSwitchesRegimes() {
        NeuronModel model = translator.translateNeuron(Fixtures.model("RefractoryLIF.xml"), Set.of());

        assertEquals("""
                if($(_regimeID) == 0) {
                    if($(V) > $(V_thresh)) {
                        $(V) = $(V_reset);
                        $(t_ref) = 0;
                        $(_regimeID) = 1;
                    }
                    $(V) += DT * (($(Isyn) + ($(V_rest) - $(V)) * $(g_L)) / $(C));
                }
                else if($(_regimeID) == 1) {
                    if($(t_ref) > $(tau_ref)) {
                        $(_regimeID) = 0;
                    }
                    $(t_ref) += DT * (1);
                }
                """, model.getSimCode());
        assertEquals("($(_regimeID) == 0 && ($(V) > $(V_thresh)))", model.getThresholdConditionCode());
        assertEquals(List.of(
                ModelVariable.scalar("V"),
                ModelVariable.scalar("t_ref"),
                new ModelVariable("_regimeID", ModelVariable.UNSIGNED_INT)), model.getVars());
        assertTrue(model.hasMultipleRegimes());
    }

    @Test
    void variableParametersAreWrappedLikeVariables() {
        NeuronModel model = translator.translateNeuron(Fixtures.model("LeakyIntegrateAndFire.xml"), Set.of("tau"));

        assertEquals(List.of("C", "V_thresh", "V_rest", "V_reset"), model.getParamNames());
        assertEquals(List.of("V", "tau"), model.getVarNames());
        assertTrue(model.getSimCode().contains("/ $(tau));"));
    }

    @Test
    void everySpikingConditionJoinsTheThreshold(@TempDir Path tmp) throws Exception {
        Path file = Fixtures.component(tmp, """
                <ComponentClass name="Burst" type="neuron_body">
                    <Dynamics>
                        <Regime name="quiet">
                            <OnCondition target_regime="bursting">
                                <EventOut port="spike"/>
                                <Trigger><MathInline>V &gt; a</MathInline></Trigger>
                            </OnCondition>
                        </Regime>
                        <Regime name="bursting">
                            <OnCondition target_regime="quiet">
                                <EventOut port="spike"/>
                                <Trigger><MathInline>V &gt; b</MathInline></Trigger>
                            </OnCondition>
                            <OnCondition target_regime="quiet">
                                <EventOut port="other"/>
                                <Trigger><MathInline>V &lt; a</MathInline></Trigger>
                            </OnCondition>
                        </Regime>
                        <StateVariable name="V"/>
                    </Dynamics>
                    <Parameter name="a"/>
                    <Parameter name="b"/>
                </ComponentClass>
                """);
        NeuronModel model = translator.translateNeuron(file, Set.of());

        assertEquals("($(_regimeID) == 0 && ($(V) > $(a))) || ($(_regimeID) == 1 && ($(V) > $(b)))",
                model.getThresholdConditionCode());
    }

    @Test
    void spikePortIsConfigurable(@TempDir Path tmp) throws Exception {
        Path file = Fixtures.component(tmp, """
                <ComponentClass name="Custom" type="neuron_body">
                    <Dynamics>
                        <Regime name="r">
                            <OnCondition target_regime="r">
                                <EventOut port="fire"/>
                                <Trigger><MathInline>V &gt; 1</MathInline></Trigger>
                            </OnCondition>
                        </Regime>
                        <StateVariable name="V"/>
                    </Dynamics>
                </ComponentClass>
                """);

        assertEquals("", translator.translateNeuron(file, Set.of()).getThresholdConditionCode());
        assertEquals("($(V) > 1)",
                new ModelTranslator(TranslationListener.NONE, "fire").translateNeuron(file, Set.of())
                        .getThresholdConditionCode());
    }

    @Test
    void analogReceivePortReadsSynapticInput(@TempDir Path tmp) throws Exception {
        Path file = Fixtures.component(tmp, """
                <ComponentClass name="Passive" type="neuron_body">
                    <Dynamics>
                        <Regime name="r">
                            <TimeDerivative variable="V"><MathInline>I_in - V</MathInline></TimeDerivative>
                        </Regime>
                        <StateVariable name="V"/>
                    </Dynamics>
                    <AnalogReceivePort name="I_in"/>
                </ComponentClass>
                """);

        assertEquals("$(V) += DT * ($(Isyn) - $(V));\n", translator.translateNeuron(file, Set.of()).getSimCode());
    }

    @Test
    void onEventInNeuronIsUnsupported(@TempDir Path tmp) throws Exception {
        Path file = Fixtures.component(tmp, """
                <ComponentClass name="Listener" type="neuron_body">
                    <Dynamics>
                        <Regime name="r">
                            <OnEvent src_port="in" target_regime="r"/>
                        </Regime>
                    </Dynamics>
                </ComponentClass>
                """);
        UnsupportedFeatureException ex = assertThrows(UnsupportedFeatureException.class,
                () -> translator.translateNeuron(file, Set.of()));
        assertTrue(ex.getMessage().contains("OnEvent"));
    }

    @Test
    void conditionWithoutTriggerIsConfigurationError(@TempDir Path tmp) throws Exception {
        Path file = Fixtures.component(tmp, """
                <ComponentClass name="NoTrigger" type="neuron_body">
                    <Dynamics>
                        <Regime name="r">
                            <OnCondition target_regime="r"/>
                        </Regime>
                    </Dynamics>
                </ComponentClass>
                """);
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> translator.translateNeuron(file, Set.of()));
        assertTrue(ex.getMessage().contains("trigger"));
    }

    @Test
    void translationIsDeterministic() {
        NeuronModel a = translator.translateNeuron(Fixtures.model("RefractoryLIF.xml"), Set.of("g_L"));
        NeuronModel b = new ModelTranslator().translateNeuron(Fixtures.model("RefractoryLIF.xml"), Set.of("g_L"));

        assertEquals(a.getCodeBuffers(), b.getCodeBuffers());
        assertEquals(a.getVars(), b.getVars());
        assertEquals(a.getParamNames(), b.getParamNames());
    }

    @Test
    void wrappingIsNotReappliedToFinishedCode() {
        NeuronModel model = translator.translateNeuron(Fixtures.model("RefractoryLIF.xml"), Set.of());

        assertFalse(model.getSimCode().contains("$($("));
        assertFalse(model.getThresholdConditionCode().contains("$($("));
    }
}
