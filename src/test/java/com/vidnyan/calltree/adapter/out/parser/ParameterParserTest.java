package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.domain.model.Parameter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParameterParserTest {

    @Test
    void parse_VoidOrEmpty_ShouldGiveNoParameters() {
        assertTrue(ParameterParser.parse("void").isEmpty());
        assertTrue(ParameterParser.parse("").isEmpty());
        assertTrue(ParameterParser.parse(null).isEmpty());
    }

    @Test
    void parse_AutosarWrappers_ShouldCarryMemoryClass() {
        List<Parameter> params = ParameterParser.parse(
                "VAR(uint16, AUTOMATIC) id, P2VAR(uint8, AUTOMATIC, COM_APPL_DATA) buf, "
                        + "CONSTP2CONST(Com_ConfigType, AUTOMATIC, COM_CONST) cfg, CONST(uint8, AUTOMATIC) mode");

        assertEquals(List.of(
                new Parameter("id", "uint16", false, false, Parameter.Wrapper.VAR, "AUTOMATIC"),
                new Parameter("buf", "uint8", true, false, Parameter.Wrapper.P2VAR, "COM_APPL_DATA"),
                new Parameter("cfg", "Com_ConfigType", true, true, Parameter.Wrapper.P2CONST, "COM_CONST"),
                new Parameter("mode", "uint8", false, true, Parameter.Wrapper.CONST, "AUTOMATIC")),
                params);
    }

    @Test
    void parse_FunctionPointerMacro_ShouldUseLastArgumentAsName() {
        List<Parameter> params = ParameterParser.parse("P2FUNC(void, COM_CODE, callback)(uint8 x)");

        assertEquals(1, params.size());
        assertEquals("callback", params.get(0).name());
        assertEquals("void (*)(uint8 x)", params.get(0).type());
        assertTrue(params.get(0).pointer());
    }

    @Test
    void parse_WrappedFunctionPointer_ShouldTakeNameFromParentheses() {
        Parameter param = ParameterParser.parse("VAR(void, AUTOMATIC) (*notify)(uint8 id)").get(0);

        assertEquals("notify", param.name());
        assertEquals("void (*)(uint8 id)", param.type());
        assertEquals(Parameter.Wrapper.VAR, param.wrapper());
        assertEquals("AUTOMATIC", param.memoryClass());
    }

    @Test
    void parse_PlainDeclarations_ShouldSplitTypeAndName() {
        List<Parameter> params = ParameterParser.parse(
                "const uint8 *data, uint8 buffer[8], unsigned long count, void (*cb)(int), uint8");

        assertEquals(List.of(
                Parameter.plain("data", "uint8", true, true),
                Parameter.plain("buffer", "uint8", true, false),
                Parameter.plain("count", "unsigned long", false, false),
                Parameter.plain("cb", "void (*)(int)", true, false),
                Parameter.plain("", "uint8", false, false)),
                params);
    }

    @Test
    void splitTopLevel_ShouldIgnoreNestedCommas() {
        assertEquals(List.of("P2VAR(a, b, c) x", " int (*f)(int, int)", " y[2]"),
                ParameterParser.splitTopLevel("P2VAR(a, b, c) x, int (*f)(int, int), y[2]"));
    }

    @Test
    void format_ShouldRenderDeclaration() {
        Parameter param = new Parameter("buf", "uint8", true, true, Parameter.Wrapper.P2CONST, "COM_APPL_DATA");

        assertEquals("const uint8* buf [COM_APPL_DATA]", param.format());
    }
}
