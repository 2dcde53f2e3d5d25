package com.example.docx2md.service.math;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolTableTest {

    @Test
    void greekLettersAndRelationsMapToCommands() {
        assertThat(SymbolTable.lookup("α")).contains("\\alpha");
        assertThat(SymbolTable.lookup("≥")).contains("\\geq");
        assertThat(SymbolTable.lookup("∞")).contains("\\infty");
        assertThat(SymbolTable.lookup("×")).contains("\\times");
    }

    @Test
    void plainCharactersHaveNoEntry() {
        assertThat(SymbolTable.lookup("x")).isEmpty();
        assertThat(SymbolTable.lookup("1")).isEmpty();
        assertThat(SymbolTable.lookup("ab")).isEmpty();
        assertThat(SymbolTable.lookup((String) null)).isEmpty();
    }

    @Test
    void latexSpecialCharactersAreEscaped() {
        assertThat(SymbolTable.lookup("{")).contains("\\{");
        assertThat(SymbolTable.lookup("%")).contains("\\%");
        assertThat(SymbolTable.lookup("$")).contains("\\$");
    }

    @Test
    void invisibleOperatorsAreDropped() {
        assertThat(SymbolTable.lookup(0x2061)).contains("");
        assertThat(SymbolTable.lookup(0x200B)).contains("");
    }

    @Test
    void naryOperatorDefaultsToIntegral() {
        assertThat(SymbolTable.operator(null)).isEqualTo("\\int");
        assertThat(SymbolTable.operator("")).isEqualTo("\\int");
        assertThat(SymbolTable.operator("∑")).isEqualTo("\\sum");
        assertThat(SymbolTable.operator("∏")).isEqualTo("\\prod");
    }

    @Test
    void accentDefaultsToHat() {
        assertThat(SymbolTable.accent(null)).contains("\\hat");
        assertThat(SymbolTable.accent("\u20D7")).contains("\\vec");
        assertThat(SymbolTable.accent("★")).isEmpty();
    }

    @Test
    void delimiters() {
        assertThat(SymbolTable.delimiter("{")).isEqualTo("\\{");
        assertThat(SymbolTable.delimiter("⟨")).isEqualTo("\\langle");
        assertThat(SymbolTable.delimiter("")).isEqualTo(".");
        assertThat(SymbolTable.delimiter(null)).isEqualTo(".");
        assertThat(SymbolTable.delimiter("[")).isEqualTo("[");
    }

    @Test
    void knownCommandsIncludeTableValuesAndFunctionNames() {
        assertThat(SymbolTable.isKnownCommand("geq")).isTrue();
        assertThat(SymbolTable.isKnownCommand("sum")).isTrue();
        assertThat(SymbolTable.isKnownCommand("frac")).isTrue();
        assertThat(SymbolTable.isKnownCommand("sin")).isTrue();
        assertThat(SymbolTable.isKnownCommand("geqx")).isFalse();
    }

    @Test
    void functionNames() {
        assertThat(SymbolTable.isFunction("sin")).isTrue();
        assertThat(SymbolTable.isFunction("lim")).isTrue();
        assertThat(SymbolTable.isLimitFunction("lim")).isTrue();
        assertThat(SymbolTable.isLimitFunction("sin")).isFalse();
        assertThat(SymbolTable.isFunction("foo")).isFalse();
    }
}
